package com.distributedraft.common.util;

import com.distributedraft.common.dto.AppendEntriesRequest;
import com.distributedraft.common.dto.RaftLogEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonUtilsTest {

    @Test
    void testCommandIsBase64OnTheWire() {
        RaftLogEntry entry = JsonUtils.fromJson(
                "{\"index\":3,\"term\":2,\"command\":\"c2V0IHg9MQ==\"}", RaftLogEntry.class);

        assertEquals(3, entry.getIndex());
        assertEquals("set x=1", new String(entry.getCommand(), StandardCharsets.UTF_8));
    }

    @Test
    void testHeartbeatFlagIsNotSerialized() throws Exception {
        AppendEntriesRequest request = AppendEntriesRequest.builder()
                .term(1)
                .leaderId(1)
                .entries(List.of())
                .build();

        JsonNode node = JsonUtils.readTree(new ObjectMapper().writeValueAsString(request));

        assertFalse(node.has("heartbeat"));
        assertTrue(node.get("entries").isArray());
    }

    @Test
    void testUnknownPropertiesAreIgnored() {
        AppendEntriesRequest request = JsonUtils.fromJson(
                "{\"term\":4,\"leaderId\":2,\"prevIndex\":1,\"commitIndex\":1,\"extra\":true}",
                AppendEntriesRequest.class);

        assertEquals(4, request.getTerm());
        assertTrue(request.isHeartbeat());
    }

    @Test
    void testInvalidJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> JsonUtils.fromJson("{", AppendEntriesRequest.class));
    }
}
