package com.distributedraft.cli.utils;

import com.distributedraft.common.dto.SubmitCommandResponse;
import com.distributedraft.common.exception.ErrorCode;
import com.distributedraft.common.exception.RaftException;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the client against a stub node served by the JDK HTTP server
 */
public class NodeClientTest {

    private HttpServer server;
    private NodeClient client;
    private final AtomicReference<String> lastJoinBody = new AtomicReference<>();
    private final AtomicBoolean leader = new AtomicBoolean(false);

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/v1/raft/status", exchange -> respond(exchange, 200,
                "{\"nodeId\":2,\"currentTerm\":4,\"role\":\"LEADER\",\"leader\":true,\"leaderId\":2,\"peers\":[]}"));
        server.createContext("/api/v1/raft/join", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            lastJoinBody.set(body);
            if (body.contains(":")) {
                respond(exchange, 200, "");
            } else {
                respond(exchange, 400, "{\"errorCode\":1003,\"errorType\":\"INVALID_ADDRESS\","
                        + "\"message\":\"Not a valid host:port address: '" + body + "'\"}");
            }
        });
        server.createContext("/api/v1/raft/commands", exchange -> {
            exchange.getRequestBody().readAllBytes();
            if (leader.get()) {
                respond(exchange, 200, "{\"index\":3,\"term\":2}");
            } else {
                respond(exchange, 503, "{\"errorCode\":2001,\"errorType\":\"NOT_LEADER\","
                        + "\"message\":\"Node 2 is not the leader\"}");
            }
        });
        server.start();

        client = new NodeClient("127.0.0.1:" + server.getAddress().getPort());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    @Test
    void testBaseUrlNormalization() {
        assertEquals("http://localhost:8081", new NodeClient("localhost:8081").getBaseUrl());
        assertEquals("http://localhost:8081", new NodeClient("http://localhost:8081/").getBaseUrl());
    }

    @Test
    void testGetStatus() throws IOException {
        JsonNode status = client.getStatus();

        assertEquals(2, status.get("nodeId").asInt());
        assertEquals(4, status.get("currentTerm").asLong());
        assertTrue(status.get("leader").asBoolean());
    }

    @Test
    void testJoinSendsRawAddress() throws IOException {
        client.join("127.0.0.1:8084");

        assertEquals("127.0.0.1:8084", lastJoinBody.get());
    }

    @Test
    void testJoinErrorCarriesErrorCode() {
        RaftException e = assertThrows(RaftException.class, () -> client.join("nonsense"));

        assertEquals(ErrorCode.INVALID_ADDRESS, e.getErrorCode());
        assertTrue(e.getMessage().contains("HTTP 400"));
    }

    @Test
    void testSubmitOnLeaderReturnsCommittedPosition() throws IOException {
        leader.set(true);

        SubmitCommandResponse reply = client.submit("set x=1".getBytes(StandardCharsets.UTF_8));

        assertEquals(3, reply.getIndex());
        assertEquals(2, reply.getTerm());
    }

    @Test
    void testSubmitOnFollower() {
        RaftException e = assertThrows(RaftException.class,
                () -> client.submit("set x=1".getBytes(StandardCharsets.UTF_8)));

        assertEquals(ErrorCode.NOT_LEADER, e.getErrorCode());
    }
}
