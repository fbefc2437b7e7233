package com.distributedraft.common.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorCodeTest {

    @Test
    void testFromCode() {
        assertEquals(ErrorCode.INVALID_ADDRESS, ErrorCode.fromCode(1003));
        assertEquals(ErrorCode.NOT_LEADER, ErrorCode.fromCode(2001));
        assertEquals(ErrorCode.UNKNOWN_ERROR, ErrorCode.fromCode(42));
    }

    @Test
    void testNotLeaderMessageNamesLeader() {
        NotLeaderException known = new NotLeaderException(2, 1);
        assertEquals(ErrorCode.NOT_LEADER, known.getErrorCode());
        assertEquals(2001, known.getCode());
        assertTrue(known.getMessage().contains("node 1"));

        NotLeaderException unknown = new NotLeaderException(2, null);
        assertNull(unknown.getLeaderId());
        assertTrue(unknown.getMessage().contains("no known leader"));
    }

    @Test
    void testPeerUnreachableKeepsCause() {
        IllegalStateException cause = new IllegalStateException("Connection refused");
        PeerUnreachableException e = new PeerUnreachableException("localhost:9002", cause);

        assertEquals(ErrorCode.CONNECTION_FAILED, e.getErrorCode());
        assertSame(cause, e.getCause());
        assertTrue(e.getMessage().contains("localhost:9002"));
    }
}
