package com.distributedraft.common.exception;

/**
 * Exception thrown when a leader-only operation reaches a follower or candidate
 */
public class NotLeaderException extends RaftException {

    private final Integer leaderId;

    public NotLeaderException(int nodeId, Integer leaderId) {
        super(ErrorCode.NOT_LEADER, "Node " + nodeId + " is not the leader"
                + (leaderId != null ? " (current leader: node " + leaderId + ")" : " (no known leader)"));
        this.leaderId = leaderId;
    }

    public Integer getLeaderId() {
        return leaderId;
    }
}
