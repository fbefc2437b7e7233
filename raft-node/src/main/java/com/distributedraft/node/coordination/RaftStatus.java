package com.distributedraft.node.coordination;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raft node status for monitoring/debugging, taken atomically
 */
@Value
@Builder
public class RaftStatus {
    int nodeId;
    long currentTerm;
    Integer votedFor;
    RaftRole role;
    boolean leader;
    Integer leaderId;
    long lastLogIndex;
    long lastLogTerm;
    long commitIndex;
    long lastApplied;
    List<String> peers;
}
