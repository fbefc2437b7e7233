package com.distributedraft.node.coordination;

/**
 * Roles a Raft node moves between
 */
public enum RaftRole {
    /**
     * Follower - default role, accepts entries from the leader of the term
     */
    FOLLOWER,

    /**
     * Candidate - campaigning for votes after an election timeout
     */
    CANDIDATE,

    /**
     * Leader - won a quorum for the current term, sends heartbeats and replicates the log
     */
    LEADER
}
