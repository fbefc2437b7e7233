package com.distributedraft.node.config;

import com.distributedraft.common.constant.RaftConstants;
import com.distributedraft.common.exception.MembershipException;
import com.distributedraft.node.coordination.PeerAddress;
import com.distributedraft.node.coordination.VotePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Node configuration, bound from the {@code raft.*} properties
 */
@Configuration
@ConfigurationProperties(prefix = "raft")
@Data
public class RaftProperties {

    // ========== NODE IDENTITY ==========
    private Integer nodeId = RaftConstants.DEFAULT_NODE_ID;

    /**
     * Address this node listens on, as peers see it. Removed from {@link #peers}.
     * Unset means localhost on the HTTP server port.
     */
    private String listenAddress;

    /**
     * Initial cluster, host:port per node. May include this node's own address.
     */
    private List<String> peers = new ArrayList<>();

    private Long heartbeatIntervalMs = RaftConstants.DEFAULT_HEARTBEAT_INTERVAL_MS;

    // ========== ELECTION ==========
    private Election election = new Election();

    @Data
    public static class Election {
        private Long minTimeoutMs = RaftConstants.DEFAULT_ELECTION_MIN_TIMEOUT_MS;
        private Long maxTimeoutMs = RaftConstants.DEFAULT_ELECTION_MAX_TIMEOUT_MS;
        private VotePolicy votePolicy = VotePolicy.SELF_AFFIRMING;
    }

    // ========== PEER RPC ==========
    private Rpc rpc = new Rpc();

    @Data
    public static class Rpc {
        private Integer connectTimeoutMs = RaftConstants.DEFAULT_CONNECT_TIMEOUT_MS;
        private Integer readTimeoutMs = RaftConstants.DEFAULT_READ_TIMEOUT_MS;
        private Long commitTimeoutMs = RaftConstants.DEFAULT_COMMIT_TIMEOUT_MS;
        private Integer fanoutThreads = RaftConstants.DEFAULT_FANOUT_THREADS;
    }

    /**
     * Fill in {@link #listenAddress} from the HTTP server port when it was left unset
     */
    public void applyDefaultListenAddress(int serverPort) {
        if (listenAddress == null || listenAddress.isBlank()) {
            listenAddress = "localhost:" + serverPort;
        }
    }

    /**
     * Fail startup on settings the node cannot run with
     */
    public void validate() {
        if (listenAddress == null || listenAddress.isBlank()) {
            throw new IllegalStateException("FATAL: raft.listen-address is not set");
        }
        if (nodeId == null || nodeId < 0) {
            throw new IllegalStateException("FATAL: raft.node-id must be a non-negative integer, got " + nodeId);
        }
        if (election.getMinTimeoutMs() <= 0 || election.getMaxTimeoutMs() <= election.getMinTimeoutMs()) {
            throw new IllegalStateException("FATAL: raft.election timeouts must satisfy 0 < min-timeout-ms < max-timeout-ms, got "
                    + election.getMinTimeoutMs() + " and " + election.getMaxTimeoutMs());
        }
        if (heartbeatIntervalMs <= 0) {
            throw new IllegalStateException("FATAL: raft.heartbeat-interval-ms must be positive, got " + heartbeatIntervalMs);
        }
        if (rpc.getFanoutThreads() <= 0 || rpc.getCommitTimeoutMs() <= 0) {
            throw new IllegalStateException("FATAL: raft.rpc.fanout-threads and raft.rpc.commit-timeout-ms must be positive");
        }
        selfAddress();
        clusterAddresses();
    }

    public PeerAddress selfAddress() {
        return parse("raft.listen-address", listenAddress);
    }

    public List<PeerAddress> clusterAddresses() {
        List<PeerAddress> addresses = new ArrayList<>();
        for (String peer : peers) {
            addresses.add(parse("raft.peers", peer));
        }
        return addresses;
    }

    private static PeerAddress parse(String key, String value) {
        try {
            return PeerAddress.parse(value);
        } catch (MembershipException e) {
            throw new IllegalStateException("FATAL: " + key + " contains an invalid address: " + e.getMessage(), e);
        }
    }
}
