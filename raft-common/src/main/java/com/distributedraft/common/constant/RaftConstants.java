package com.distributedraft.common.constant;

/**
 * Application-wide constants.
 */
public final class RaftConstants {

    private RaftConstants() {
        // Utility class - prevent instantiation
    }

    // REST surface of a node
    public static final String API_BASE_PATH = "/api/v1/raft";
    public static final String REQUEST_VOTE_PATH = "/request-vote";
    public static final String APPEND_ENTRIES_PATH = "/append-entries";
    public static final String JOIN_PATH = "/join";
    public static final String COMMANDS_PATH = "/commands";
    public static final String STATUS_PATH = "/status";

    // Default configuration values
    public static final int DEFAULT_NODE_ID = 1;
    public static final long DEFAULT_ELECTION_MIN_TIMEOUT_MS = 1500;
    public static final long DEFAULT_ELECTION_MAX_TIMEOUT_MS = 3000;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 500;

    // Timeout values (milliseconds)
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 500;
    public static final int DEFAULT_READ_TIMEOUT_MS = 1000;
    public static final long DEFAULT_COMMIT_TIMEOUT_MS = 5000;

    public static final int DEFAULT_FANOUT_THREADS = 8;

    /**
     * Full URL of an endpoint on the node listening at {@code host:port}
     */
    public static String endpoint(String address, String path) {
        return "http://" + address + API_BASE_PATH + path;
    }
}
