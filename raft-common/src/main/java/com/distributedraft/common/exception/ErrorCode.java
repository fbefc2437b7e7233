package com.distributedraft.common.exception;

/**
 * Error codes for categorizing different types of failures.
 * Error codes are organized by category:
 * - 1xxx: Client errors (malformed or invalid requests)
 * - 2xxx: Consensus errors (leadership and commit progress)
 * - 4xxx: Network errors
 */
public enum ErrorCode {

    // Client errors (1xxx)
    INVALID_REQUEST(1001, "Invalid request parameters"),
    MALFORMED_PAYLOAD(1002, "Payload is not valid UTF-8 text"),
    INVALID_ADDRESS(1003, "Payload is not a valid host:port address"),

    // Consensus errors (2xxx)
    NOT_LEADER(2001, "This node is not the leader"),
    LEADERSHIP_LOST(2002, "Leadership was lost before the entry committed"),
    COMMIT_TIMEOUT(2003, "Entry was not committed in time"),

    // Network errors (4xxx)
    CONNECTION_FAILED(4003, "Failed to reach peer"),

    // Unknown errors
    UNKNOWN_ERROR(9999, "Unknown error occurred");

    private final int code;
    private final String message;

    ErrorCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public static ErrorCode fromCode(int code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code == code) {
                return errorCode;
            }
        }
        return UNKNOWN_ERROR;
    }
}
