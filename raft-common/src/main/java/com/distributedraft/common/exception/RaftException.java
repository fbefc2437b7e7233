package com.distributedraft.common.exception;

/**
 * Base exception for all Raft node errors.
 * All custom exceptions should extend this base class.
 */
public class RaftException extends RuntimeException {

    private final ErrorCode errorCode;

    public RaftException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public RaftException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RaftException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getCode() {
        return errorCode.getCode();
    }
}
