package com.distributedraft.common.exception;

/**
 * Exception thrown when a Join request cannot be turned into a cluster member.
 * Membership is left unchanged whenever this is thrown.
 */
public class MembershipException extends RaftException {

    public MembershipException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public MembershipException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
