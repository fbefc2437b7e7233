package com.distributedraft.common.exception;

/**
 * Exception used to fail an outbound RPC future when the peer could not be reached
 */
public class PeerUnreachableException extends RaftException {

    public PeerUnreachableException(String peer, Throwable cause) {
        super(ErrorCode.CONNECTION_FAILED, "Peer " + peer + " unreachable: " + cause.getMessage(), cause);
    }
}
