package com.distributedraft.node.coordination;

import com.distributedraft.common.dto.AppendEntriesRequest;
import com.distributedraft.common.dto.AppendEntriesResponse;
import com.distributedraft.common.dto.RequestVoteRequest;
import com.distributedraft.common.dto.RequestVoteResponse;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound Raft RPCs to one peer.
 *
 * Calls never block the caller. A peer that cannot be reached completes the future
 * exceptionally (normally with {@link com.distributedraft.common.exception.PeerUnreachableException}).
 */
public interface RaftPeerClient {

    CompletableFuture<RequestVoteResponse> requestVote(PeerAddress peer, RequestVoteRequest request);

    CompletableFuture<AppendEntriesResponse> appendEntries(PeerAddress peer, AppendEntriesRequest request);
}
