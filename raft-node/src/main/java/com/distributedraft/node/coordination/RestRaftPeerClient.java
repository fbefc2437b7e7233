package com.distributedraft.node.coordination;

import com.distributedraft.common.constant.RaftConstants;
import com.distributedraft.common.dto.AppendEntriesRequest;
import com.distributedraft.common.dto.AppendEntriesResponse;
import com.distributedraft.common.dto.RequestVoteRequest;
import com.distributedraft.common.dto.RequestVoteResponse;
import com.distributedraft.common.exception.PeerUnreachableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Raft peer client over HTTP/JSON, talking to the peer's {@code /api/v1/raft} endpoints
 */
@Slf4j
public class RestRaftPeerClient implements RaftPeerClient {

    private final RestTemplate restTemplate;
    private final Executor executor;

    public RestRaftPeerClient(RestTemplate restTemplate, Executor executor) {
        this.restTemplate = restTemplate;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<RequestVoteResponse> requestVote(PeerAddress peer, RequestVoteRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Sending RequestVote to {}: term={}, candidate={}",
                    peer, request.getTerm(), request.getCandidateId());

            RequestVoteResponse response = post(peer, RaftConstants.REQUEST_VOTE_PATH, request,
                    RequestVoteResponse.class);

            log.debug("Received RequestVote response from {}: term={}, grant={}",
                    peer, response.getTerm(), response.isGrant());
            return response;
        }, executor);
    }

    @Override
    public CompletableFuture<AppendEntriesResponse> appendEntries(PeerAddress peer, AppendEntriesRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Sending AppendEntries to {}: term={}, prevIndex={}, entries={}, commitIndex={}",
                    peer, request.getTerm(), request.getPrevIndex(),
                    request.isHeartbeat() ? 0 : request.getEntries().size(), request.getCommitIndex());

            AppendEntriesResponse response = post(peer, RaftConstants.APPEND_ENTRIES_PATH, request,
                    AppendEntriesResponse.class);

            log.debug("Received AppendEntries response from {}: term={}, success={}",
                    peer, response.getTerm(), response.isSuccess());
            return response;
        }, executor);
    }

    private <T> T post(PeerAddress peer, String path, Object request, Class<T> responseType) {
        String url = RaftConstants.endpoint(peer.toString(), path);
        try {
            T body = restTemplate.postForObject(url, request, responseType);
            if (body == null) {
                throw new RestClientException("empty response body");
            }
            return body;
        } catch (RestClientException e) {
            throw new PeerUnreachableException(peer.toString(), e);
        }
    }
}
