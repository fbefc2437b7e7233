package com.distributedraft.node.coordination;

import com.distributedraft.common.dto.AppendEntriesRequest;
import com.distributedraft.common.dto.AppendEntriesResponse;
import com.distributedraft.common.dto.RaftLogEntry;
import com.distributedraft.common.dto.RequestVoteRequest;
import com.distributedraft.common.dto.RequestVoteResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Raft node controller.
 *
 * Entry point for the inbound RPCs (RequestVote, AppendEntries, Join) and driver of the
 * outbound side: the election timer, the vote fanout of a campaign and the leader's
 * heartbeat/replication rounds. All protocol state transitions are delegated to
 * {@link ConsensusState}; this class only adds timers and I/O around them.
 */
@Slf4j
public class RaftController {

    private final ConsensusState state;
    private final ClusterMembership membership;
    private final RaftPeerClient peerClient;
    private final ScheduledExecutorService scheduler;
    private final ElectionTimer electionTimer;
    private final long heartbeatIntervalMs;

    private ScheduledFuture<?> heartbeatFuture;

    public RaftController(ConsensusState state,
                          ClusterMembership membership,
                          RaftPeerClient peerClient,
                          ScheduledExecutorService scheduler,
                          ElectionTimeoutSource electionTimeouts,
                          long heartbeatIntervalMs) {
        this.state = state;
        this.membership = membership;
        this.peerClient = peerClient;
        this.scheduler = scheduler;
        this.heartbeatIntervalMs = heartbeatIntervalMs;
        this.electionTimer = new ElectionTimer(scheduler, electionTimeouts, this::onElectionTimeout);
    }

    /**
     * Arm the election timer and start the heartbeat loop (idle until this node leads)
     */
    public synchronized void start() {
        log.info("Starting Raft node {} with {} peer(s): {}",
                state.getNodeId(), membership.size(), membership.snapshot());
        electionTimer.start();
        heartbeatFuture = scheduler.scheduleWithFixedDelay(this::heartbeatTick,
                heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void shutdown() {
        log.info("Shutting down Raft node {}", state.getNodeId());
        electionTimer.stop();
        if (heartbeatFuture != null) {
            heartbeatFuture.cancel(false);
            heartbeatFuture = null;
        }
    }

    // ---------------------------------------------------------------- election

    private void onElectionTimeout() {
        if (state.getRole() == RaftRole.LEADER) {
            return;
        }
        startElection();
    }

    /**
     * Run one campaign: new term and self-vote, timer reset, then RequestVote to every peer
     * of the current membership concurrently.
     *
     * @return future completed with the role the campaign settled on: LEADER on a quorum,
     * FOLLOWER after seeing a higher term, CANDIDATE when every peer answered without a quorum
     */
    public CompletableFuture<RaftRole> startElection() {
        Campaign campaign = state.startCampaign();
        electionTimer.reset();

        CompletableFuture<RaftRole> result = new CompletableFuture<>();
        if (campaign.isDecided()) {
            result.complete(campaign.getOutcome());
            sendHeartbeats();
            return result;
        }

        for (PeerAddress peer : campaign.getPeers()) {
            peerClient.requestVote(peer, campaign.getRequest()).whenComplete((reply, error) -> {
                RaftRole outcome;
                if (error != null) {
                    log.warn("No vote from {} for term {}: {}", peer, campaign.getTerm(), rootMessage(error));
                    outcome = state.recordNoReply(campaign);
                } else {
                    outcome = state.recordVote(campaign, reply);
                }
                if (outcome != null && result.complete(outcome) && outcome == RaftRole.LEADER) {
                    sendHeartbeats();
                }
            });
        }
        return result;
    }

    // ---------------------------------------------------------------- replication

    private void heartbeatTick() {
        try {
            sendHeartbeats();
        } catch (RuntimeException e) {
            log.error("Heartbeat round failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One replication round: AppendEntries to every peer if this node is leader.
     *
     * @return future completed once every peer answered or failed
     */
    public CompletableFuture<Void> sendHeartbeats() {
        List<OutboundAppend> outbound = state.prepareReplication();
        if (outbound.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<?>[] calls = new CompletableFuture<?>[outbound.size()];
        for (int i = 0; i < outbound.size(); i++) {
            OutboundAppend append = outbound.get(i);
            calls[i] = peerClient.appendEntries(append.getPeer(), append.getRequest())
                    .handle((response, error) -> {
                        if (error != null) {
                            log.debug("AppendEntries to {} failed: {}", append.getPeer(), rootMessage(error));
                        } else {
                            state.recordAppendReply(append.getPeer(), append.getRequest(), response);
                        }
                        return null;
                    });
        }
        return CompletableFuture.allOf(calls);
    }

    /**
     * Append a client command on the leader and push it to followers right away.
     *
     * @return future completed with the entry once committed and applied
     * @throws com.distributedraft.common.exception.NotLeaderException on a non-leader
     */
    public CompletableFuture<RaftLogEntry> submitCommand(byte[] command) {
        CompletableFuture<RaftLogEntry> committed = state.appendCommand(command);
        sendHeartbeats();
        return committed;
    }

    // ---------------------------------------------------------------- inbound RPCs

    public RequestVoteResponse handleRequestVote(RequestVoteRequest request) {
        RequestVoteResponse response = state.handleRequestVote(request);
        if (response.isGrant()) {
            electionTimer.reset();
        }
        return response;
    }

    public AppendEntriesResponse handleAppendEntries(AppendEntriesRequest request) {
        AppendEntriesResponse response = state.handleAppendEntries(request);
        if (response.getTerm() == request.getTerm()) {
            // heard from the leader of our term
            electionTimer.reset();
        }
        return response;
    }

    /**
     * Add the address carried by a Join payload to the membership.
     *
     * @throws com.distributedraft.common.exception.MembershipException when the payload is not
     * UTF-8 or not a host:port address; membership is unchanged in that case
     */
    public PeerAddress join(byte[] payload) {
        PeerAddress address = PeerAddress.fromJoinPayload(payload);
        membership.add(address);
        return address;
    }

    // ---------------------------------------------------------------- queries

    public RaftStatus status() {
        return state.status();
    }

    public ConsensusState getState() {
        return state;
    }

    public ClusterMembership getMembership() {
        return membership;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage();
    }
}
