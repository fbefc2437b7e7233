package com.distributedraft.node.coordination;

import com.distributedraft.common.dto.AppendEntriesRequest;
import com.distributedraft.common.dto.AppendEntriesResponse;
import com.distributedraft.common.dto.RaftLogEntry;
import com.distributedraft.common.dto.RequestVoteRequest;
import com.distributedraft.common.dto.RequestVoteResponse;
import com.distributedraft.common.exception.ErrorCode;
import com.distributedraft.common.exception.NotLeaderException;
import com.distributedraft.common.exception.RaftException;
import com.distributedraft.node.statemachine.AppliedStateMachine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Authoritative protocol state of one node: term, vote, log, commit index, role,
 * plus the transitions between them.
 *
 * Every public method runs under this object's monitor, so each RPC reply is computed
 * atomically and reflects the state after its own transition. Nothing here performs I/O;
 * outbound calls and timers are driven by {@link RaftController}.
 *
 * State lives for the process only.
 */
@Slf4j
public class ConsensusState {

    private final int nodeId;
    private final ClusterMembership membership;
    private final VotePolicy votePolicy;
    private final AppliedStateMachine stateMachine;
    private final RaftLog raftLog = new RaftLog();

    private long currentTerm = 0;
    private Integer votedFor = null;
    private RaftRole role = RaftRole.FOLLOWER;
    private Integer leaderId = null;

    private long commitIndex = 0;
    private long lastApplied = 0;

    // Leader state, reset on every election win
    private final Map<PeerAddress, Long> nextIndex = new HashMap<>();
    private final Map<PeerAddress, Long> matchIndex = new HashMap<>();

    // Client commands waiting for commit, by log index
    private final Map<Long, CompletableFuture<RaftLogEntry>> pendingCommands = new HashMap<>();

    public ConsensusState(int nodeId, ClusterMembership membership, VotePolicy votePolicy,
                          AppliedStateMachine stateMachine) {
        this.nodeId = nodeId;
        this.membership = membership;
        this.votePolicy = votePolicy;
        this.stateMachine = stateMachine;
    }

    /**
     * Votes needed to win with {@code membershipSize} peers: a strict majority of peers plus self
     */
    public static int quorumFor(int membershipSize) {
        return (membershipSize + 1) / 2 + 1;
    }

    // ---------------------------------------------------------------- election

    /**
     * Begin a campaign: next term, vote for self, become candidate.
     * A node without peers wins on its own vote.
     */
    public synchronized Campaign startCampaign() {
        currentTerm++;
        votedFor = nodeId;
        role = RaftRole.CANDIDATE;
        leaderId = null;

        RequestVoteRequest request = RequestVoteRequest.builder()
                .term(currentTerm)
                .candidateId(nodeId)
                .lastLogIndex(raftLog.getLastLogIndex())
                .lastLogTerm(raftLog.getLastLogTerm())
                .build();
        Campaign campaign = new Campaign(request, membership.snapshot());

        log.info("Node {} starting election for term {} ({} peer(s), quorum {})",
                nodeId, currentTerm, campaign.getPeers().size(), campaign.getQuorum());

        if (campaign.hasQuorum()) {
            becomeLeader();
            campaign.decide(RaftRole.LEADER);
        }
        return campaign;
    }

    /**
     * Fold one RequestVote reply into a campaign.
     *
     * @return the campaign outcome, or null while it is still undecided
     */
    public synchronized RaftRole recordVote(Campaign campaign, RequestVoteResponse reply) {
        boolean allAnswered = campaign.countReply();

        if (reply.getTerm() > currentTerm) {
            log.info("Node {} saw term {} in a vote reply during term {} campaign, stepping down",
                    nodeId, reply.getTerm(), campaign.getTerm());
            stepDown(reply.getTerm());
            campaign.decide(RaftRole.FOLLOWER);
            return campaign.getOutcome();
        }
        if (campaign.isDecided()) {
            return campaign.getOutcome();
        }
        if (currentTerm != campaign.getTerm() || role != RaftRole.CANDIDATE) {
            // superseded by a later term or by a leader's AppendEntries
            campaign.decide(role);
            return campaign.getOutcome();
        }

        if (reply.isGrant() && reply.getTerm() == campaign.getTerm()) {
            campaign.addGrant();
            if (campaign.hasQuorum()) {
                becomeLeader();
                campaign.decide(RaftRole.LEADER);
                return campaign.getOutcome();
            }
        }
        return closeIfAllAnswered(campaign, allAnswered);
    }

    /**
     * Count a peer that could not be reached. It grants nothing.
     */
    public synchronized RaftRole recordNoReply(Campaign campaign) {
        boolean allAnswered = campaign.countReply();
        if (campaign.isDecided()) {
            return campaign.getOutcome();
        }
        return closeIfAllAnswered(campaign, allAnswered);
    }

    private RaftRole closeIfAllAnswered(Campaign campaign, boolean allAnswered) {
        if (allAnswered) {
            log.info("Election for term {} ended without a winner: {}/{} votes",
                    campaign.getTerm(), campaign.getGrants(), campaign.getQuorum());
            campaign.decide(role);
            return campaign.getOutcome();
        }
        return null;
    }

    // ---------------------------------------------------------------- inbound RPCs

    /**
     * RequestVote: reject stale terms, adopt newer ones, then apply the configured vote policy
     */
    public synchronized RequestVoteResponse handleRequestVote(RequestVoteRequest request) {
        if (request.getTerm() < currentTerm) {
            log.debug("Rejecting vote for node {}: stale term {} < {}",
                    request.getCandidateId(), request.getTerm(), currentTerm);
            return voteReply(false);
        }
        if (request.getTerm() > currentTerm) {
            stepDown(request.getTerm());
        }

        boolean grant;
        if (votePolicy == VotePolicy.CANONICAL) {
            grant = (votedFor == null || votedFor == request.getCandidateId())
                    && isLogUpToDate(request.getLastLogIndex(), request.getLastLogTerm());
            if (grant) {
                votedFor = request.getCandidateId();
            }
        } else {
            grant = votedFor != null && votedFor == nodeId;
        }

        log.debug("Vote for node {} in term {}: {}", request.getCandidateId(), currentTerm,
                grant ? "granted" : "denied");
        return voteReply(grant);
    }

    /**
     * AppendEntries: reject stale leaders, recognise the leader of the term, apply the
     * consistency gate, merge entries and move the commit index forward.
     */
    public synchronized AppendEntriesResponse handleAppendEntries(AppendEntriesRequest request) {
        if (request.getTerm() < currentTerm) {
            log.debug("Rejecting AppendEntries from node {}: stale term {} < {}",
                    request.getLeaderId(), request.getTerm(), currentTerm);
            return appendReply(false);
        }
        if (request.getTerm() > currentTerm) {
            stepDown(request.getTerm());
        } else if (role != RaftRole.FOLLOWER) {
            log.info("Node {} stepping down from {} to follow node {} in term {}",
                    nodeId, role, request.getLeaderId(), currentTerm);
            becomeFollower();
        }
        leaderId = request.getLeaderId();

        if (request.getPrevIndex() > commitIndex) {
            log.debug("Rejecting AppendEntries: prevIndex {} beyond commit index {}",
                    request.getPrevIndex(), commitIndex);
            return appendReply(false);
        }

        if (!request.isHeartbeat()) {
            int appended = raftLog.merge(request.getEntries(), commitIndex);
            log.debug("Merged {} of {} entries from leader {}", appended,
                    request.getEntries().size(), request.getLeaderId());
        }

        if (request.getCommitIndex() > commitIndex) {
            long oldCommitIndex = commitIndex;
            commitIndex = Math.max(commitIndex, Math.min(request.getCommitIndex(), raftLog.getLastLogIndex()));
            log.debug("Updated commitIndex from {} to {} (leaderCommit={}, lastLogIndex={})",
                    oldCommitIndex, commitIndex, request.getCommitIndex(), raftLog.getLastLogIndex());
            applyCommittedEntries();
        }

        return appendReply(true);
    }

    // ---------------------------------------------------------------- leader side

    /**
     * Build the next AppendEntries for every peer. Empty when this node is not leader.
     */
    public synchronized List<OutboundAppend> prepareReplication() {
        if (role != RaftRole.LEADER) {
            return List.of();
        }
        List<OutboundAppend> outbound = new ArrayList<>();
        for (PeerAddress peer : membership.snapshot()) {
            long next = nextIndex.computeIfAbsent(peer, p -> raftLog.getLastLogIndex() + 1);
            long prevIndex = next - 1;
            AppendEntriesRequest request = AppendEntriesRequest.builder()
                    .term(currentTerm)
                    .leaderId(nodeId)
                    .prevIndex(prevIndex)
                    .prevTerm(raftLog.getTermForIndex(prevIndex))
                    .entries(raftLog.getEntriesFrom(next))
                    .commitIndex(commitIndex)
                    .build();
            outbound.add(new OutboundAppend(peer, request));
        }
        return outbound;
    }

    /**
     * Fold a follower's AppendEntries reply into the leader bookkeeping
     */
    public synchronized void recordAppendReply(PeerAddress peer, AppendEntriesRequest request,
                                               AppendEntriesResponse response) {
        if (response.getTerm() > currentTerm) {
            log.info("Node {} saw term {} from {}, stepping down", nodeId, response.getTerm(), peer);
            stepDown(response.getTerm());
            return;
        }
        if (role != RaftRole.LEADER || request.getTerm() != currentTerm) {
            return;
        }

        if (response.isSuccess()) {
            int sent = request.getEntries() != null ? request.getEntries().size() : 0;
            long matched = Math.max(matchIndex.getOrDefault(peer, 0L), request.getPrevIndex() + sent);
            matchIndex.put(peer, matched);
            nextIndex.put(peer, matched + 1);
            advanceLeaderCommitIndex();
        } else {
            // Back off and retry on the next heartbeat
            long current = nextIndex.getOrDefault(peer, request.getPrevIndex() + 1);
            nextIndex.put(peer, Math.max(1, Math.min(current - 1, request.getPrevIndex())));
        }
    }

    /**
     * Append a client command to the leader's log.
     *
     * @return future completed with the entry once it is committed and applied
     * @throws NotLeaderException when this node is not the leader
     */
    public synchronized CompletableFuture<RaftLogEntry> appendCommand(byte[] command) {
        if (role != RaftRole.LEADER) {
            throw new NotLeaderException(nodeId, leaderId);
        }

        RaftLogEntry entry = RaftLogEntry.builder()
                .index(raftLog.getLastLogIndex() + 1)
                .term(currentTerm)
                .command(command)
                .build();
        raftLog.append(entry);

        CompletableFuture<RaftLogEntry> future = new CompletableFuture<>();
        pendingCommands.put(entry.getIndex(), future);
        log.debug("Leader {} appended entry {} in term {}", nodeId, entry.getIndex(), currentTerm);

        // A leader without peers commits on its own
        advanceLeaderCommitIndex();
        return future;
    }

    /**
     * Commit the highest index of the current term that a majority holds
     */
    private void advanceLeaderCommitIndex() {
        List<PeerAddress> peers = membership.snapshot();
        int voters = peers.size() + 1;

        for (long index = raftLog.getLastLogIndex(); index > commitIndex; index--) {
            if (raftLog.getTermForIndex(index) != currentTerm) {
                break;
            }
            int replicated = 1;
            for (PeerAddress peer : peers) {
                if (matchIndex.getOrDefault(peer, 0L) >= index) {
                    replicated++;
                }
            }
            if (replicated > voters / 2) {
                log.debug("Leader {} advancing commit index {} -> {}", nodeId, commitIndex, index);
                commitIndex = index;
                applyCommittedEntries();
                return;
            }
        }
    }

    // ---------------------------------------------------------------- transitions

    private void becomeLeader() {
        role = RaftRole.LEADER;
        leaderId = nodeId;

        nextIndex.clear();
        matchIndex.clear();
        long next = raftLog.getLastLogIndex() + 1;
        for (PeerAddress peer : membership.snapshot()) {
            nextIndex.put(peer, next);
            matchIndex.put(peer, 0L);
        }
        log.info("Node {} became leader for term {}", nodeId, currentTerm);
    }

    private void becomeFollower() {
        if (role == RaftRole.LEADER) {
            failPendingCommands();
        }
        role = RaftRole.FOLLOWER;
    }

    /**
     * Adopt a newer term: clear the vote and fall back to follower
     */
    private void stepDown(long newTerm) {
        RaftRole previous = role;
        currentTerm = newTerm;
        votedFor = null;
        leaderId = null;
        becomeFollower();
        nextIndex.clear();
        matchIndex.clear();
        if (previous != RaftRole.FOLLOWER) {
            log.info("Node {} stepped down from {} to follower for term {}", nodeId, previous, newTerm);
        }
    }

    private void failPendingCommands() {
        for (CompletableFuture<RaftLogEntry> future : pendingCommands.values()) {
            future.completeExceptionally(new RaftException(ErrorCode.LEADERSHIP_LOST,
                    "Node " + nodeId + " lost leadership before the entry committed"));
        }
        pendingCommands.clear();
    }

    private void applyCommittedEntries() {
        while (lastApplied < commitIndex) {
            lastApplied++;
            RaftLogEntry entry = raftLog.getEntry(lastApplied);
            CompletableFuture<RaftLogEntry> pending = pendingCommands.remove(lastApplied);
            try {
                stateMachine.apply(entry);
                if (pending != null) {
                    pending.complete(entry);
                }
            } catch (RuntimeException e) {
                log.error("Failed to apply entry {}: {}", lastApplied, e.getMessage(), e);
                if (pending != null) {
                    pending.completeExceptionally(e);
                }
            }
        }
    }

    /**
     * Candidate's log is at least as up-to-date as ours: higher last term, or same term and not shorter
     */
    private boolean isLogUpToDate(long candidateLastLogIndex, long candidateLastLogTerm) {
        long lastLogTerm = raftLog.getLastLogTerm();
        return candidateLastLogTerm > lastLogTerm
                || (candidateLastLogTerm == lastLogTerm && candidateLastLogIndex >= raftLog.getLastLogIndex());
    }

    private RequestVoteResponse voteReply(boolean grant) {
        return RequestVoteResponse.builder().term(currentTerm).grant(grant).build();
    }

    private AppendEntriesResponse appendReply(boolean success) {
        return AppendEntriesResponse.builder().term(currentTerm).success(success).build();
    }

    // ---------------------------------------------------------------- queries

    public int getNodeId() {
        return nodeId;
    }

    public VotePolicy getVotePolicy() {
        return votePolicy;
    }

    public synchronized long getCurrentTerm() {
        return currentTerm;
    }

    public synchronized Integer getVotedFor() {
        return votedFor;
    }

    public synchronized RaftRole getRole() {
        return role;
    }

    public synchronized Integer getLeaderId() {
        return leaderId;
    }

    public synchronized long getCommitIndex() {
        return commitIndex;
    }

    public synchronized long getLastApplied() {
        return lastApplied;
    }

    public synchronized long getLastLogIndex() {
        return raftLog.getLastLogIndex();
    }

    public synchronized RaftLogEntry getEntry(long index) {
        return raftLog.getEntry(index);
    }

    public synchronized RaftStatus status() {
        return RaftStatus.builder()
                .nodeId(nodeId)
                .currentTerm(currentTerm)
                .votedFor(votedFor)
                .role(role)
                .leader(role == RaftRole.LEADER)
                .leaderId(leaderId)
                .lastLogIndex(raftLog.getLastLogIndex())
                .lastLogTerm(raftLog.getLastLogTerm())
                .commitIndex(commitIndex)
                .lastApplied(lastApplied)
                .peers(membership.snapshot().stream().map(PeerAddress::toString).collect(Collectors.toList()))
                .build();
    }
}
