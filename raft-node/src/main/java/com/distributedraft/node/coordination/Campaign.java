package com.distributedraft.node.coordination;

import com.distributedraft.common.dto.RequestVoteRequest;

import java.util.List;

/**
 * One election attempt: the term it runs in, the peers asked, and the running tally.
 *
 * Quorum is fixed from the membership snapshot taken when the campaign starts.
 * The tally is only updated under the {@link ConsensusState} monitor.
 */
public class Campaign {

    private final RequestVoteRequest request;
    private final List<PeerAddress> peers;
    private final int quorum;

    private int grants = 1; // self-vote
    private int replies;
    private RaftRole outcome;

    Campaign(RequestVoteRequest request, List<PeerAddress> peers) {
        this.request = request;
        this.peers = List.copyOf(peers);
        this.quorum = ConsensusState.quorumFor(peers.size());
    }

    public long getTerm() {
        return request.getTerm();
    }

    public RequestVoteRequest getRequest() {
        return request;
    }

    public List<PeerAddress> getPeers() {
        return peers;
    }

    public int getQuorum() {
        return quorum;
    }

    int getGrants() {
        return grants;
    }

    boolean isDecided() {
        return outcome != null;
    }

    RaftRole getOutcome() {
        return outcome;
    }

    void addGrant() {
        grants++;
    }

    /**
     * Count an answer from a peer, a reply or a transport failure alike.
     *
     * @return true once every peer has answered
     */
    boolean countReply() {
        replies++;
        return replies >= peers.size();
    }

    boolean hasQuorum() {
        return grants >= quorum;
    }

    void decide(RaftRole role) {
        if (outcome == null) {
            outcome = role;
        }
    }
}
