package com.distributedraft.node.coordination;

import com.distributedraft.common.exception.ErrorCode;
import com.distributedraft.common.exception.MembershipException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Peers this node contacts, excluding itself.
 *
 * Membership only grows. Duplicates are not filtered: every Join adds one entry.
 * The node's own address is never admitted.
 */
@Slf4j
public class ClusterMembership {

    private final PeerAddress self;
    private final List<PeerAddress> peers = new ArrayList<>();

    /**
     * Membership with no known self address, nothing is refused on {@link #add}
     */
    public ClusterMembership(Collection<PeerAddress> initialPeers) {
        this(null, initialPeers);
    }

    public ClusterMembership(PeerAddress self, Collection<PeerAddress> initialPeers) {
        this.self = self;
        for (PeerAddress peer : initialPeers) {
            if (!peer.equals(self)) {
                peers.add(peer);
            }
        }
    }

    /**
     * Build the membership from the configured cluster list, dropping this node's own address.
     */
    public static ClusterMembership fromCluster(PeerAddress self, Collection<PeerAddress> cluster) {
        return new ClusterMembership(self, cluster);
    }

    /**
     * @throws MembershipException INVALID_ADDRESS when {@code address} is this node's own
     */
    public synchronized void add(PeerAddress address) {
        if (address.equals(self)) {
            log.warn("Refusing to add own address {} to cluster membership", address);
            throw new MembershipException(ErrorCode.INVALID_ADDRESS,
                    "Address " + address + " is this node's own address");
        }
        peers.add(address);
        log.info("Added {} to cluster membership, {} peer(s) now", address, peers.size());
    }

    public PeerAddress getSelf() {
        return self;
    }

    /**
     * Copy of the current peer list, safe to iterate while Joins happen
     */
    public synchronized List<PeerAddress> snapshot() {
        return new ArrayList<>(peers);
    }

    public synchronized int size() {
        return peers.size();
    }
}
