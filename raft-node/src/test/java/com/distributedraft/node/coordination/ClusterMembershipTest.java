package com.distributedraft.node.coordination;

import com.distributedraft.common.exception.ErrorCode;
import com.distributedraft.common.exception.MembershipException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClusterMembershipTest {

    @Test
    void testFromClusterDropsSelf() {
        PeerAddress self = PeerAddress.parse("localhost:8081");
        ClusterMembership membership = ClusterMembership.fromCluster(self, List.of(
                PeerAddress.parse("localhost:8081"),
                PeerAddress.parse("localhost:8082"),
                PeerAddress.parse("localhost:8083")));

        assertEquals(2, membership.size());
        assertFalse(membership.snapshot().contains(self));
    }

    @Test
    void testAddKeepsDuplicates() {
        ClusterMembership membership = new ClusterMembership(List.of());
        membership.add(PeerAddress.parse("127.0.0.1:9001"));
        membership.add(PeerAddress.parse("127.0.0.1:9001"));

        assertEquals(2, membership.size());
    }

    @Test
    void testAddRejectsOwnAddress() {
        PeerAddress self = PeerAddress.parse("127.0.0.1:8081");
        ClusterMembership membership = ClusterMembership.fromCluster(self,
                List.of(self, PeerAddress.parse("127.0.0.1:8082")));

        MembershipException e = assertThrows(MembershipException.class,
                () -> membership.add(PeerAddress.parse("127.0.0.1:8081")));

        assertEquals(ErrorCode.INVALID_ADDRESS, e.getErrorCode());
        assertEquals(1, membership.size());
        assertEquals(self, membership.getSelf());
    }

    @Test
    void testSnapshotIsDetached() {
        ClusterMembership membership = new ClusterMembership(List.of(PeerAddress.parse("localhost:8082")));
        List<PeerAddress> snapshot = membership.snapshot();

        membership.add(PeerAddress.parse("localhost:8083"));

        assertEquals(1, snapshot.size());
        assertEquals(2, membership.snapshot().size());
    }
}
