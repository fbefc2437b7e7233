package com.distributedraft.node.config;

import com.distributedraft.node.coordination.ClusterMembership;
import com.distributedraft.node.coordination.ConsensusState;
import com.distributedraft.node.coordination.RaftController;
import com.distributedraft.node.coordination.RaftPeerClient;
import com.distributedraft.node.coordination.RandomizedElectionTimeout;
import com.distributedraft.node.coordination.RestRaftPeerClient;
import com.distributedraft.node.statemachine.AppliedStateMachine;
import com.distributedraft.node.statemachine.CommandLogStateMachine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Wires the consensus core from {@link RaftProperties}
 */
@Slf4j
@Configuration
public class RaftNodeConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public AppliedStateMachine appliedStateMachine() {
        return new CommandLogStateMachine();
    }

    @Bean
    public ClusterMembership clusterMembership(RaftProperties properties,
                                               @Value("${server.port:8080}") int serverPort) {
        properties.applyDefaultListenAddress(serverPort);
        properties.validate();
        ClusterMembership membership = ClusterMembership.fromCluster(
                properties.selfAddress(), properties.clusterAddresses());

        log.info("Raft node configuration: node={}, listen={}, peers={}, election=[{}, {}) ms, heartbeat={} ms, votePolicy={}",
                properties.getNodeId(), properties.selfAddress(), membership.snapshot(),
                properties.getElection().getMinTimeoutMs(), properties.getElection().getMaxTimeoutMs(),
                properties.getHeartbeatIntervalMs(), properties.getElection().getVotePolicy());
        return membership;
    }

    @Bean
    public ConsensusState consensusState(RaftProperties properties, ClusterMembership membership,
                                         AppliedStateMachine stateMachine) {
        return new ConsensusState(properties.getNodeId(), membership,
                properties.getElection().getVotePolicy(), stateMachine);
    }

    @Bean
    public RaftPeerClient raftPeerClient(RestTemplate raftRestTemplate,
                                         @Qualifier("raftRpcExecutor") Executor raftRpcExecutor) {
        return new RestRaftPeerClient(raftRestTemplate, raftRpcExecutor);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public RaftController raftController(RaftProperties properties,
                                         ConsensusState consensusState,
                                         ClusterMembership membership,
                                         RaftPeerClient raftPeerClient,
                                         @Qualifier("raftScheduler") ScheduledExecutorService raftScheduler) {
        return new RaftController(consensusState, membership, raftPeerClient, raftScheduler,
                new RandomizedElectionTimeout(properties.getElection().getMinTimeoutMs(),
                        properties.getElection().getMaxTimeoutMs()),
                properties.getHeartbeatIntervalMs());
    }
}
