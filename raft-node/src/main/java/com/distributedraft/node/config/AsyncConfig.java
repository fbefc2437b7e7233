package com.distributedraft.node.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the node: outbound RPC fanout, and the scheduler shared by the
 * election timer and the heartbeat loop
 */
@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Executor for outbound RequestVote / AppendEntries calls
     */
    @Bean(name = "raftRpcExecutor")
    public Executor raftRpcExecutor(RaftProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        int threads = properties.getRpc().getFanoutThreads();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads * 2);
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("raft-rpc-");

        // Rejection policy - caller runs if queue full (back-pressure)
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("Raft RPC executor initialized: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), 256);

        return executor;
    }

    /**
     * Scheduler for the election timer and the leader heartbeat
     */
    @Bean(name = "raftScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService raftScheduler(RaftProperties properties) {
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r);
            t.setName("raft-scheduler-" + properties.getNodeId());
            t.setDaemon(true);
            return t;
        });
    }
}
