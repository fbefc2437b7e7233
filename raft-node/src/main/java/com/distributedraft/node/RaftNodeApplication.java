package com.distributedraft.node;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Raft Node Application
 * Runs one member of a Raft cluster: election, log replication and membership growth
 */
@SpringBootApplication
@EnableConfigurationProperties
public class RaftNodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(RaftNodeApplication.class, args);
    }
}
