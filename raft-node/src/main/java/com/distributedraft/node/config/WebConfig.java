package com.distributedraft.node.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Web configuration for the node
 * Provides the HTTP client used for peer RPCs
 */
@Configuration
public class WebConfig {

    /**
     * RestTemplate for Raft RPCs; the transport timeouts are the only per-call bound
     */
    @Bean
    public RestTemplate raftRestTemplate(RestTemplateBuilder builder, RaftProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getRpc().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getRpc().getReadTimeoutMs()))
                .build();
    }
}
