package com.distributedraft.node.coordination;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Election timeout drawn uniformly from [min, max) milliseconds on every call
 */
public class RandomizedElectionTimeout implements ElectionTimeoutSource {

    private final long minMillis;
    private final long maxMillis;

    public RandomizedElectionTimeout(long minMillis, long maxMillis) {
        if (minMillis <= 0 || maxMillis <= minMillis) {
            throw new IllegalArgumentException("Election timeout bounds must satisfy 0 < min < max, got ["
                    + minMillis + ", " + maxMillis + ")");
        }
        this.minMillis = minMillis;
        this.maxMillis = maxMillis;
    }

    @Override
    public Duration nextTimeout() {
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(minMillis, maxMillis));
    }
}
