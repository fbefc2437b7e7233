package com.distributedraft.node.coordination;

import java.time.Duration;

/**
 * Supplies the election timeout to use for the next timer arming
 */
@FunctionalInterface
public interface ElectionTimeoutSource {

    Duration nextTimeout();
}
