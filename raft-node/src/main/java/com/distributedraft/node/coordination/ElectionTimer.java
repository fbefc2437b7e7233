package com.distributedraft.node.coordination;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Resettable election deadline.
 *
 * Each arming draws a fresh timeout. When the deadline passes without a reset the timer
 * re-arms itself and runs the expiry action (the campaign), so it keeps ticking for the
 * life of the node until {@link #stop()}.
 */
@Slf4j
public class ElectionTimer {

    private final ScheduledExecutorService scheduler;
    private final ElectionTimeoutSource timeoutSource;
    private final Runnable onExpiry;

    private ScheduledFuture<?> deadline;
    private long generation;
    private boolean running;

    public ElectionTimer(ScheduledExecutorService scheduler, ElectionTimeoutSource timeoutSource, Runnable onExpiry) {
        this.scheduler = scheduler;
        this.timeoutSource = timeoutSource;
        this.onExpiry = onExpiry;
    }

    public synchronized void start() {
        running = true;
        arm();
    }

    /**
     * Push the deadline out by a freshly drawn timeout. No-op once stopped.
     */
    public synchronized void reset() {
        if (running) {
            arm();
        }
    }

    public synchronized void stop() {
        running = false;
        if (deadline != null) {
            deadline.cancel(false);
            deadline = null;
        }
    }

    public synchronized boolean isRunning() {
        return running;
    }

    private void arm() {
        if (deadline != null) {
            deadline.cancel(false);
        }
        long armed = ++generation;
        Duration timeout = timeoutSource.nextTimeout();
        deadline = scheduler.schedule(() -> expire(armed), timeout.toMillis(), TimeUnit.MILLISECONDS);
        log.trace("Election timer armed for {} ms", timeout.toMillis());
    }

    private void expire(long armed) {
        synchronized (this) {
            // a reset that raced with this deadline wins
            if (!running || armed != generation) {
                return;
            }
            arm();
        }
        log.debug("Election timeout elapsed");
        try {
            onExpiry.run();
        } catch (RuntimeException e) {
            // the timer must survive a failed campaign
            log.error("Election timeout action failed: {}", e.getMessage(), e);
        }
    }
}
