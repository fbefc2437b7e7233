package com.distributedraft.node.coordination;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ElectionTimerTest {

    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    void testFiresRepeatedlyWithoutReset() throws Exception {
        CountDownLatch expiries = new CountDownLatch(3);
        ElectionTimer timer = new ElectionTimer(scheduler, () -> Duration.ofMillis(20), expiries::countDown);

        timer.start();

        assertTrue(expiries.await(5, TimeUnit.SECONDS));
        timer.stop();
    }

    @Test
    void testResetPostponesExpiry() throws Exception {
        AtomicInteger fired = new AtomicInteger();
        ElectionTimer timer = new ElectionTimer(scheduler, () -> Duration.ofMillis(300), fired::incrementAndGet);

        timer.start();
        for (int i = 0; i < 10; i++) {
            Thread.sleep(50);
            timer.reset();
        }

        assertEquals(0, fired.get());
        timer.stop();
    }

    @Test
    void testStopCancelsDeadline() throws Exception {
        AtomicInteger fired = new AtomicInteger();
        ElectionTimer timer = new ElectionTimer(scheduler, () -> Duration.ofMillis(50), fired::incrementAndGet);

        timer.start();
        timer.stop();
        Thread.sleep(200);

        assertEquals(0, fired.get());
        assertFalse(timer.isRunning());
    }

    @Test
    void testResetBeforeStartIsIgnored() throws Exception {
        AtomicInteger fired = new AtomicInteger();
        ElectionTimer timer = new ElectionTimer(scheduler, () -> Duration.ofMillis(20), fired::incrementAndGet);

        timer.reset();
        Thread.sleep(150);

        assertEquals(0, fired.get());
        assertFalse(timer.isRunning());
    }

    @Test
    void testSurvivesFailingExpiryAction() throws Exception {
        CountDownLatch expiries = new CountDownLatch(2);
        ElectionTimer timer = new ElectionTimer(scheduler, () -> Duration.ofMillis(20), () -> {
            expiries.countDown();
            throw new IllegalStateException("campaign failed");
        });

        timer.start();

        assertTrue(expiries.await(5, TimeUnit.SECONDS));
        timer.stop();
    }
}
