package com.questrail.phoenix.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production timer used for heartbeats and reconnects.
 *
 * Note: These tests use real time. Tolerances are generous to avoid false
 * failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void timerFiresAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long start = System.nanoTime();

        scheduler.scheduleAfter(Duration.ofMillis(50), SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Timer should fire");
        assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(50));
    }

    @Test
    void zeroDelayFiresImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        scheduler.scheduleAfter(Duration.ZERO, SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), SystemMonotonicClock.INSTANCE, () -> { }));
    }

    @Test
    void cancelledTimerNeverFires() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean(false);

        Cancellable timer = scheduler.scheduleAfter(Duration.ofMillis(100), SystemMonotonicClock.INSTANCE,
                () -> fired.set(true));

        assertTrue(timer.cancel());
        assertFalse(timer.cancel(), "Second cancel is a no-op");

        Thread.sleep(200);
        assertFalse(fired.get());
    }

    @Test
    void cancelAfterFiringReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable timer = scheduler.scheduleAfter(Duration.ZERO, SystemMonotonicClock.INSTANCE, latch::countDown);

        assertTrue(latch.await(200, TimeUnit.MILLISECONDS));
        assertFalse(timer.cancel());
    }

    @Test
    void timersFireInDeadlineOrder() throws InterruptedException {
        List<String> fired = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch latch = new CountDownLatch(2);

        // Reconnect delay scheduled before a shorter heartbeat.
        scheduler.scheduleAfter(Duration.ofMillis(60), SystemMonotonicClock.INSTANCE, () -> {
            fired.add("reconnect");
            latch.countDown();
        });
        scheduler.scheduleAfter(Duration.ofMillis(20), SystemMonotonicClock.INSTANCE, () -> {
            fired.add("heartbeat");
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(List.of("heartbeat", "reconnect"), fired);
    }

    @Test
    void timerArmedAfterShutdownIsDropped() throws InterruptedException {
        AtomicBoolean fired = new AtomicBoolean(false);
        executor.shutdown();

        Cancellable timer = scheduler.scheduleAfter(Duration.ZERO, SystemMonotonicClock.INSTANCE,
                () -> fired.set(true));

        assertFalse(timer.cancel());
        Thread.sleep(50);
        assertFalse(fired.get());
    }
}
