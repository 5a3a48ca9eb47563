package com.questrail.phoenix.internal.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <h2>Clock Consistency</h2>
 * <p>Deadlines are converted into relative delays using the supplied
 * {@link MonotonicClock}. Callers computing deadlines must use the same clock,
 * normally {@link SystemMonotonicClock#INSTANCE}.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own the provided executor. Callers
 * are responsible for shutdown.</p>
 *
 * <h2>After shutdown</h2>
 * <p>A worker task still draining after {@code PhoenixSocket.shutdown()} may
 * re-arm a heartbeat. Once the executor is shut down such timers are dropped:
 * the returned handle is inert and its {@code cancel()} returns {@code false}.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private static final Cancellable DROPPED = () -> false;

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        // Deadlines in the past run immediately.
        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        final ScheduledFuture<?> future;
        try {
            future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            if (executor.isShutdown()) {
                return DROPPED;
            }
            throw e;
        }
        return () -> future.cancel(false);
    }
}
