package com.questrail.phoenix.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for heartbeat cadence and reconnect delays.
 *
 * <p>
 * Timer deadlines are expressed against this clock, never against wall-clock
 * time, so NTP or DST adjustments cannot stall or burst heartbeats.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
