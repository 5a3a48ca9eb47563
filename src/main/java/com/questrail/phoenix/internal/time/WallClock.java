package com.questrail.phoenix.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source used strictly for observability timestamps.
 *
 * <p>
 * This clock may jump due to DST, NTP adjustments, or explicit time setting.
 * It MUST NOT be used for heartbeat cadence or reconnect delays.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
