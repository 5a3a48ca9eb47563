package com.questrail.phoenix.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Socket-level protocol observation: heartbeats and reconnect bookkeeping.
 */
public record PhoenixProtocolEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        HEARTBEAT_SENT,
        HEARTBEAT_SKIPPED,
        RECONNECT_SCHEDULED,
        RECONNECT_ATTEMPT,
        RECONNECT_CANCELLED
    }

    public PhoenixProtocolEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
    }
}
