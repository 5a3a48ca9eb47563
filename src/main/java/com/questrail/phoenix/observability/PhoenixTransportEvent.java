package com.questrail.phoenix.observability;

import java.time.Instant;
import java.util.Objects;

/**
 * Transport lifecycle observation.
 *
 * @param detail URL, close reason or error text; empty when not applicable
 */
public record PhoenixTransportEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        CONNECTING,
        OPENED,
        CLOSED,
        ERROR,
        DISCONNECTED
    }

    public PhoenixTransportEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
    }
}
