package com.questrail.phoenix.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the socket.
 */
public record PhoenixErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
