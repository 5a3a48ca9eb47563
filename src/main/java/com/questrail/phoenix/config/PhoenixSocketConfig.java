package com.questrail.phoenix.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for one {@code PhoenixSocket}.
 *
 * <p>The endpoint is the {@code ws://} or {@code wss://} URL of the socket,
 * without connection params; those are given to {@code connect(params)}.</p>
 *
 * <p>Heartbeats are sent every {@code heartbeatInterval} while the connection
 * is open; {@link Duration#ZERO} disables them. After a connection loss the
 * socket waits {@code reconnectDelay} before each reconnect attempt. The delay
 * is fixed, not a backoff.</p>
 *
 * <p>{@code connectTimeout} bounds both the TCP connect and the WebSocket
 * handshake of the default transport, and {@code maxFramePayloadLength} is the
 * largest inbound message it accepts.</p>
 */
public record PhoenixSocketConfig(
    URI endpoint,
    Duration heartbeatInterval,
    Duration reconnectDelay,
    Duration connectTimeout,
    int maxFramePayloadLength
) {
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(1);
    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_MAX_FRAME_PAYLOAD_LENGTH = 1024 * 1024;

    public PhoenixSocketConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        if (heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be non-negative");
        }
        if (reconnectDelay.isNegative()) {
            throw new IllegalArgumentException("reconnectDelay must be non-negative");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be positive");
        }
    }

    /**
     * Configuration with all defaults for the given endpoint.
     */
    public static PhoenixSocketConfig withDefaults(String endpoint) {
        return builder(endpoint).build();
    }

    public static Builder builder(String endpoint) {
        return new Builder(URI.create(Objects.requireNonNull(endpoint, "endpoint")));
    }

    public static Builder builder(URI endpoint) {
        return new Builder(Objects.requireNonNull(endpoint, "endpoint"));
    }

    public static final class Builder {
        private final URI endpoint;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration reconnectDelay = DEFAULT_RECONNECT_DELAY;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private int maxFramePayloadLength = DEFAULT_MAX_FRAME_PAYLOAD_LENGTH;

        private Builder(URI endpoint) {
            this.endpoint = endpoint;
        }

        public Builder withHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder withReconnectDelay(Duration reconnectDelay) {
            this.reconnectDelay = reconnectDelay;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withMaxFramePayloadLength(int maxFramePayloadLength) {
            this.maxFramePayloadLength = maxFramePayloadLength;
            return this;
        }

        public PhoenixSocketConfig build() {
            return new PhoenixSocketConfig(
                endpoint, heartbeatInterval, reconnectDelay, connectTimeout, maxFramePayloadLength);
        }
    }
}
