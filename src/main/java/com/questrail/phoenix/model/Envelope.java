package com.questrail.phoenix.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Envelope
 * =============================================================================
 * The four-field message unit exchanged over the socket.
 *
 * <pre>
 *   {"topic": string, "event": string, "payload": any, "ref": integer|null}
 * </pre>
 *
 * <h2>Ref fidelity</h2>
 * An absent ref ({@code null} on the wire) is {@link OptionalLong#empty()}. It is
 * never coerced to {@code 0} or {@code -1}; {@code 0} is a real ref value (the
 * socket uses it for synthetic {@code phx_error} deliveries).
 *
 * <p>The payload is an opaque JSON tree. A missing payload is normalized to
 * JSON {@code null}.</p>
 */
public record Envelope(
    String topic,
    String event,
    JsonNode payload,
    OptionalLong ref
) {
    /** Topic used for socket-level (non-channel) messages such as heartbeats. */
    public static final String PHOENIX_TOPIC = "phoenix";

    public static final String HEARTBEAT_EVENT = "heartbeat";

    /** Event delivered to channels when the underlying connection drops. */
    public static final String CHANNEL_ERROR_EVENT = "phx_error";

    public Envelope {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(ref, "ref");
        payload = payload == null ? NullNode.getInstance() : payload;
    }

    public static Envelope of(String topic, String event, JsonNode payload, long ref) {
        return new Envelope(topic, event, payload, OptionalLong.of(ref));
    }

    public static Envelope withoutRef(String topic, String event, JsonNode payload) {
        return new Envelope(topic, event, payload, OptionalLong.empty());
    }

    /**
     * {@code {"topic":"phoenix","event":"heartbeat","payload":{},"ref":ref}}
     */
    public static Envelope heartbeat(long ref) {
        return of(PHOENIX_TOPIC, HEARTBEAT_EVENT, JsonNodeFactory.instance.objectNode(), ref);
    }
}
