package com.questrail.phoenix.channel;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.OptionalLong;

/**
 * PhoenixChannel
 * -----------------------------------------------------------------------------
 * The part of a logical channel the socket needs in order to route envelopes.
 *
 * <p>Join/leave, push bookkeeping and per-event handlers are the channel's own
 * business. The socket only reads the topic and hands over inbound events.</p>
 *
 * <p>{@link #triggerEvent(String, JsonNode, OptionalLong)} is always invoked on
 * the socket's serialized context, never concurrently with another delivery
 * from the same socket.</p>
 */
public interface PhoenixChannel
{
    /**
     * The topic this channel is multiplexed under, e.g. {@code "room:lobby"}.
     */
    String topic();

    /**
     * Deliver an inbound event to this channel.
     *
     * @param event   event name, e.g. {@code "phx_reply"} or {@code "phx_error"}
     * @param payload event payload (opaque)
     * @param ref     correlation ref; empty when the server sent {@code null}
     */
    void triggerEvent(String event, JsonNode payload, OptionalLong ref);
}
