package com.questrail.phoenix.observability;

/**
 * Receives socket observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>All callbacks are made from the socket's serialized context, except
 * {@link #onError(PhoenixErrorEvent)} which may also be reported by the
 * transport I/O thread.</p>
 */
public interface PhoenixObservabilitySink {
    /**
     * Called when the transport changes lifecycle (connecting, open, closed, error).
     * @param event the transport event
     */
    void onTransportEvent(PhoenixTransportEvent event);

    /**
     * Called for socket-level protocol activity (heartbeat, reconnect scheduling).
     * @param event the protocol event
     */
    void onProtocolEvent(PhoenixProtocolEvent event);

    /**
     * Called when an inbound message cannot be decoded or a task fails.
     * @param event the error event
     */
    void onError(PhoenixErrorEvent event);
}
