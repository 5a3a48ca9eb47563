package com.questrail.phoenix.transport;

import java.net.URI;

/**
 * SocketTransport
 * -----------------------------------------------------------------------------
 * Port for one persistent, bidirectional text-frame connection (a WebSocket).
 *
 * <p>The transport performs I/O only. It does not decode envelopes, send
 * heartbeats or reconnect; all of that belongs to {@code PhoenixSocket}.</p>
 *
 * <p>Implementations may be backed by Netty, the JDK HTTP client, or a test
 * double. Listener callbacks may arrive on any thread.</p>
 */
public interface SocketTransport
{
    /**
     * Register the listener that receives lifecycle and message callbacks.
     *
     * <p>Passing {@code null} silences the transport: events raised after the
     * call are dropped.</p>
     */
    void setListener(SocketTransportListener listener);

    /**
     * Set the endpoint the next {@link #open()} connects to.
     */
    void setUrl(URI url);

    /**
     * Begin connecting. Completion is reported asynchronously through
     * {@link SocketTransportListener#didOpen()} or
     * {@link SocketTransportListener#didError(String)}.
     */
    void open();

    /**
     * Begin an orderly close. Safe to call in any state.
     */
    void close();

    /**
     * Send one text frame.
     *
     * @throws IllegalStateException if the transport is not {@link TransportState#OPEN}
     */
    void send(String text);

    TransportState state();
}
