package com.questrail.phoenix.transport;

/**
 * SocketTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link SocketTransport}.
 *
 * <p>Callbacks are delivered on the transport's own thread. Receivers must not
 * block; {@code PhoenixSocket} only enqueues work from here.</p>
 *
 * <p>An error report implies the connection is gone. Implementations report
 * either {@link #didError(String)} or {@link #didClose(int, String, boolean)}
 * for a given connection loss, not both.</p>
 */
public interface SocketTransportListener
{
    /**
     * The connection is established and ready to send.
     */
    void didOpen();

    /**
     * A complete text frame arrived.
     */
    void didReceive(String text);

    /**
     * The connection failed (refused, reset, handshake rejected, protocol
     * violation).
     *
     * @param message diagnostic text; never {@code null}
     */
    void didError(String message);

    /**
     * The connection closed.
     *
     * @param code     WebSocket close status code, or {@code -1} when none was received
     * @param reason   close reason; empty when none was given
     * @param wasClean {@code true} if a close handshake completed
     */
    void didClose(int code, String reason, boolean wasClean);
}
