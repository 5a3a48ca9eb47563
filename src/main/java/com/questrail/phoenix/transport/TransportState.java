package com.questrail.phoenix.transport;

/**
 * Lifecycle state reported by a {@link SocketTransport}.
 */
public enum TransportState
{
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
