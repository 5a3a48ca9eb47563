package com.questrail.phoenix.transport;

/**
 * Creates a fresh {@link SocketTransport} for each connect or reconnect.
 */
@FunctionalInterface
public interface SocketTransportFactory
{
    SocketTransport create();
}
