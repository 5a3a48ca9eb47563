package com.questrail.phoenix;

/**
 * Lifecycle observer for a {@link PhoenixSocket}.
 *
 * <p>The socket holds its delegate weakly: registering a delegate does not keep
 * it alive, and a collected delegate is simply no longer notified. Hooks are
 * invoked on the socket's serialized context after the matching callbacks
 * registered through {@code onOpen}, {@code onClose} and {@code onError}.</p>
 */
public interface PhoenixSocketDelegate
{
    void socketDidOpen();

    void socketDidClose(String reason);

    void socketDidReceiveError(String error);
}
