/**
 * Phoenix Socket Transport Ports
 * =============================================================================
 *
 * These interfaces define the boundary between a concrete WebSocket
 * implementation (Netty, a test double) and {@code PhoenixSocket}.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Complete inbound text messages as {@code String}</li>
 *   <li>The connect URL as a standard {@link java.net.URI}</li>
 *   <li>Lifecycle notifications (open, error, close)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no envelope decoding)</li>
 *   <li>Not send heartbeats or schedule reconnects</li>
 *   <li>Report each connection loss once</li>
 * </ul>
 */
package com.questrail.phoenix.transport;
