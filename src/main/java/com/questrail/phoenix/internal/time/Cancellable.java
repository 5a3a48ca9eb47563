package com.questrail.phoenix.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Cancellation handle for a scheduled heartbeat or reconnect timer.
 *
 * <p>
 * Cancelling is idempotent. A timer that has already fired (or already enqueued
 * its work on the socket's serialized context) cannot be recalled by this
 * handle; the socket guards against that case with its own timer generation.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         was already executed or previously cancelled.
     */
    boolean cancel();
}
