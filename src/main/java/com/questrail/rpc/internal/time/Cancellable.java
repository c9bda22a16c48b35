package com.questrail.rpc.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a pending scheduled step of a client lifecycle (a backoff delay,
 * the wait between heartbeat rounds, or a heartbeat timeout).
 *
 * <p>
 * A client keeps the handle of its pending step so that closing the client
 * stops the lifecycle from scheduling anything further.
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

    /**
     * A handle with nothing behind it. Used as the initial "no pending step".
     */
    Cancellable NONE = () -> false;
}
