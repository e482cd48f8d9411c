package com.questrail.taskchannel.internal.time;

/**
 * Cancellation handle for a scheduled timer (heartbeat interval, heartbeat timeout,
 * reconnect backoff).
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
