package com.questrail.taskchannel.api;

/**
 * Handle for one callback subscribed to one task id.
 *
 * <p>{@link #cancel()} is equivalent to {@code channel.unsubscribe(taskId(), callback)}.</p>
 */
public interface TaskSubscription extends Registration
{
    String taskId();

    /**
     * {@code false} once the callback is no longer registered, whether through
     * {@link #cancel()}, {@code unsubscribe} or a channel {@code disconnect()}.
     */
    boolean isActive();
}
