package com.questrail.taskchannel.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Timer surface for the channel. Deadlines are expressed against the scheduler's own
 * {@link MonotonicClock}, never in wall-clock instants.
 */
public interface MonotonicScheduler
{
    /**
     * The clock deadlines are measured against.
     */
    MonotonicClock clock();

    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in nanoseconds on {@link #clock()}
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task to run once {@code delay} has elapsed.
     */
    default Cancellable scheduleAfter(Duration delay, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        long now = clock().nowNanos();
        long delayNanos = delay.toNanos();
        // Saturate instead of wrapping for effectively-infinite delays.
        long deadline = delayNanos > Long.MAX_VALUE - now ? Long.MAX_VALUE : now + delayNanos;
        return scheduleAtNanos(deadline, task);
    }
}
