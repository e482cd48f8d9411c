package com.questrail.taskchannel.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational decision in the channel: heartbeat cadence,
 * heartbeat timeouts and reconnect backoff.
 *
 * <p>Wall-clock time ({@link WallClock}) is only used to stamp frames and
 * observability events.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    /**
     * Monotonically non-decreasing tick in nanoseconds. Only differences are meaningful.
     */
    long nowNanos();

    /**
     * Clock backed by {@link System#nanoTime()}.
     */
    static MonotonicClock system() {
        return System::nanoTime;
    }
}
