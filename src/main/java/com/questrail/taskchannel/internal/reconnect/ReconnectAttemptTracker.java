package com.questrail.taskchannel.internal.reconnect;

/**
 * Consecutive reconnection attempt counter.
 *
 * - Incremented once per scheduled retry
 * - Reset when the channel reaches OPEN (or on an explicit fresh connect)
 * - Does not encode retry policy
 */
public final class ReconnectAttemptTracker {

    private int attempts;

    /**
     * Record that a retry is about to be scheduled.
     *
     * @return the updated attempt count
     */
    public int recordAttempt() {
        return ++attempts;
    }

    public void reset() {
        attempts = 0;
    }

    /**
     * Current attempt count (0 if none).
     */
    public int attempts() {
        return attempts;
    }
}
