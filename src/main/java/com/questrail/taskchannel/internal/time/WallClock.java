package com.questrail.taskchannel.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used to stamp outbound frames and observability events.
 *
 * <p>May jump (NTP, manual changes). Must not drive timeouts or backoff.</p>
 */
@FunctionalInterface
public interface WallClock
{
    Instant now();

    default long nowMillis() {
        return now().toEpochMilli();
    }

    static WallClock system() {
        return Instant::now;
    }
}
