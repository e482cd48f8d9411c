package com.questrail.taskchannel.internal.reconnect;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectAttemptTrackerTest {

    @Test
    void countsConsecutiveAttemptsUntilReset() {
        ReconnectAttemptTracker tracker = new ReconnectAttemptTracker();
        assertEquals(0, tracker.attempts());

        assertEquals(1, tracker.recordAttempt());
        assertEquals(2, tracker.recordAttempt());
        assertEquals(2, tracker.attempts());

        tracker.reset();
        assertEquals(0, tracker.attempts());
        assertEquals(1, tracker.recordAttempt());
    }
}
