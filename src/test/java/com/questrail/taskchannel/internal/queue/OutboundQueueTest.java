package com.questrail.taskchannel.internal.queue;

import com.questrail.taskchannel.model.OutboundFrame;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * OutboundQueueTest
 * -----------------------------------------------------------------------------
 * Insertion order, partial flushes and filtering.
 */
class OutboundQueueTest {

    private static EncodedFrame frame(String name) {
        return new EncodedFrame(OutboundFrame.of(name, Map.of(), 0L), "{\"type\":\"" + name + "\"}");
    }

    @Test
    void flushWritesFramesInInsertionOrder() {
        OutboundQueue queue = new OutboundQueue();
        queue.enqueue(frame("a"));
        queue.enqueue(frame("b"));
        queue.enqueue(frame("c"));

        List<String> written = new ArrayList<>();
        int count = queue.flush(f -> written.add(f.frame().type()));

        assertEquals(3, count);
        assertEquals(List.of("a", "b", "c"), written);
        assertTrue(queue.isEmpty());
    }

    @Test
    void flushStopsAtFirstRefusalAndKeepsRemainder() {
        OutboundQueue queue = new OutboundQueue();
        queue.enqueue(frame("a"));
        queue.enqueue(frame("b"));
        queue.enqueue(frame("c"));

        List<String> written = new ArrayList<>();
        int count = queue.flush(f -> {
            if (f.frame().type().equals("b")) {
                return false;
            }
            written.add(f.frame().type());
            return true;
        });

        assertEquals(1, count);
        assertEquals(List.of("a"), written);
        assertEquals(2, queue.size());
        assertEquals("b", queue.snapshot().get(0).frame().type());
        assertEquals("c", queue.snapshot().get(1).frame().type());
    }

    @Test
    void flushOfEmptyQueueWritesNothing() {
        OutboundQueue queue = new OutboundQueue();
        assertEquals(0, queue.flush(f -> fail("nothing to write")));
    }

    @Test
    void writerThatClearsQueueDoesNotLoseOrDuplicateFrames() {
        OutboundQueue queue = new OutboundQueue();
        queue.enqueue(frame("a"));
        queue.enqueue(frame("b"));

        int count = queue.flush(f -> {
            queue.clear();
            return true;
        });

        assertEquals(1, count);
        assertTrue(queue.isEmpty());
    }

    @Test
    void removeIfDropsMatchingFramesOnly() {
        OutboundQueue queue = new OutboundQueue();
        queue.enqueue(new EncodedFrame(OutboundFrame.subscribe("T1", 0L), "s"));
        queue.enqueue(frame("custom"));
        queue.enqueue(new EncodedFrame(OutboundFrame.unsubscribe("T1", 0L), "u"));

        assertTrue(queue.removeIf(f -> f.frame().isSubscriptionControl()));

        assertEquals(1, queue.size());
        assertEquals("custom", queue.snapshot().get(0).frame().type());
    }

    @Test
    void snapshotIsImmutableCopy() {
        OutboundQueue queue = new OutboundQueue();
        queue.enqueue(frame("a"));

        List<EncodedFrame> snapshot = queue.snapshot();
        queue.clear();

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(frame("b")));
    }
}
