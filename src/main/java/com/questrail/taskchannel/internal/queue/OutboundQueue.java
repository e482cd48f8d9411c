package com.questrail.taskchannel.internal.queue;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * OutboundQueue
 * -----------------------------------------------------------------------------
 * FIFO buffer of frames submitted while the channel could not write them.
 *
 * <h2>Flush semantics</h2>
 * {@link #flush(Predicate)} offers frames to a writer in insertion order. A frame is
 * removed only after the writer accepts it; the first refusal stops the flush and leaves
 * that frame and everything behind it queued for the next open.
 *
 * <p>Not thread-safe. The owning channel serializes access.</p>
 */
public final class OutboundQueue {

    private final Deque<EncodedFrame> frames = new ArrayDeque<>();

    public void enqueue(EncodedFrame frame) {
        frames.addLast(Objects.requireNonNull(frame, "frame"));
    }

    /**
     * Write queued frames in order until the writer refuses one.
     *
     * @param writer returns {@code true} when the frame was handed to the transport
     * @return number of frames written
     */
    public int flush(Predicate<EncodedFrame> writer) {
        Objects.requireNonNull(writer, "writer");

        int written = 0;
        while (!frames.isEmpty()) {
            EncodedFrame next = frames.peekFirst();
            if (!writer.test(next)) {
                break;
            }
            // The writer may re-enter the channel; only drop the head if it is still ours.
            if (frames.peekFirst() == next) {
                frames.pollFirst();
            }
            written++;
        }
        return written;
    }

    public boolean removeIf(Predicate<EncodedFrame> filter) {
        return frames.removeIf(filter);
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public List<EncodedFrame> snapshot() {
        return List.copyOf(frames);
    }

    public void clear() {
        frames.clear();
    }
}
