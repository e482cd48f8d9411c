package com.questrail.taskchannel.time;

import com.questrail.taskchannel.internal.time.Cancellable;
import com.questrail.taskchannel.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} or {@link #advance(Duration)} is called.
 * Tasks with equal deadlines run in submission order.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final ManualMonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public ManualMonotonicClock clock() {
        return clock;
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time.
     */
    public void runDueTasks() {
        while (!queue.isEmpty() && queue.peek().deadlineNanos <= clock.nowNanos()) {
            Scheduled next = queue.poll();
            if (next.cancelled.compareAndSet(false, true)) {
                next.task.run();
            }
        }
    }

    /**
     * Advance the clock by {@code delta}, stopping at each intermediate deadline so tasks
     * observe the time they were scheduled for.
     */
    public void advance(Duration delta) {
        long target = clock.nowNanos() + delta.toNanos();
        while (true) {
            Scheduled head = nextLive();
            if (head == null || head.deadlineNanos > target) {
                break;
            }
            if (head.deadlineNanos > clock.nowNanos()) {
                clock.advanceNanos(head.deadlineNanos - clock.nowNanos());
            }
            runDueTasks();
        }
        clock.advanceNanos(target - clock.nowNanos());
        runDueTasks();
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /**
     * Number of scheduled tasks that have neither run nor been cancelled.
     */
    public int pendingCount() {
        return (int) queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private Scheduled nextLive() {
        while (!queue.isEmpty() && queue.peek().cancelled.get()) {
            queue.poll();
        }
        return queue.peek();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        // Set when the task runs or is cancelled.
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(this.sequence, o.sequence);
        }
    }
}
