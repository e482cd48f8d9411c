package com.questrail.taskchannel.internal.time;

import java.util.Objects;

/**
 * Decorates a {@link MonotonicScheduler} so every task runs while holding a given monitor.
 *
 * <p>The channel hands this to its timer-driven components so that timer firings are
 * serialized with transport events and consumer calls. A task cancelled while it was
 * already waiting for the monitor may still run; callers guard against that with their
 * own generation checks.</p>
 */
public final class SerializedScheduler implements MonotonicScheduler {

    private final MonotonicScheduler delegate;
    private final Object monitor;

    public SerializedScheduler(MonotonicScheduler delegate, Object monitor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.monitor = Objects.requireNonNull(monitor, "monitor");
    }

    @Override
    public MonotonicClock clock() {
        return delegate.clock();
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");
        return delegate.scheduleAtNanos(deadlineNanos, () -> {
            synchronized (monitor) {
                task.run();
            }
        });
    }
}
