package com.questrail.taskchannel.internal.heartbeat;

import com.questrail.taskchannel.internal.time.Cancellable;
import com.questrail.taskchannel.internal.time.MonotonicScheduler;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * HeartbeatMonitor
 * =============================================================================
 * Liveness probe for an open connection. Detects half-open sockets that still
 * accept writes but no longer deliver reads.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Every {@code interval} the probe sender is invoked and a {@code timeout} timer is
 *       armed unless one is already pending. A refused write does not skip the timer.</li>
 *   <li>{@link #onAck()} cancels the pending timer.</li>
 *   <li>If the timer fires first, the monitor stops itself and runs the timeout action
 *       exactly once. The owner decides what a timeout means.</li>
 * </ul>
 *
 * <h2>Stale timers</h2>
 * Every {@link #start()} and {@link #stop()} bumps a generation counter. Timer tasks
 * capture the generation they were armed under and do nothing when it has moved on, so
 * a cancelled task that was already queued cannot fire a probe or timeout.
 *
 * <p>Not thread-safe. Expected to be driven through a serialized scheduler.</p>
 */
public final class HeartbeatMonitor {

    private final MonotonicScheduler scheduler;
    private final Duration interval;
    private final Duration timeout;
    private final BooleanSupplier probeSender;
    private final Runnable timeoutAction;

    private long generation;
    private boolean running;
    private Cancellable intervalTimer;
    private Cancellable timeoutTimer;
    private long lastProbeSentAtNanos = -1L;
    private long lastAckAtNanos = -1L;
    private boolean ackedSinceProbe;

    /**
     * @param scheduler     scheduler for interval and timeout timers
     * @param interval      time between probes
     * @param timeout       time allowed for an acknowledgment; must be shorter than {@code interval}
     * @param probeSender   writes one probe frame; returns {@code false} if it could not be written
     * @param timeoutAction invoked when an acknowledgment does not arrive in time
     */
    public HeartbeatMonitor(MonotonicScheduler scheduler,
                            Duration interval,
                            Duration timeout,
                            BooleanSupplier probeSender,
                            Runnable timeoutAction) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.probeSender = Objects.requireNonNull(probeSender, "probeSender");
        this.timeoutAction = Objects.requireNonNull(timeoutAction, "timeoutAction");

        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (timeout.compareTo(interval) >= 0) {
            throw new IllegalArgumentException("timeout must be shorter than interval");
        }
    }

    /**
     * Begin probing. Restarts cleanly if already running.
     */
    public void start() {
        stop();
        running = true;
        scheduleNextProbe(generation);
    }

    /**
     * Cancel both timers. Safe to call repeatedly.
     */
    public void stop() {
        generation++;
        running = false;
        cancelTimeout();
        if (intervalTimer != null) {
            intervalTimer.cancel();
            intervalTimer = null;
        }
    }

    /**
     * Record a {@code heartbeat_response}.
     */
    public void onAck() {
        lastAckAtNanos = scheduler.clock().nowNanos();
        ackedSinceProbe = true;
        cancelTimeout();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isAwaitingAck() {
        return timeoutTimer != null;
    }

    /**
     * Monotonic time of the last probe written, or -1 if none.
     */
    public long lastProbeSentAtNanos() {
        return lastProbeSentAtNanos;
    }

    /**
     * Monotonic time of the last acknowledgment, or -1 if none.
     */
    public long lastAckAtNanos() {
        return lastAckAtNanos;
    }

    private void scheduleNextProbe(long gen) {
        intervalTimer = scheduler.scheduleAfter(interval, () -> onIntervalElapsed(gen));
    }

    private void onIntervalElapsed(long gen) {
        if (!running || gen != generation) {
            return;
        }

        ackedSinceProbe = false;
        if (probeSender.getAsBoolean()) {
            lastProbeSentAtNanos = scheduler.clock().nowNanos();
        }
        // Armed even when the write was refused.
        // A synchronous transport can acknowledge before the write call returns.
        if (running && gen == generation && timeoutTimer == null && !ackedSinceProbe) {
            timeoutTimer = scheduler.scheduleAfter(timeout, () -> onTimeoutElapsed(gen));
        }

        // The probe sender may have stopped us (e.g. a write that tore the connection down).
        if (running && gen == generation) {
            scheduleNextProbe(gen);
        }
    }

    private void onTimeoutElapsed(long gen) {
        if (!running || gen != generation) {
            return;
        }
        timeoutTimer = null;
        stop();
        timeoutAction.run();
    }

    private void cancelTimeout() {
        if (timeoutTimer != null) {
            timeoutTimer.cancel();
            timeoutTimer = null;
        }
    }
}
