package com.questrail.taskchannel.core;

import com.questrail.taskchannel.api.ChannelError;
import com.questrail.taskchannel.api.ChannelErrorKind;
import com.questrail.taskchannel.api.ChannelStateListener;
import com.questrail.taskchannel.api.ChannelStatus;
import com.questrail.taskchannel.api.ConnectionState;
import com.questrail.taskchannel.api.Registration;
import com.questrail.taskchannel.api.TaskChannel;
import com.questrail.taskchannel.api.TaskEventListener;
import com.questrail.taskchannel.api.TaskSubscription;
import com.questrail.taskchannel.codec.FrameCodec;
import com.questrail.taskchannel.config.ChannelConfig;
import com.questrail.taskchannel.internal.dispatch.MessageDispatcher;
import com.questrail.taskchannel.internal.heartbeat.HeartbeatMonitor;
import com.questrail.taskchannel.internal.queue.EncodedFrame;
import com.questrail.taskchannel.internal.queue.OutboundQueue;
import com.questrail.taskchannel.internal.reconnect.ReconnectAttemptTracker;
import com.questrail.taskchannel.internal.reconnect.ReconnectPolicy;
import com.questrail.taskchannel.internal.subscription.SubscriptionRegistry;
import com.questrail.taskchannel.internal.time.Cancellable;
import com.questrail.taskchannel.internal.time.MonotonicScheduler;
import com.questrail.taskchannel.internal.time.SerializedScheduler;
import com.questrail.taskchannel.internal.time.WallClock;
import com.questrail.taskchannel.model.FrameType;
import com.questrail.taskchannel.model.OutboundFrame;
import com.questrail.taskchannel.observability.ChannelErrorEvent;
import com.questrail.taskchannel.observability.ChannelObservabilitySink;
import com.questrail.taskchannel.observability.ChannelReconnectEvent;
import com.questrail.taskchannel.observability.ChannelStateTransitionEvent;
import com.questrail.taskchannel.observability.ChannelTransportEvent;
import com.questrail.taskchannel.observability.NullObservabilitySink;
import com.questrail.taskchannel.transport.ChannelTransport;
import com.questrail.taskchannel.transport.ChannelTransportListener;
import com.questrail.taskchannel.transport.TransportConnection;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ResilientTaskChannel
 * =============================================================================
 * Connection manager and public face of the task channel. Owns the transport
 * connection and orchestrates the outbound queue, subscription registry, heartbeat
 * monitor, reconnect policy and message dispatcher.
 *
 * <h2>State machine</h2>
 * <pre>
 *   IDLE ──connect()──► CONNECTING ──open──► OPEN
 *                          ▲                  │ unexpected loss / heartbeat timeout
 *                          │ backoff elapsed  ▼
 *                          └────────────── RECONNECTING ──attempts exhausted──► CLOSED
 *
 *   any ──disconnect()──► CLOSED
 * </pre>
 *
 * <h2>On entering OPEN</h2>
 * <ol>
 *   <li>Reset the attempt counter and last error.</li>
 *   <li>Start the heartbeat monitor.</li>
 *   <li>Flush the outbound queue in insertion order.</li>
 *   <li>Send {@code subscribe} for every task id with a live callback that the flush did
 *       not already cover. Each physical connection is a fresh server session.</li>
 * </ol>
 *
 * <h2>Execution model</h2>
 * Every entry point (consumer call, transport callback, timer) runs while holding a
 * single channel-owned monitor, so state is mutated one event at a time no matter which
 * thread delivers the event. Nothing here blocks on I/O. Consumer callbacks run under
 * the monitor and may call back into the channel.
 *
 * <h2>Connection identity</h2>
 * Each open attempt gets its own {@link Attempt} listener. Events from any attempt other
 * than the current one are ignored, which keeps at most one connection live.
 */
public final class ResilientTaskChannel implements TaskChannel {

    private final ChannelConfig config;
    private final ChannelTransport transport;
    private final FrameCodec codec;
    private final WallClock wallClock;
    private final ChannelObservabilitySink sink;
    private final ReconnectPolicy reconnectPolicy;

    private final Object lock = new Object();
    private final MonotonicScheduler timers;

    private final OutboundQueue queue = new OutboundQueue();
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final ReconnectAttemptTracker attempts = new ReconnectAttemptTracker();
    private final HeartbeatMonitor heartbeat;
    private final MessageDispatcher dispatcher;
    private final List<ChannelStateListener> stateListeners = new CopyOnWriteArrayList<>();

    // Task ids whose subscribe frame has been written on the current connection.
    private final Set<String> sessionSubscriptions = new HashSet<>();

    private ConnectionState state = ConnectionState.IDLE;
    private ChannelError lastError;
    private Attempt current;
    private Cancellable reconnectTimer;
    private long reconnectGeneration;

    public ResilientTaskChannel(ChannelConfig config,
                                ChannelTransport transport,
                                FrameCodec codec,
                                MonotonicScheduler scheduler,
                                WallClock wallClock,
                                ChannelObservabilitySink observabilitySink) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.reconnectPolicy = config.reconnectPolicy();

        this.timers = new SerializedScheduler(Objects.requireNonNull(scheduler, "scheduler"), lock);
        this.heartbeat = new HeartbeatMonitor(
                timers,
                config.heartbeatInterval(),
                config.heartbeatTimeout(),
                this::sendHeartbeatProbe,
                this::onHeartbeatTimeout
        );
        this.dispatcher = new MessageDispatcher(codec, registry, heartbeat::onAck, sink, wallClock);
    }

    public ResilientTaskChannel(ChannelConfig config,
                                ChannelTransport transport,
                                FrameCodec codec,
                                MonotonicScheduler scheduler) {
        this(config, transport, codec, scheduler, WallClock.system(), null);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void connect() {
        synchronized (lock) {
            switch (state) {
                case CONNECTING:
                case OPEN:
                    return;
                case RECONNECTING:
                    // Skip the remaining backoff but keep counting attempts.
                    cancelReconnectTimer();
                    break;
                case IDLE:
                case CLOSED:
                    attempts.reset();
                    lastError = null;
                    break;
                default:
                    throw new IllegalStateException("Unhandled state " + state);
            }
            openTransport("connect requested");
        }
    }

    @Override
    public void disconnect() {
        synchronized (lock) {
            cancelReconnectTimer();
            heartbeat.stop();

            Attempt attempt = current;
            current = null;
            if (attempt != null) {
                attempt.close(TransportConnection.NORMAL_CLOSURE, "Client disconnect");
            }

            registry.clear();
            sessionSubscriptions.clear();
            // Registry is gone, so queued subscription frames would describe nothing.
            queue.removeIf(f -> f.frame().isSubscriptionControl());

            ConnectionState previous = changeState(ConnectionState.CLOSED);
            if (previous != ConnectionState.CLOSED) {
                publish(previous, "disconnect requested");
            }
        }
    }

    // -------------------------------------------------------------------------
    // Subscriptions
    // -------------------------------------------------------------------------

    @Override
    public TaskSubscription subscribe(String taskId, TaskEventListener callback) {
        if (taskId == null || taskId.isBlank() || callback == null) {
            throw new IllegalArgumentException("Task ID and callback are required");
        }

        synchronized (lock) {
            if (registry.add(taskId, callback)) {
                transmitOrQueue(encode(OutboundFrame.subscribe(taskId, wallClock.nowMillis())));
            }
        }
        return new CallbackSubscription(taskId, callback);
    }

    @Override
    public void unsubscribe(String taskId, TaskEventListener callback) {
        if (taskId == null || callback == null) {
            return;
        }
        synchronized (lock) {
            if (registry.remove(taskId, callback)) {
                transmitOrQueue(encode(OutboundFrame.unsubscribe(taskId, wallClock.nowMillis())));
            }
        }
    }

    @Override
    public Registration onFrameType(String type, TaskEventListener listener) {
        if (type == null || type.isBlank() || listener == null) {
            throw new IllegalArgumentException("Frame type and listener are required");
        }
        synchronized (lock) {
            registry.addTypeListener(type, listener);
        }
        return () -> {
            synchronized (lock) {
                return registry.removeTypeListener(type, listener);
            }
        };
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    @Override
    public boolean send(OutboundFrame frame) {
        Objects.requireNonNull(frame, "frame");
        EncodedFrame encoded = encode(frame);
        synchronized (lock) {
            return transmitOrQueue(encoded);
        }
    }

    private EncodedFrame encode(OutboundFrame frame) {
        return new EncodedFrame(frame, codec.encode(frame));
    }

    /**
     * Write now when open and nothing is waiting ahead of the frame, otherwise queue it.
     */
    private boolean transmitOrQueue(EncodedFrame frame) {
        if (state == ConnectionState.OPEN && queue.isEmpty() && write(frame)) {
            return true;
        }
        queue.enqueue(frame);
        return false;
    }

    private boolean write(EncodedFrame frame) {
        Attempt attempt = current;
        if (state != ConnectionState.OPEN || attempt == null || attempt.connection == null) {
            return false;
        }
        if (!attempt.connection.send(frame.payload())) {
            return false;
        }

        OutboundFrame written = frame.frame();
        if (written.isType(FrameType.SUBSCRIBE)) {
            sessionSubscriptions.add(written.taskId());
        }
        else if (written.isType(FrameType.UNSUBSCRIBE)) {
            sessionSubscriptions.remove(written.taskId());
        }
        return true;
    }

    private boolean sendHeartbeatProbe() {
        return write(encode(OutboundFrame.heartbeat(wallClock.nowMillis())));
    }

    // -------------------------------------------------------------------------
    // Observable state
    // -------------------------------------------------------------------------

    @Override
    public Registration addStateListener(ChannelStateListener listener) {
        Objects.requireNonNull(listener, "listener");
        stateListeners.add(listener);
        return () -> stateListeners.remove(listener);
    }

    @Override
    public ConnectionState state() {
        synchronized (lock) {
            return state;
        }
    }

    @Override
    public ChannelStatus status() {
        synchronized (lock) {
            return snapshot();
        }
    }

    @Override
    public ChannelError lastError() {
        synchronized (lock) {
            return lastError;
        }
    }

    @Override
    public List<String> subscribedTaskIds() {
        synchronized (lock) {
            return registry.taskIds();
        }
    }

    @Override
    public int pendingFrameCount() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public ChannelConfig config() {
        return config;
    }

    // -------------------------------------------------------------------------
    // Transitions
    // -------------------------------------------------------------------------

    private void openTransport(String reason) {
        Attempt attempt = new Attempt();
        current = attempt;

        ConnectionState previous = changeState(ConnectionState.CONNECTING);
        sink.onTransportEvent(new ChannelTransportEvent(
                wallClock.now(), ChannelTransportEvent.Kind.OPENING, 0, config.baseUrl().toString()));

        try {
            TransportConnection handle = transport.open(config.connectionUri(), attempt);
            if (attempt.connection == null) {
                attempt.connection = handle;
            }
        } catch (RuntimeException e) {
            if (current == attempt) {
                handleLoss(ChannelErrorKind.TRANSPORT_OPEN_FAILURE, "Failed to open transport: " + e.getMessage(), e);
            }
            else {
                sink.onError(new ChannelErrorEvent(wallClock.now(), ChannelErrorKind.TRANSPORT_OPEN_FAILURE,
                        "Superseded open attempt failed: " + e.getMessage(), e));
            }
            return;
        }

        // A synchronous transport may already have moved us on; only announce what still holds.
        if (current == attempt && state == ConnectionState.CONNECTING) {
            publish(previous, reason);
        }
    }

    private void handleOpen(Attempt attempt) {
        attempts.reset();
        lastError = null;
        ConnectionState previous = changeState(ConnectionState.OPEN);

        sink.onTransportEvent(new ChannelTransportEvent(
                wallClock.now(), ChannelTransportEvent.Kind.OPENED, 0, config.baseUrl().toString()));

        heartbeat.start();
        queue.flush(this::write);
        resubscribe();

        if (current == attempt && state == ConnectionState.OPEN) {
            publish(previous, "transport open");
        }
    }

    private void resubscribe() {
        for (String taskId : registry.taskIds()) {
            if (current == null || state != ConnectionState.OPEN) {
                return;
            }
            if (!sessionSubscriptions.contains(taskId)) {
                // Not queued on failure: the next open resends from the registry anyway.
                write(encode(OutboundFrame.subscribe(taskId, wallClock.nowMillis())));
            }
        }
    }

    /**
     * Unexpected loss: open failure, remote close, or heartbeat timeout.
     */
    private void handleLoss(ChannelErrorKind kind, String message, Throwable cause) {
        heartbeat.stop();
        sessionSubscriptions.clear();
        current = null;

        lastError = new ChannelError(kind, message, wallClock.now());
        sink.onError(new ChannelErrorEvent(lastError.timestamp(), kind, message, cause));

        int attempt = attempts.recordAttempt();
        if (reconnectPolicy.isExhausted(attempt)) {
            String exhausted = "Gave up after " + reconnectPolicy.maxAttempts() + " reconnection attempts";
            lastError = new ChannelError(ChannelErrorKind.RECONNECT_EXHAUSTED, exhausted, wallClock.now());
            sink.onError(new ChannelErrorEvent(lastError.timestamp(), ChannelErrorKind.RECONNECT_EXHAUSTED, exhausted, cause));

            ConnectionState previous = changeState(ConnectionState.CLOSED);
            publish(previous, "reconnect attempts exhausted");
            return;
        }

        Duration delay = reconnectPolicy.nextDelay(attempt);
        ConnectionState previous = changeState(ConnectionState.RECONNECTING);

        long generation = ++reconnectGeneration;
        reconnectTimer = timers.scheduleAfter(delay, () -> onReconnectDue(generation));
        sink.onReconnectScheduled(new ChannelReconnectEvent(
                wallClock.now(), attempt, reconnectPolicy.maxAttempts(), delay));

        publish(previous, kind.name().toLowerCase(Locale.ROOT));
    }

    private void onReconnectDue(long generation) {
        if (state != ConnectionState.RECONNECTING || generation != reconnectGeneration) {
            return;
        }
        reconnectTimer = null;
        openTransport("reconnect attempt " + attempts.attempts());
    }

    private void onHeartbeatTimeout() {
        Attempt attempt = current;
        if (state != ConnectionState.OPEN || attempt == null) {
            return;
        }

        // Detach first so the close callback of this connection is ignored.
        current = null;
        attempt.close(TransportConnection.HEARTBEAT_TIMEOUT, "Heartbeat timeout");
        sink.onTransportEvent(new ChannelTransportEvent(
                wallClock.now(), ChannelTransportEvent.Kind.FORCED_CLOSE,
                TransportConnection.HEARTBEAT_TIMEOUT, "Heartbeat timeout"));

        handleLoss(ChannelErrorKind.HEARTBEAT_TIMEOUT,
                "No heartbeat response within " + config.heartbeatTimeout().toMillis() + "ms", null);
    }

    private void cancelReconnectTimer() {
        reconnectGeneration++;
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    private ConnectionState changeState(ConnectionState next) {
        ConnectionState previous = state;
        state = next;
        return previous;
    }

    private ChannelStatus snapshot() {
        return new ChannelStatus(state, lastError, attempts.attempts());
    }

    private void publish(ConnectionState previous, String reason) {
        sink.onStateTransition(new ChannelStateTransitionEvent(wallClock.now(), previous, state, reason));

        ChannelStatus status = snapshot();
        for (ChannelStateListener listener : stateListeners) {
            try {
                listener.onStatusChanged(status);
            } catch (RuntimeException e) {
                sink.onError(new ChannelErrorEvent(
                        wallClock.now(), ChannelErrorKind.CALLBACK_ERROR, "State listener failed", e));
            }
        }
    }

    // -------------------------------------------------------------------------
    // Transport listener (one per open attempt)
    // -------------------------------------------------------------------------

    private final class Attempt implements ChannelTransportListener {
        private TransportConnection connection;
        private boolean opened;
        private boolean closeRequested;

        private void close(int code, String reason) {
            closeRequested = true;
            if (connection != null) {
                connection.close(code, reason);
            }
        }

        @Override
        public void onOpen(TransportConnection openedConnection) {
            synchronized (lock) {
                if (current != this || closeRequested) {
                    openedConnection.close(TransportConnection.NORMAL_CLOSURE, "Superseded");
                    return;
                }
                connection = openedConnection;
                opened = true;
                handleOpen(this);
            }
        }

        @Override
        public void onMessage(String payload) {
            synchronized (lock) {
                if (current != this || state != ConnectionState.OPEN) {
                    return;
                }
                dispatcher.dispatch(payload);
            }
        }

        @Override
        public void onClose(int code, String reason, Throwable cause) {
            synchronized (lock) {
                if (current != this) {
                    return;
                }
                String detail = reason == null || reason.isEmpty() ? "" : reason;
                sink.onTransportEvent(new ChannelTransportEvent(
                        wallClock.now(), ChannelTransportEvent.Kind.CLOSED, code, detail));

                if (opened) {
                    handleLoss(ChannelErrorKind.CONNECTION_LOST,
                            "Connection closed (code " + code + (detail.isEmpty() ? "" : ", " + detail) + ")", cause);
                }
                else {
                    String why = cause != null && cause.getMessage() != null ? cause.getMessage() : "code " + code;
                    handleLoss(ChannelErrorKind.TRANSPORT_OPEN_FAILURE, "Failed to open transport: " + why, cause);
                }
            }
        }
    }

    private final class CallbackSubscription implements TaskSubscription {
        private final String taskId;
        private final TaskEventListener callback;

        private CallbackSubscription(String taskId, TaskEventListener callback) {
            this.taskId = taskId;
            this.callback = callback;
        }

        @Override
        public String taskId() {
            return taskId;
        }

        @Override
        public boolean isActive() {
            synchronized (lock) {
                return registry.contains(taskId, callback);
            }
        }

        @Override
        public boolean cancel() {
            synchronized (lock) {
                if (!registry.contains(taskId, callback)) {
                    return false;
                }
                unsubscribe(taskId, callback);
                return true;
            }
        }
    }
}
