package com.questrail.taskchannel.api;

import com.questrail.taskchannel.model.OutboundFrame;

import java.util.List;

/**
 * TaskChannel
 * =============================================================================
 * One logical, multiplexed push-update connection that keeps client-side task state
 * in step with server-side progress.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Construction has no side effects. Nothing is opened until {@link #connect()}.</li>
 *   <li>Transport failures never throw across this interface. They surface only through
 *       {@link #state()}, {@link #lastError()} and {@link ChannelStateListener}s.</li>
 *   <li>All callbacks are delivered serially, one inbound frame fully processed before
 *       the next is considered.</li>
 * </ul>
 */
public interface TaskChannel
{
    /**
     * Open the connection. No-op while already connecting or open. When called from
     * {@link ConnectionState#CLOSED} the reconnect counter and last error are reset.
     */
    void connect();

    /**
     * Terminal shutdown: cancels all timers, closes the transport, clears every
     * subscription and transitions to {@link ConnectionState#CLOSED}. No reconnect is
     * scheduled afterward.
     */
    void disconnect();

    /**
     * Register a callback for frames carrying {@code taskId}. The first callback for an
     * id causes a {@code subscribe} frame to be sent (queued while offline). Subscribing
     * the same callback twice has no additional effect.
     *
     * @throws IllegalArgumentException if {@code taskId} is blank or {@code callback} is null
     */
    TaskSubscription subscribe(String taskId, TaskEventListener callback);

    /**
     * Remove a callback. When the last callback for the id is removed an
     * {@code unsubscribe} frame is sent. Unknown ids or callbacks are ignored.
     */
    void unsubscribe(String taskId, TaskEventListener callback);

    /**
     * Transmit a frame now if the channel is open, otherwise append it to the outbound queue.
     *
     * @return {@code true} if written immediately, {@code false} if queued
     */
    boolean send(OutboundFrame frame);

    /**
     * Register a listener for every inbound frame of the given wire type, regardless of task id.
     */
    Registration onFrameType(String type, TaskEventListener listener);

    Registration addStateListener(ChannelStateListener listener);

    ConnectionState state();

    ChannelStatus status();

    default boolean isConnected() {
        return state() == ConnectionState.OPEN;
    }

    default boolean isReconnecting() {
        return state() == ConnectionState.RECONNECTING;
    }

    /**
     * Last transport-level error, or {@code null} when none has occurred since the last open.
     */
    ChannelError lastError();

    /**
     * Task ids with at least one live callback, in subscription order.
     */
    List<String> subscribedTaskIds();

    /**
     * Number of frames waiting in the outbound queue.
     */
    int pendingFrameCount();
}
