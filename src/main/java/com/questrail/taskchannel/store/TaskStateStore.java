package com.questrail.taskchannel.store;

import com.questrail.taskchannel.api.TaskChannel;
import com.questrail.taskchannel.api.TaskEventListener;
import com.questrail.taskchannel.api.TaskSubscription;
import com.questrail.taskchannel.internal.time.WallClock;
import com.questrail.taskchannel.model.FrameType;
import com.questrail.taskchannel.model.InboundFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * TaskStateStore
 * =============================================================================
 * Keeps a snapshot per watched task in step with the frames a {@link TaskChannel}
 * delivers.
 *
 * <pre>
 *   watch(id)      → PENDING, progress 0
 *   task_update    → RUNNING, progress = data.progress (unchanged when absent)
 *   task_complete  → COMPLETED, progress 100, result = data.result
 *   task_error     → FAILED, progress 0, error = data.error
 * </pre>
 *
 * <p>Frames arrive on the channel's callback path; listeners are invoked on that path
 * too and must not block.</p>
 */
public final class TaskStateStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TaskStateStore.class);

    private final TaskChannel channel;
    private final WallClock wallClock;
    private final TaskEventListener frameListener = this::onFrame;

    private final Map<String, TaskSnapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, TaskSubscription> subscriptions = new ConcurrentHashMap<>();
    private final List<TaskStateListener> listeners = new CopyOnWriteArrayList<>();

    public TaskStateStore(TaskChannel channel) {
        this(channel, WallClock.system());
    }

    public TaskStateStore(TaskChannel channel, WallClock wallClock) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Start tracking a task. Watching an already watched task returns its current snapshot,
     * subscribing again if the channel has dropped the subscription (after {@code disconnect()}).
     *
     * @throws IllegalArgumentException if {@code taskId} is blank
     */
    public TaskSnapshot watch(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("Task ID is required");
        }

        TaskSnapshot existing = snapshots.get(taskId);
        TaskSubscription subscription = subscriptions.get(taskId);
        if (existing != null && subscription != null && subscription.isActive()) {
            return existing;
        }

        TaskSnapshot pending = TaskSnapshot.pending(taskId, wallClock.now());
        TaskSnapshot previous = snapshots.putIfAbsent(taskId, pending);
        subscriptions.compute(taskId, (id, current) ->
                current != null && current.isActive() ? current : channel.subscribe(id, frameListener));

        if (previous == null) {
            notifyListeners(null, pending);
            return pending;
        }
        return previous;
    }

    /**
     * Stop tracking a task and forget its snapshot.
     *
     * @return {@code true} if the task was being watched
     */
    public boolean unwatch(String taskId) {
        if (taskId == null) {
            return false;
        }
        TaskSubscription subscription = subscriptions.remove(taskId);
        if (subscription != null) {
            subscription.cancel();
        }
        return snapshots.remove(taskId) != null;
    }

    public Optional<TaskSnapshot> snapshot(String taskId) {
        return taskId == null ? Optional.empty() : Optional.ofNullable(snapshots.get(taskId));
    }

    public Map<String, TaskSnapshot> snapshots() {
        return Map.copyOf(snapshots);
    }

    public void addListener(TaskStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(TaskStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Unwatch every task. Listeners are kept.
     */
    @Override
    public void close() {
        for (String taskId : List.copyOf(subscriptions.keySet())) {
            unwatch(taskId);
        }
        snapshots.clear();
    }

    private void onFrame(InboundFrame frame) {
        if (!frame.hasTaskId()) {
            return;
        }
        FrameType type = frame.knownType().orElse(null);
        if (type == null) {
            return;
        }

        TaskSnapshot previous = snapshots.get(frame.taskId());
        if (previous == null) {
            return;
        }

        Instant now = wallClock.now();
        TaskSnapshot next = switch (type) {
            case TASK_UPDATE -> previous.running(progressOf(frame, previous.progress()), now);
            case TASK_COMPLETE -> previous.completed(frame.dataValue("result").orElse(null), now);
            case TASK_ERROR -> previous.failed(frame.dataValue("error").map(Object::toString).orElse("Task failed"), now);
            default -> null;
        };
        if (next == null) {
            return;
        }

        // unwatch() may have raced us; do not resurrect a forgotten task.
        if (snapshots.replace(frame.taskId(), previous, next)) {
            notifyListeners(previous, next);
        }
    }

    private static int progressOf(InboundFrame frame, int fallback) {
        Object value = frame.data().get("progress");
        if (value instanceof Number number) {
            return clamp(Math.round(number.floatValue()));
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return clamp(Math.round(Float.parseFloat(text.trim())));
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric progress '{}' for task {}", text, frame.taskId());
            }
        }
        return fallback;
    }

    private static int clamp(int progress) {
        return Math.max(0, Math.min(100, progress));
    }

    private void notifyListeners(TaskSnapshot previous, TaskSnapshot current) {
        for (TaskStateListener listener : listeners) {
            try {
                listener.onTaskChanged(previous, current);
            } catch (RuntimeException e) {
                log.warn("Task state listener failed for task {}", current.taskId(), e);
            }
        }
    }
}
