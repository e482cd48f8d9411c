package com.questrail.taskchannel.internal.subscription;

import com.questrail.taskchannel.api.TaskEventListener;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * SubscriptionRegistry
 * -----------------------------------------------------------------------------
 * Task id → ordered set of callbacks, plus frame type → ordered set of listeners.
 *
 * <ul>
 *   <li>A task id has at most one entry. It is created by the first callback and
 *       removed with the last one.</li>
 *   <li>Adding the same callback twice is a no-op, so a frame is delivered to it once.</li>
 *   <li>Lookups return snapshots; callers may mutate the registry while iterating.</li>
 * </ul>
 *
 * <p>The registry never sends frames. It reports entry creation and removal so the
 * channel can emit {@code subscribe}/{@code unsubscribe}.</p>
 *
 * <p>Not thread-safe. The owning channel serializes access.</p>
 */
public final class SubscriptionRegistry {

    private final Map<String, Set<TaskEventListener>> byTask = new LinkedHashMap<>();
    private final Map<String, Set<TaskEventListener>> byType = new LinkedHashMap<>();

    /**
     * @return {@code true} if this call created the entry for {@code taskId}
     */
    public boolean add(String taskId, TaskEventListener listener) {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(listener, "listener");

        boolean created = !byTask.containsKey(taskId);
        byTask.computeIfAbsent(taskId, id -> new LinkedHashSet<>()).add(listener);
        return created;
    }

    /**
     * @return {@code true} if this call removed the last callback and so the entry
     */
    public boolean remove(String taskId, TaskEventListener listener) {
        Set<TaskEventListener> listeners = byTask.get(taskId);
        if (listeners == null || !listeners.remove(listener)) {
            return false;
        }
        if (listeners.isEmpty()) {
            byTask.remove(taskId);
            return true;
        }
        return false;
    }

    public boolean contains(String taskId, TaskEventListener listener) {
        Set<TaskEventListener> listeners = byTask.get(taskId);
        return listeners != null && listeners.contains(listener);
    }

    public boolean hasSubscription(String taskId) {
        return byTask.containsKey(taskId);
    }

    public List<TaskEventListener> listenersFor(String taskId) {
        Set<TaskEventListener> listeners = byTask.get(taskId);
        return listeners == null ? List.of() : List.copyOf(listeners);
    }

    public int listenerCount(String taskId) {
        Set<TaskEventListener> listeners = byTask.get(taskId);
        return listeners == null ? 0 : listeners.size();
    }

    /**
     * Task ids with live callbacks, in the order they were first subscribed.
     */
    public List<String> taskIds() {
        return List.copyOf(byTask.keySet());
    }

    public void addTypeListener(String type, TaskEventListener listener) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");
        byType.computeIfAbsent(type, t -> new LinkedHashSet<>()).add(listener);
    }

    public boolean removeTypeListener(String type, TaskEventListener listener) {
        Set<TaskEventListener> listeners = byType.get(type);
        if (listeners == null || !listeners.remove(listener)) {
            return false;
        }
        if (listeners.isEmpty()) {
            byType.remove(type);
        }
        return true;
    }

    public boolean containsTypeListener(String type, TaskEventListener listener) {
        Set<TaskEventListener> listeners = byType.get(type);
        return listeners != null && listeners.contains(listener);
    }

    public List<TaskEventListener> typeListenersFor(String type) {
        Set<TaskEventListener> listeners = byType.get(type);
        return listeners == null ? List.of() : List.copyOf(listeners);
    }

    public boolean isEmpty() {
        return byTask.isEmpty() && byType.isEmpty();
    }

    public void clear() {
        byTask.clear();
        byType.clear();
    }
}
