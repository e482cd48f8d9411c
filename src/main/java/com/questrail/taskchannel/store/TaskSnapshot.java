package com.questrail.taskchannel.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable view of one task as last reported by the server.
 *
 * @param taskId    task identifier
 * @param status    lifecycle status
 * @param progress  percent complete, 0..100
 * @param result    result payload of a completed task, otherwise {@code null}
 * @param error     failure description of a failed task, otherwise {@code null}
 * @param updatedAt wall-clock time of the last change
 */
public record TaskSnapshot(String taskId, TaskStatus status, int progress, Object result, String error, Instant updatedAt)
{
    public TaskSnapshot {
        Objects.requireNonNull(taskId, "taskId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(updatedAt, "updatedAt");
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be within 0..100");
        }
    }

    public static TaskSnapshot pending(String taskId, Instant at) {
        return new TaskSnapshot(taskId, TaskStatus.PENDING, 0, null, null, at);
    }

    TaskSnapshot running(int newProgress, Instant at) {
        return new TaskSnapshot(taskId, TaskStatus.RUNNING, newProgress, result, error, at);
    }

    TaskSnapshot completed(Object newResult, Instant at) {
        return new TaskSnapshot(taskId, TaskStatus.COMPLETED, 100, newResult, null, at);
    }

    TaskSnapshot failed(String newError, Instant at) {
        return new TaskSnapshot(taskId, TaskStatus.FAILED, 0, null, newError, at);
    }
}
