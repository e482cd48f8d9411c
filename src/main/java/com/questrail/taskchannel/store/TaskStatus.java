package com.questrail.taskchannel.store;

/**
 * Client-side lifecycle of a watched task.
 */
public enum TaskStatus
{
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
