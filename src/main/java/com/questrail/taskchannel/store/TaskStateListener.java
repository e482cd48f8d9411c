package com.questrail.taskchannel.store;

@FunctionalInterface
public interface TaskStateListener
{
    /**
     * @param previous snapshot before the change, or {@code null} when the task was just watched
     * @param current  snapshot after the change
     */
    void onTaskChanged(TaskSnapshot previous, TaskSnapshot current);
}
