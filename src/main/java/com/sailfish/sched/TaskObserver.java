package com.sailfish.sched;

import com.sailfish.sched.model.TaskStatus;

/**
 * Receives status transitions of the tasks it is attached to.
 * Calls are made synchronously on the thread executing the task, so implementations
 * must be quick and safe to invoke from several worker threads at once.
 */
@FunctionalInterface
public interface TaskObserver {

    /**
     * Called once per transition, after the task's status has been updated.
     *
     * @param task      The task whose status changed. Must not be mutated.
     * @param oldStatus The status immediately before the transition.
     * @param newStatus The status immediately after the transition.
     */
    void onTransition(Task task, TaskStatus oldStatus, TaskStatus newStatus);
}
