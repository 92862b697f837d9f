package com.sailfish.sched.model;

/**
 * Represents the lifecycle statuses of a scheduled task.
 * A task only ever moves forward: PENDING, then RUNNING, then one of the terminal statuses.
 */
public enum TaskStatus {
    /**
     * Task has been created and is waiting to be executed.
     */
    PENDING,
    /**
     * Task is currently being executed by a worker.
     */
    RUNNING,
    /**
     * Task execution completed successfully.
     */
    COMPLETED,
    /**
     * Task execution failed. No further transitions occur.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
