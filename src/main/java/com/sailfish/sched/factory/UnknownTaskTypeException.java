package com.sailfish.sched.factory;

/**
 * Thrown when a task description names a type that no factory constructor is registered for.
 * Callers typically skip or reject the offending description and carry on.
 */
public class UnknownTaskTypeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String taskType;

    public UnknownTaskTypeException(String taskType) {
        super("Unknown task type: " + taskType);
        this.taskType = taskType;
    }

    /**
     * @return the offending discriminant, possibly null.
     */
    public String getTaskType() {
        return taskType;
    }
}
