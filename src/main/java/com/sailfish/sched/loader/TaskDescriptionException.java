package com.sailfish.sched.loader;

/**
 * Thrown when a task description document cannot be read or parsed.
 */
public class TaskDescriptionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TaskDescriptionException(String message, Throwable cause) {
        super(message, cause);
    }

    public TaskDescriptionException(String message) {
        super(message);
    }
}
