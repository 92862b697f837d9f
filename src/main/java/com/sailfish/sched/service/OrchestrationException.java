package com.sailfish.sched.service;

/**
 * Signals a fault in the scheduler's own dispatch machinery, as opposed to a fault inside a
 * task's work step (which only ever surfaces as a FAILED task).
 */
public class OrchestrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public OrchestrationException(String message) {
        super(message);
    }

    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
