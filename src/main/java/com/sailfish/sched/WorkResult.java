package com.sailfish.sched;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a task's work step. Either the work succeeded, or it faulted with a reason
 * and an optional underlying cause.
 */
public final class WorkResult {

    private static final WorkResult OK = new WorkResult(null, null);

    private final String faultReason;
    private final Throwable cause;

    private WorkResult(String faultReason, Throwable cause) {
        this.faultReason = faultReason;
        this.cause = cause;
    }

    public static WorkResult ok() {
        return OK;
    }

    public static WorkResult fault(String reason) {
        return fault(reason, null);
    }

    public static WorkResult fault(String reason, Throwable cause) {
        Objects.requireNonNull(reason, "reason cannot be null");
        return new WorkResult(reason, cause);
    }

    public boolean isOk() {
        return faultReason == null;
    }

    /**
     * @return the reason of the fault, or null for a successful result.
     */
    public String getFaultReason() {
        return faultReason;
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString() {
        return isOk() ? "WorkResult{ok}" : "WorkResult{fault='" + faultReason + "'}";
    }
}
