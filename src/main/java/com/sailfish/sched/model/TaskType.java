package com.sailfish.sched.model;

import java.time.Duration;
import java.util.Optional;

/**
 * The closed set of task types understood by the default factory.
 * Each type carries its external discriminant, its reference work duration and the
 * message written when a task of that type completes.
 */
public enum TaskType {

    EMAIL("email", Duration.ofSeconds(2), "[EmailTask] Sending email for Task %d"),
    BACKUP("backup", Duration.ofSeconds(3), "[DataBackupTask] Backing up data for Task %d"),
    REPORT("report", Duration.ofSeconds(1), "[ReportGenerationTask] Generating report for Task %d");

    private final String discriminant;
    private final Duration defaultDuration;
    private final String completionFormat;

    TaskType(String discriminant, Duration defaultDuration, String completionFormat) {
        this.discriminant = discriminant;
        this.defaultDuration = defaultDuration;
        this.completionFormat = completionFormat;
    }

    public String discriminant() {
        return discriminant;
    }

    public Duration defaultDuration() {
        return defaultDuration;
    }

    public String completionMessage(long taskId) {
        return String.format(completionFormat, taskId);
    }

    /**
     * Looks up a type by its exact discriminant (case-sensitive).
     */
    public static Optional<TaskType> fromDiscriminant(String discriminant) {
        if (discriminant == null) {
            return Optional.empty();
        }
        for (TaskType type : values()) {
            if (type.discriminant.equals(discriminant)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
