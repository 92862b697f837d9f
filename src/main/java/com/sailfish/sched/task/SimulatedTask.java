package com.sailfish.sched.task;

import com.sailfish.sched.Task;
import com.sailfish.sched.WorkResult;
import com.sailfish.sched.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * A task whose work is a fixed delay standing in for real I/O (sending an email, transferring a
 * backup, computing a report), followed by a type-specific completion message.
 */
public class SimulatedTask extends Task {

    private static final Logger log = LoggerFactory.getLogger(SimulatedTask.class);

    private final TaskType type;
    private final Duration duration;

    public SimulatedTask(long id, String name, TaskType type) {
        this(id, name, type, type.defaultDuration());
    }

    public SimulatedTask(long id, String name, TaskType type, Duration duration) {
        super(id, name);
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.duration = Objects.requireNonNull(duration, "duration cannot be null");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative");
        }
    }

    @Override
    protected WorkResult execute() throws InterruptedException {
        Thread.sleep(duration.toMillis());
        log.info(completionMessage());
        return WorkResult.ok();
    }

    public String completionMessage() {
        return type.completionMessage(getId());
    }

    public TaskType getType() {
        return type;
    }

    public Duration getDuration() {
        return duration;
    }
}
