package com.sailfish.sched.service.impl;

import com.sailfish.sched.Task;
import com.sailfish.sched.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/**
 * Runs a single task on a worker thread and hands back its terminal status.
 * The task's own {@code run()} owns every status transition; this wrapper only adds
 * worker-side tracing.
 */
public class TaskExecutionWrapper implements Callable<TaskStatus> {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutionWrapper.class);

    private final Task task;

    public TaskExecutionWrapper(Task task) {
        this.task = Objects.requireNonNull(task, "task cannot be null");
    }

    @Override
    public TaskStatus call() {
        log.debug("Starting execution for task ID {} on {}", task.getId(), Thread.currentThread().getName());
        long start = System.nanoTime();

        TaskStatus result = task.run();

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        log.debug("Task ID {} finished with status {} in {} ms", task.getId(), result, elapsedMs);
        return result;
    }

    public Task getTask() {
        return task;
    }
}
