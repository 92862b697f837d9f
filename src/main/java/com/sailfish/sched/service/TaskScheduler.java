package com.sailfish.sched.service;

import com.sailfish.sched.Task;

import java.util.List;

/**
 * Service interface for running a set of tasks with bounded parallelism.
 */
public interface TaskScheduler extends AutoCloseable {

    /**
     * Attaches the scheduler's logger to the task and appends it to the scheduled set.
     *
     * @param task The task to schedule. Must be in PENDING status to be executed by {@link #runAll()}.
     * @throws IllegalStateException if the scheduler has been shut down.
     */
    void addTask(Task task);

    /**
     * Runs every scheduled task that has not been executed yet and blocks until all of them
     * have reached a terminal status. Task failures are not reported through this method;
     * attach an observer to the tasks to learn about them.
     * <p>
     * If the calling thread is interrupted while waiting, this method throws at once with the
     * interrupt flag set. Tasks already submitted keep running on the pool and may still be
     * RUNNING when the exception is thrown; {@link #shutdown(long)} waits for them.
     *
     * @throws OrchestrationException if the worker pool cannot accept or complete the work,
     *                                or the calling thread is interrupted while waiting.
     * @throws IllegalStateException  if the scheduler has been shut down.
     */
    void runAll();

    /**
     * @return the scheduled tasks, in insertion order.
     */
    List<Task> getTasks();

    /**
     * Initiates a graceful shutdown of the underlying worker pool.
     *
     * @param timeoutSeconds Time to wait for running tasks to complete before forceful shutdown.
     */
    void shutdown(long timeoutSeconds);

    @Override
    void close();
}
