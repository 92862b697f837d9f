package com.sailfish.sched;

import com.sailfish.sched.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A unit of work with an identity, a name and a lifecycle status.
 * <p>
 * {@link #run()} drives the state machine PENDING -> RUNNING -> COMPLETED | FAILED around the
 * variant-specific {@link #execute()} work step. Every transition is reported synchronously to the
 * attached observers, in attachment order, before execution continues.
 * <p>
 * A task is executed at most once. Faults in the work step never escape {@link #run()}; they end
 * the task in {@link TaskStatus#FAILED} and callers inspect {@link #getStatus()} instead.
 */
public abstract class Task {

    private static final Logger log = LoggerFactory.getLogger(Task.class);

    private final long id;
    private final String name;
    private final Instant createdAt;
    private final List<TaskObserver> observers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile String failureReason;

    protected Task(long id, String name) {
        this.id = id;
        this.name = name;
        this.createdAt = Instant.now();
    }

    /**
     * Performs the actual work of this task.
     *
     * @return {@link WorkResult#ok()} on success, or a fault describing what went wrong.
     * @throws InterruptedException if the worker thread is interrupted while blocked.
     */
    protected abstract WorkResult execute() throws InterruptedException;

    /**
     * Appends an observer. The same observer may be attached more than once and is then
     * notified once per attachment.
     */
    public void attach(TaskObserver observer) {
        observers.add(Objects.requireNonNull(observer, "observer cannot be null"));
    }

    /**
     * Executes the task and returns its terminal status. Exceptions from the work step never
     * escape; an {@link Error} ends the task in FAILED and is then rethrown.
     * Calling this on a task that has already been started returns the current status.
     */
    public final TaskStatus run() {
        if (!started.compareAndSet(false, true)) {
            log.warn("Task {} already started (status {}). Skipping execution.", id, status);
            return status;
        }

        setStatus(TaskStatus.RUNNING);

        WorkResult result;
        try {
            result = execute();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = WorkResult.fault("Interrupted during execution", e);
        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            result = WorkResult.fault(reason, e);
        } catch (Error e) {
            finish(WorkResult.fault(e.getMessage() != null ? e.getMessage() : e.getClass().getName(), e));
            throw e;
        }
        if (result == null) {
            result = WorkResult.fault("Work step returned no result");
        }

        finish(result);
        return status;
    }

    private void finish(WorkResult result) {
        if (status != TaskStatus.RUNNING) {
            log.warn("Task {} left RUNNING during its work step (status {}). Keeping it.", id, status);
            return;
        }
        if (result.isOk()) {
            setStatus(TaskStatus.COMPLETED);
        } else {
            failureReason = result.getFaultReason();
            log.error("Task {} ({}) failed: {}", id, name, failureReason, result.getCause().orElse(null));
            setStatus(TaskStatus.FAILED);
        }
    }

    /**
     * The only path that changes {@code status}. Notifies each observer with the prior and new status.
     */
    final void setStatus(TaskStatus newStatus) {
        Objects.requireNonNull(newStatus, "newStatus cannot be null");
        TaskStatus oldStatus = status;
        if (!isAllowed(oldStatus, newStatus)) {
            throw new IllegalStateException("Illegal transition for task " + id + ": " + oldStatus + " -> " + newStatus);
        }
        status = newStatus;
        notifyObservers(oldStatus, newStatus);
    }

    private static boolean isAllowed(TaskStatus from, TaskStatus to) {
        switch (from) {
            case PENDING:
                return to == TaskStatus.RUNNING;
            case RUNNING:
                return to.isTerminal();
            default:
                return false;
        }
    }

    private void notifyObservers(TaskStatus oldStatus, TaskStatus newStatus) {
        for (TaskObserver observer : observers) {
            try {
                observer.onTransition(this, oldStatus, newStatus);
            } catch (RuntimeException e) {
                // remaining observers are still notified
                log.error("Observer {} failed on task {} transition {} -> {}",
                        observer.getClass().getName(), id, oldStatus, newStatus, e);
            }
        }
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * @return the fault reason if the task ended in FAILED, null otherwise.
     */
    public String getFailureReason() {
        return failureReason;
    }

    public List<TaskObserver> getObservers() {
        return Collections.unmodifiableList(observers);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + id + ", name='" + name + "', status=" + status + '}';
    }
}
