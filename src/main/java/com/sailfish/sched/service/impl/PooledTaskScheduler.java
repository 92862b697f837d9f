package com.sailfish.sched.service.impl;

import com.sailfish.sched.Task;
import com.sailfish.sched.TaskObserver;
import com.sailfish.sched.config.SchedulerConfig;
import com.sailfish.sched.model.TaskStatus;
import com.sailfish.sched.observer.TaskLogger;
import com.sailfish.sched.service.OrchestrationException;
import com.sailfish.sched.service.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of the TaskScheduler.
 * Runs tasks on a fixed-size worker pool; tasks are admitted in submission order as workers
 * become free, and at most {@code poolSize} of them execute at the same time.
 */
public class PooledTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(PooledTaskScheduler.class);

    private final ExecutorService taskExecutor;
    private final SchedulerConfig config;
    private final int poolSize;
    private final long shutdownTimeoutSeconds;
    private final TaskObserver taskLogger = new TaskLogger();
    private final List<Task> tasks = new CopyOnWriteArrayList<>();

    private volatile boolean shutdown = false;

    public PooledTaskScheduler(SchedulerConfig config) {
        this(newWorkerPool(Objects.requireNonNull(config, "config cannot be null").poolSize()), config);
    }

    // Constructor injection of the executor, mainly for tests.
    // Settings are read once here; later changes to the config do not affect this scheduler.
    public PooledTaskScheduler(ExecutorService taskExecutor, SchedulerConfig config) {
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.poolSize = config.poolSize();
        this.shutdownTimeoutSeconds = config.shutdownTimeoutSeconds();
        log.info("PooledTaskScheduler initialized with poolSize={}", poolSize);
    }

    private static ExecutorService newWorkerPool(int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "task-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void addTask(Task task) {
        Objects.requireNonNull(task, "task cannot be null");
        ensureOpen();
        task.attach(taskLogger);
        tasks.add(task);
        log.debug("Task {} ({}) added to scheduler", task.getId(), task.getName());
    }

    @Override
    public void runAll() {
        ensureOpen();

        List<Task> pending = new ArrayList<>();
        for (Task task : tasks) {
            if (task.getStatus() == TaskStatus.PENDING) {
                pending.add(task);
            } else {
                log.debug("Task {} already in status {}. Not resubmitting.", task.getId(), task.getStatus());
            }
        }
        if (pending.isEmpty()) {
            log.info("No pending tasks to run.");
            return;
        }

        log.info("Running {} tasks with up to {} in parallel", pending.size(), poolSize);
        long start = System.nanoTime();

        List<Future<TaskStatus>> futures = new ArrayList<>(pending.size());
        OrchestrationException fault = null;
        for (Task task : pending) {
            try {
                futures.add(taskExecutor.submit(new TaskExecutionWrapper(task)));
            } catch (RejectedExecutionException e) {
                log.error("Worker pool rejected task ID {}. Remaining tasks are not submitted.", task.getId(), e);
                fault = new OrchestrationException("Worker pool rejected task " + task.getId(), e);
                break;
            }
        }

        // Wait for every submitted task, even after a fault
        for (Future<TaskStatus> future : futures) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OrchestrationException("Interrupted while waiting for tasks to finish", e);
            } catch (ExecutionException e) {
                log.error("Unexpected fault while executing a task: {}", e.getCause().getMessage(), e.getCause());
                if (fault == null) {
                    fault = new OrchestrationException("Task execution machinery failed", e.getCause());
                }
            } catch (CancellationException e) {
                log.error("Task execution was cancelled", e);
                if (fault == null) {
                    fault = new OrchestrationException("Task execution was cancelled", e);
                }
            }
        }

        logSummary(pending, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
        if (fault != null) {
            throw fault;
        }
    }

    private void logSummary(List<Task> ran, long elapsedMs) {
        int completed = 0;
        int failed = 0;
        for (Task task : ran) {
            if (task.getStatus() == TaskStatus.COMPLETED) {
                completed++;
            } else if (task.getStatus() == TaskStatus.FAILED) {
                failed++;
            }
        }
        log.info("Finished {} tasks in {} ms: {} completed, {} failed", ran.size(), elapsedMs, completed, failed);
    }

    @Override
    public List<Task> getTasks() {
        return Collections.unmodifiableList(tasks);
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    /**
     * @return the worker pool size fixed at construction.
     */
    public int getPoolSize() {
        return poolSize;
    }

    private void ensureOpen() {
        if (shutdown) {
            throw new IllegalStateException("Scheduler has been shut down");
        }
    }

    @Override
    public void shutdown(long timeoutSeconds) {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("Shutting down task worker pool...");
        taskExecutor.shutdown(); // Disable new tasks from being submitted
        try {
            if (!taskExecutor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Task worker pool did not terminate in {} seconds.", timeoutSeconds);
                List<Runnable> dropped = taskExecutor.shutdownNow();
                log.warn("Forcefully shutting down task worker pool. {} tasks were dropped.", dropped.size());
                if (!taskExecutor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                    log.error("Task worker pool did not terminate even after forceful shutdown.");
                }
            } else {
                log.info("Task worker pool terminated gracefully.");
            }
        } catch (InterruptedException ie) {
            log.warn("Task worker pool shutdown interrupted. Forcing shutdown now.");
            taskExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    @PreDestroy
    public void close() {
        shutdown(shutdownTimeoutSeconds);
    }
}
