package com.sailfish.sched.observer;

import com.sailfish.sched.Task;
import com.sailfish.sched.TaskObserver;
import com.sailfish.sched.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one log line per status transition. Stateless, so a single instance can be shared
 * by every task of a scheduler.
 */
public class TaskLogger implements TaskObserver {

    private static final Logger log = LoggerFactory.getLogger(TaskLogger.class);

    @Override
    public void onTransition(Task task, TaskStatus oldStatus, TaskStatus newStatus) {
        log.info("Task {} ({}) status changed: {} -> {}", task.getId(), task.getName(), oldStatus, newStatus);
    }
}
