package com.sailfish.sched.factory;

import com.sailfish.sched.Task;

/**
 * Builds a task of one particular type from its id and name.
 */
@FunctionalInterface
public interface TaskConstructor {

    Task create(long taskId, String name);
}
