/**
 * Provides the core classes of the task scheduler: the {@link com.sailfish.sched.Task} state machine,
 * the {@link com.sailfish.sched.TaskObserver} notification contract and the
 * {@link com.sailfish.sched.WorkResult} returned by a task's work step.
 */
package com.sailfish.sched;
