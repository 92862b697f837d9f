/**
 * Observers shipped with the scheduler, such as the default {@link com.sailfish.sched.observer.TaskLogger}.
 */
package com.sailfish.sched.observer;
