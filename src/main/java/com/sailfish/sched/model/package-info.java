/**
 * Value types of the scheduler: task statuses, the known task types and the
 * external task description record.
 */
package com.sailfish.sched.model;
