/**
 * Worker-pool backed implementation of {@link com.sailfish.sched.service.TaskScheduler}.
 */
package com.sailfish.sched.service.impl;
