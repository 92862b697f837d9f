/**
 * The scheduler service API. Implementations live in {@code service.impl}.
 */
package com.sailfish.sched.service;
