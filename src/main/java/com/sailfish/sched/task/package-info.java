/**
 * Concrete task variants.
 */
package com.sailfish.sched.task;
