/**
 * Loading of task description documents.
 */
package com.sailfish.sched.loader;
