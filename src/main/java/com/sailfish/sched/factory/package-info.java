/**
 * Task construction from external descriptions. {@link com.sailfish.sched.factory.MapTaskFactory}
 * is the one place where task types are registered.
 */
package com.sailfish.sched.factory;
