package com.sailfish.sched.factory;

import com.sailfish.sched.Task;
import com.sailfish.sched.model.TaskDescription;

/**
 * Factory responsible for building the correct Task variant from an untyped description,
 * based on the description's type discriminant.
 */
public interface TaskFactory {

    /**
     * Creates a new task for the given description.
     *
     * @param description The description carrying the task id, name and type discriminant.
     * @return A new task in PENDING status.
     * @throws UnknownTaskTypeException if the type is not registered with this factory.
     */
    Task createTask(TaskDescription description);
}
