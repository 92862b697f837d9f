package com.sailfish.sched.factory;

import com.sailfish.sched.Task;
import com.sailfish.sched.config.SchedulerConfig;
import com.sailfish.sched.model.TaskDescription;
import com.sailfish.sched.model.TaskType;
import com.sailfish.sched.task.SimulatedTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A {@link TaskFactory} backed by an explicit map from type discriminant to constructor.
 * Constructors should be registered during startup, before the factory is used.
 */
public class MapTaskFactory implements TaskFactory {

    private static final Logger log = LoggerFactory.getLogger(MapTaskFactory.class);

    private final Map<String, TaskConstructor> registry = new ConcurrentHashMap<>();

    /**
     * Creates a factory with the {@code email}, {@code backup} and {@code report} types registered,
     * using the durations from the given configuration.
     */
    public static MapTaskFactory withDefaults(SchedulerConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        MapTaskFactory factory = new MapTaskFactory();
        for (TaskType type : TaskType.values()) {
            Duration duration = config.durationOf(type);
            factory.register(type.discriminant(), (taskId, name) -> new SimulatedTask(taskId, name, type, duration));
        }
        return factory;
    }

    /**
     * Registers a constructor for a type discriminant, replacing any previous registration.
     *
     * @param taskType    The discriminant as it appears in task descriptions.
     * @param constructor Builds the task from its id and name.
     */
    public void register(String taskType, TaskConstructor constructor) {
        if (taskType == null || taskType.trim().isEmpty()) {
            throw new IllegalArgumentException("taskType cannot be blank");
        }
        if (constructor == null) {
            throw new IllegalArgumentException("constructor cannot be null");
        }
        log.debug("Registering task constructor for type '{}'", taskType);
        registry.put(taskType, constructor);
    }

    @Override
    public Task createTask(TaskDescription description) {
        Objects.requireNonNull(description, "description cannot be null");
        String taskType = description.type();
        TaskConstructor constructor = taskType == null ? null : registry.get(taskType);
        if (constructor == null) {
            log.warn("No task constructor found for type '{}' (task {})", taskType, description.taskId());
            throw new UnknownTaskTypeException(taskType);
        }
        return constructor.create(description.taskId(), description.name());
    }

    public Set<String> supportedTypes() {
        return Collections.unmodifiableSet(registry.keySet());
    }
}
