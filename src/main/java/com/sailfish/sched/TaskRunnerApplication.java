package com.sailfish.sched;

import com.sailfish.sched.config.SchedulerConfig;
import com.sailfish.sched.factory.MapTaskFactory;
import com.sailfish.sched.factory.TaskFactory;
import com.sailfish.sched.factory.UnknownTaskTypeException;
import com.sailfish.sched.loader.TaskDescriptionLoader;
import com.sailfish.sched.model.TaskDescription;
import com.sailfish.sched.service.TaskScheduler;
import com.sailfish.sched.service.impl.PooledTaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Command-line entry point. Loads task descriptions from the JSON file given as the first
 * argument (or the bundled {@code tasks.json}), builds the tasks and runs them all.
 */
public final class TaskRunnerApplication {

    private static final Logger log = LoggerFactory.getLogger(TaskRunnerApplication.class);

    static final String DEFAULT_TASKS_RESOURCE = "tasks.json";

    private TaskRunnerApplication() {
    }

    public static void main(String[] args) {
        SchedulerConfig config = SchedulerConfig.load();
        TaskDescriptionLoader loader = new TaskDescriptionLoader();

        List<TaskDescription> descriptions;
        if (args.length > 0) {
            Path path = Paths.get(args[0]);
            descriptions = loader.fromFile(path);
        } else {
            descriptions = loader.fromClasspath(DEFAULT_TASKS_RESOURCE);
        }

        TaskFactory factory = MapTaskFactory.withDefaults(config);
        try (TaskScheduler scheduler = new PooledTaskScheduler(config)) {
            int added = schedule(descriptions, factory, scheduler);
            log.info("Scheduled {} of {} task descriptions", added, descriptions.size());
            scheduler.runAll();
        }
    }

    /**
     * Creates a task for each description and adds it to the scheduler.
     * Descriptions with an unknown type are logged and skipped.
     *
     * @return the number of tasks added.
     */
    static int schedule(List<TaskDescription> descriptions, TaskFactory factory, TaskScheduler scheduler) {
        int added = 0;
        for (TaskDescription description : descriptions) {
            try {
                scheduler.addTask(factory.createTask(description));
                added++;
            } catch (UnknownTaskTypeException e) {
                log.warn("Skipping task {} ({}): {}", description.taskId(), description.name(), e.getMessage());
            }
        }
        return added;
    }
}
