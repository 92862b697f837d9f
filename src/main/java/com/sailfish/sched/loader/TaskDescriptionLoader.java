package com.sailfish.sched.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sailfish.sched.model.TaskDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Reads task descriptions from a JSON array such as
 * {@code [{"task_id": 1, "name": "Send Welcome Email", "type": "email"}]}.
 */
public class TaskDescriptionLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskDescriptionLoader.class);

    private static final TypeReference<List<TaskDescription>> LIST_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public TaskDescriptionLoader() {
        this(defaultMapper());
    }

    /**
     * A mapper that rejects records with a missing field or a null {@code task_id}
     * instead of defaulting the id to 0.
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public TaskDescriptionLoader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
    }

    public List<TaskDescription> fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return checked(mapper.readValue(json, LIST_TYPE));
        } catch (JsonProcessingException e) {
            throw new TaskDescriptionException("Invalid task description document: " + e.getOriginalMessage(), e);
        }
    }

    public List<TaskDescription> fromStream(InputStream in) {
        Objects.requireNonNull(in, "in cannot be null");
        try {
            return checked(mapper.readValue(in, LIST_TYPE));
        } catch (IOException e) {
            throw new TaskDescriptionException("Failed to read task descriptions: " + e.getMessage(), e);
        }
    }

    public List<TaskDescription> fromFile(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        log.info("Loading task descriptions from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return fromStream(in);
        } catch (IOException e) {
            throw new TaskDescriptionException("Failed to open " + path, e);
        }
    }

    public List<TaskDescription> fromClasspath(String resource) {
        Objects.requireNonNull(resource, "resource cannot be null");
        log.info("Loading task descriptions from classpath resource {}", resource);
        try (InputStream in = TaskDescriptionLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new TaskDescriptionException("Classpath resource not found: " + resource);
            }
            return fromStream(in);
        } catch (IOException e) {
            throw new TaskDescriptionException("Failed to close classpath resource " + resource, e);
        }
    }

    private static List<TaskDescription> checked(List<TaskDescription> descriptions) {
        if (descriptions == null) {
            throw new TaskDescriptionException("Task description document is empty");
        }
        log.debug("Read {} task descriptions", descriptions.size());
        return descriptions;
    }
}
