package com.sailfish.sched.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Untyped description of a task as supplied by configuration or an upstream call.
 * {@code type} is the discriminant used by the factory to select a task variant.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskDescription(
        @JsonProperty("task_id") @JsonAlias("taskId") long taskId,
        @JsonProperty("name") String name,
        @JsonProperty("type") String type) {
}
