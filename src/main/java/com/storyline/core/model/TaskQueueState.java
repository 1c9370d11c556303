package com.storyline.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of the task queue.
 */
public record TaskQueueState(
    String sprintId,
    List<Task> tasks,
    Instant lastUpdated
) {

    public TaskQueueState {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    public static TaskQueueState empty() {
        return new TaskQueueState(null, List.of(), null);
    }
}
