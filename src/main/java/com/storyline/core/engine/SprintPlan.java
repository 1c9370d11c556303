package com.storyline.core.engine;

import com.storyline.core.model.Task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of planning a sprint from a backlog.
 *
 * @param sprintId       the sprint started
 * @param tasks          tasks created for ready stories
 * @param notReady       stories failing readiness, with their missing fields
 * @param escalationIds  readiness escalations raised for those stories
 * @param skipped        stories that could not be decomposed, with the reason
 */
public record SprintPlan(
    String sprintId,
    List<Task> tasks,
    Map<String, List<String>> notReady,
    List<String> escalationIds,
    Map<String, String> skipped
) {

    public SprintPlan {
        tasks = List.copyOf(tasks);
        notReady = Collections.unmodifiableMap(new LinkedHashMap<>(notReady));
        escalationIds = List.copyOf(escalationIds);
        skipped = Collections.unmodifiableMap(new LinkedHashMap<>(skipped));
    }

    public List<String> plannedStories() {
        return tasks.stream().map(Task::storyId).distinct().toList();
    }
}
