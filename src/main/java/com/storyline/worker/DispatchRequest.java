package com.storyline.worker;

import com.storyline.core.model.Phase;
import com.storyline.core.model.Task;

import java.time.Instant;
import java.util.List;

/**
 * Instruction handed to a worker role for one task.
 */
public record DispatchRequest(
    String taskId,
    String storyId,
    String title,
    Phase phase,
    String role,
    List<String> acceptanceCriteria,
    Instant dispatchedAt
) {

    public DispatchRequest {
        acceptanceCriteria = acceptanceCriteria != null ? List.copyOf(acceptanceCriteria) : List.of();
    }

    public static DispatchRequest of(Task task, String role, Instant at) {
        return new DispatchRequest(task.taskId(), task.storyId(), task.title(), task.phase(),
                role, task.acceptanceCriteria(), at);
    }
}
