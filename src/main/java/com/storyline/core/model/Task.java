package com.storyline.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A schedulable unit of work: one pipeline phase of one story.
 *
 * @param taskId             "{storyId}-{phase sequence}", retries append ".r{n}"
 * @param storyId            owning story
 * @param title              human-readable summary
 * @param phase              pipeline phase this task covers
 * @param priority           copied from the story at decomposition
 * @param status             current status
 * @param assignedTo         worker role, set on assignment
 * @param dependsOn          task ids that must be complete before this one is pending
 * @param acceptanceCriteria story criteria handed to the worker with the task
 * @param createdAt          creation time, FIFO tie-breaker within a priority band
 * @param assignedAt         last assignment time
 * @param completedAt        completion time
 */
public record Task(
    String taskId,
    String storyId,
    String title,
    Phase phase,
    Priority priority,
    TaskStatus status,
    String assignedTo,
    List<String> dependsOn,
    List<String> acceptanceCriteria,
    Instant createdAt,
    Instant assignedAt,
    Instant completedAt
) {

    public Task {
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
        acceptanceCriteria = acceptanceCriteria != null ? List.copyOf(acceptanceCriteria) : List.of();
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(taskId, storyId, title, phase, priority, newStatus, assignedTo,
                dependsOn, acceptanceCriteria, createdAt, assignedAt, completedAt);
    }

    public Task withAssignment(String role, Instant at) {
        return new Task(taskId, storyId, title, phase, priority, TaskStatus.ASSIGNED, role,
                dependsOn, acceptanceCriteria, createdAt, at, completedAt);
    }

    public Task withCompletion(Instant at) {
        return new Task(taskId, storyId, title, phase, priority, TaskStatus.COMPLETE, assignedTo,
                dependsOn, acceptanceCriteria, createdAt, assignedAt, at);
    }

    public Task withDependsOn(List<String> newDependsOn) {
        return new Task(taskId, storyId, title, phase, priority, status, assignedTo,
                newDependsOn, acceptanceCriteria, createdAt, assignedAt, completedAt);
    }
}
