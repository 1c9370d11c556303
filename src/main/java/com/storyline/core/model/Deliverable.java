package com.storyline.core.model;

import java.util.List;

/**
 * What a worker reports back for a task. The core reads only the fields the DoD check needs.
 */
public record Deliverable(
    String taskId,
    SelfValidation selfValidation,
    Output output,
    List<CriterionResult> acceptanceCriteriaResults
) {

    public Deliverable {
        acceptanceCriteriaResults = acceptanceCriteriaResults != null
                ? List.copyOf(acceptanceCriteriaResults) : List.of();
    }

    /** Stand-in used when a worker completed without writing a deliverable. */
    public static Deliverable empty(String taskId) {
        return new Deliverable(taskId, null, null, List.of());
    }

    public boolean selfValidationPassed() {
        return selfValidation != null && selfValidation.passed();
    }

    public boolean hasOutput() {
        return output != null && output.path() != null && !output.path().isBlank();
    }

    public record SelfValidation(boolean passed) {}

    public record Output(String path) {}

    public record CriterionResult(String criterion, boolean passed) {}
}
