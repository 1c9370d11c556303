package com.storyline.core.engine;

import com.storyline.core.model.GateDecision;

import java.util.List;

/**
 * What the quality gate did with one completed task.
 *
 * @param taskId         the checked task
 * @param storyId        its story
 * @param role           the role that reported completion
 * @param decision       gate decision
 * @param issues         DoD issues behind the decision
 * @param escalationId   raised escalation, for {@link GateDecision#ESCALATE}
 * @param followUpTaskId task added to the pipeline after approval, or the retry of a rejected task
 */
public record GateOutcome(
    String taskId,
    String storyId,
    String role,
    GateDecision decision,
    List<String> issues,
    String escalationId,
    String followUpTaskId
) {

    public GateOutcome {
        issues = issues != null ? List.copyOf(issues) : List.of();
    }
}
