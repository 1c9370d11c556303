package com.storyline.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An open question routed to a human reviewer.
 *
 * @param escalationId   "ESC-{n}", assigned in creation order
 * @param storyId        story the question concerns
 * @param taskId         task whose deliverable triggered the escalation; {@code null} for story-level questions
 * @param type           category, e.g. "dod_gap" or "dor_gap"
 * @param question       what the reviewer is asked to decide
 * @param context        opaque supporting data
 * @param recommendation suggested answer, may be {@code null}
 * @param raisedBy       component that raised it
 * @param raisedAt       creation time
 * @param resolved       true once a reviewer answered
 * @param resolvedAt     answer time
 * @param resolution     reviewer's notes
 */
public record Escalation(
    String escalationId,
    String storyId,
    String taskId,
    String type,
    String question,
    Map<String, Object> context,
    String recommendation,
    String raisedBy,
    Instant raisedAt,
    boolean resolved,
    Instant resolvedAt,
    String resolution
) {

    public Escalation {
        context = context != null ? Collections.unmodifiableMap(new LinkedHashMap<>(context)) : Map.of();
    }

    public Escalation resolve(String resolutionText, Instant at) {
        return new Escalation(escalationId, storyId, taskId, type, question, context,
                recommendation, raisedBy, raisedAt, true, at, resolutionText);
    }
}
