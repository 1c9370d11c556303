package com.storyline.core.model;

import java.util.List;

/**
 * Persisted form of the escalation log.
 *
 * @param nextSequence number used for the next "ESC-{n}" id
 * @param escalations  all escalations in creation order, resolved or not
 */
public record EscalationLog(
    int nextSequence,
    List<Escalation> escalations
) {

    public EscalationLog {
        escalations = escalations != null ? List.copyOf(escalations) : List.of();
    }

    public static EscalationLog empty() {
        return new EscalationLog(1, List.of());
    }
}
