package com.storyline.core.model;

/**
 * Outcome of the quality gate for a delivered task.
 */
public enum GateDecision {
    APPROVE,
    ESCALATE,
    REJECT
}
