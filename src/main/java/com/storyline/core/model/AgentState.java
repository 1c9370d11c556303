package com.storyline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status a worker reports about itself.
 */
public enum AgentState {
    IDLE("idle"),
    IN_PROGRESS("in_progress"),
    COMPLETE("complete"),
    BLOCKED("blocked");

    private final String wireName;

    AgentState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AgentState fromWireName(String value) {
        for (AgentState state : values()) {
            if (state.wireName.equalsIgnoreCase(value) || state.name().equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown agent status: " + value);
    }
}
