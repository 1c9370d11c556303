package com.storyline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stage of the content pipeline. Declaration order is pipeline order.
 */
public enum Phase {
    RESEARCH("research", "Research"),
    WRITING("writing", "Write"),
    EDITING("editing", "Edit"),
    GRAPHICS("graphics", "Graphics"),
    FINAL_REVIEW("final_review", "Final review");

    private final String wireName;
    private final String label;

    Phase(String wireName, String label) {
        this.wireName = wireName;
        this.label = label;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Short verb used as the task title prefix. */
    public String label() {
        return label;
    }

    /** 1-based position in the pipeline, used in task ids. */
    public int sequence() {
        return ordinal() + 1;
    }

    @JsonCreator
    public static Phase fromWireName(String value) {
        for (Phase phase : values()) {
            if (phase.wireName.equalsIgnoreCase(value) || phase.name().equalsIgnoreCase(value)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + value);
    }
}
