package com.storyline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Backlog priority label. Declaration order is scheduling order: P0 is dispatched first.
 */
public enum Priority {
    P0,
    P1,
    P2,
    P3;

    /** Priority applied when a story carries none. */
    public static final Priority DEFAULT = P1;

    /**
     * Parses a label ignoring case and surrounding blanks; blank means no priority.
     *
     * @throws IllegalArgumentException for anything other than P0 to P3
     */
    @JsonCreator
    public static Priority fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        String normalized = label.strip();
        for (Priority priority : values()) {
            if (priority.name().equalsIgnoreCase(normalized)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority '" + label + "', expected P0 to P3");
    }
}
