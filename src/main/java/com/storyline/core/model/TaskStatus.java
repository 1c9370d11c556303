package com.storyline.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a task in the queue.
 * <p>
 * Lifecycle: {@code blocked -> pending -> assigned -> in_progress -> complete | failed}.
 */
public enum TaskStatus {
    BLOCKED("blocked"),
    PENDING("pending"),
    ASSIGNED("assigned"),
    IN_PROGRESS("in_progress"),
    COMPLETE("complete"),
    FAILED("failed");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }

    /**
     * Whether the lifecycle allows moving from this status to {@code next}.
     * {@code assigned -> pending} covers a dispatch the worker side declined.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case BLOCKED -> next == PENDING;
            case PENDING -> next == ASSIGNED;
            case ASSIGNED -> next == IN_PROGRESS || next == PENDING;
            case IN_PROGRESS -> next == COMPLETE || next == FAILED;
            case COMPLETE, FAILED -> false;
        };
    }

    @JsonCreator
    public static TaskStatus fromWireName(String value) {
        for (TaskStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
