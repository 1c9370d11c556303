package com.storyline.core;

/**
 * Thrown when an operation references a task, agent role, or escalation that does not exist.
 * The operation that raised it performs no mutation.
 */
public class NotFoundException extends RuntimeException {

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    public String kind() {
        return kind;
    }

    public String id() {
        return id;
    }
}
