package com.storyline.core.model;

import java.util.List;

/**
 * Definition-of-Done verdict for a deliverable.
 */
public record DodResult(boolean passed, List<String> issues) {

    public DodResult {
        issues = List.copyOf(issues);
    }
}
