package com.storyline.core.model;

import java.util.List;

/**
 * Definition-of-Ready verdict for a story.
 */
public record DorResult(boolean passed, List<String> missingFields) {

    public DorResult {
        missingFields = List.copyOf(missingFields);
    }
}
