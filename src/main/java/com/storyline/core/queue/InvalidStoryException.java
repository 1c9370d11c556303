package com.storyline.core.queue;

import java.util.List;

/**
 * Thrown when a story cannot be decomposed because required fields are absent or malformed.
 */
public class InvalidStoryException extends RuntimeException {

    private final String storyId;
    private final List<String> missingFields;

    public InvalidStoryException(String storyId, List<String> missingFields) {
        super("Story " + storyId + " is not ready, missing: " + String.join(", ", missingFields));
        this.storyId = storyId;
        this.missingFields = List.copyOf(missingFields);
    }

    public String storyId() {
        return storyId;
    }

    public List<String> missingFields() {
        return missingFields;
    }
}
