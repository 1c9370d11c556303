package com.storyline;

import com.storyline.core.model.Priority;
import com.storyline.core.model.Story;

import java.util.List;
import java.util.Map;

/**
 * Backlog fixtures.
 */
public final class Stories {

    private Stories() {}

    public static Story ready(String storyId) {
        return ready(storyId, Priority.P1);
    }

    public static Story ready(String storyId, Priority priority) {
        return new Story(
                storyId,
                "As a reader, I want a guide to sourdough starters so that I can bake at home",
                List.of("[ ] Covers feeding schedule", "[ ] Includes troubleshooting", "[x] Cites two sources"),
                Map.of("tone", "friendly", "length", "1200 words"),
                priority,
                5);
    }
}
