package com.storyline.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a scheduling cycle, used by the CLI's verbose mode.
 *
 * @param eventType event type (e.g. "task.completed", "escalation.created", "task.dispatched")
 * @param storyId   the story this event belongs to (nullable for cycle-level events)
 * @param taskId    the task this event relates to (nullable for story-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record StorylineEvent(
    String eventType,
    String storyId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {}
