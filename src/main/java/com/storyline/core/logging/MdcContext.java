package com.storyline.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Storyline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setCycle(long cycle) {
        MDC.put("cycle", String.valueOf(cycle));
    }

    public static void setStory(String storyId) {
        MDC.put("storyId", storyId);
    }

    public static void setTask(String storyId, String taskId, String agentRole) {
        MDC.put("storyId", storyId);
        MDC.put("taskId", taskId);
        if (agentRole != null) {
            MDC.put("agentRole", agentRole);
        }
    }

    /** Clears the story and task keys, keeping the cycle. */
    public static void clearTask() {
        MDC.remove("storyId");
        MDC.remove("taskId");
        MDC.remove("agentRole");
    }

    public static void clear() {
        clearTask();
        MDC.remove("cycle");
    }
}
