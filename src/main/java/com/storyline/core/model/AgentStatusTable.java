package com.storyline.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of the agent status table.
 */
public record AgentStatusTable(
    List<AgentStatus> agents,
    Instant lastPoll
) {

    public AgentStatusTable {
        agents = agents != null ? List.copyOf(agents) : List.of();
    }

    public static AgentStatusTable empty() {
        return new AgentStatusTable(List.of(), null);
    }
}
