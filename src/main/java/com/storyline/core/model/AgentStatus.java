package com.storyline.core.model;

import java.time.Instant;

/**
 * Status record for one worker role.
 *
 * @param role          worker role (e.g. "writer")
 * @param status        what the worker last reported
 * @param currentTaskId task the worker holds, if any
 * @param processed     true once a completion has been picked up by a poll
 * @param updatedAt     time of the worker's last report
 */
public record AgentStatus(
    String role,
    AgentState status,
    String currentTaskId,
    boolean processed,
    Instant updatedAt
) {

    public AgentStatus markProcessed() {
        return new AgentStatus(role, status, currentTaskId, true, updatedAt);
    }
}
