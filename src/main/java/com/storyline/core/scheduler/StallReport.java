package com.storyline.core.scheduler;

import java.util.List;

/**
 * Tasks that cannot make progress without outside action.
 *
 * @param stuckTasks         tasks that can never complete: abandoned in-progress work and
 *                           blocked tasks whose dependencies can never all complete
 * @param awaitingEscalation pending or in-progress tasks held back because their story has an
 *                           open escalation
 * @param dispatchable       pending tasks that can be dispatched now
 * @param active             in-progress tasks a worker still holds, outside paused stories
 */
public record StallReport(
    List<StuckTask> stuckTasks,
    List<String> awaitingEscalation,
    int dispatchable,
    int active
) {

    public StallReport {
        stuckTasks = List.copyOf(stuckTasks);
        awaitingEscalation = List.copyOf(awaitingEscalation);
    }

    /**
     * True when some task is stuck, or all remaining work waits on escalations.
     */
    public boolean stalled() {
        return !stuckTasks.isEmpty() || waitingOnEscalations();
    }

    /** Nothing can be dispatched or finished until someone resolves an escalation. */
    public boolean waitingOnEscalations() {
        return dispatchable == 0 && active == 0 && !awaitingEscalation.isEmpty();
    }

    public enum Cause {
        DEPENDENCY_CYCLE,
        FAILED_DEPENDENCY,
        MISSING_DEPENDENCY,
        /** In progress, but its escalation was closed without a verdict and no worker holds it. */
        ABANDONED
    }

    public record StuckTask(String taskId, Cause cause, String culprit) {}
}
