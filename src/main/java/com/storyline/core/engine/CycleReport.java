package com.storyline.core.engine;

import com.storyline.core.model.AgentStatus;
import com.storyline.core.scheduler.StallReport;

import java.util.List;

/**
 * Result of one scheduling cycle.
 *
 * @param cycle      cycle number within this process, starting at 1
 * @param outcomes   gate outcomes for completions found by the poll
 * @param dispatched ids of tasks handed to workers
 * @param blockers   agents reporting blocked
 * @param stall      stall analysis after the cycle
 * @param errors     per-record problems that were logged and skipped
 * @param durationMs wall time of the cycle
 */
public record CycleReport(
    long cycle,
    List<GateOutcome> outcomes,
    List<String> dispatched,
    List<AgentStatus> blockers,
    StallReport stall,
    List<String> errors,
    long durationMs
) {

    public CycleReport {
        outcomes = List.copyOf(outcomes);
        dispatched = List.copyOf(dispatched);
        blockers = List.copyOf(blockers);
        errors = List.copyOf(errors);
    }

    public boolean stalled() {
        return stall.stalled();
    }
}
