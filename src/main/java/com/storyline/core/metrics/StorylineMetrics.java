package com.storyline.core.metrics;

import com.storyline.core.model.GateDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for sprint orchestration.
 */
@Service
public class StorylineMetrics {

    private final MeterRegistry registry;

    public StorylineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCycleDuration(long ms) {
        Timer.builder("storyline.cycle.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGateDecision(GateDecision decision) {
        Counter.builder("storyline.gate.decisions")
                .tag("decision", decision.name().toLowerCase())
                .register(registry)
                .increment();
    }

    public void incrementEscalations(String type) {
        Counter.builder("storyline.escalations.total")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    public void recordDispatch(String role, boolean accepted) {
        Counter.builder("storyline.dispatches.total")
                .tag("role", role)
                .tag("accepted", String.valueOf(accepted))
                .register(registry)
                .increment();
    }

    /**
     * Records the number of tasks found blocked indefinitely in a cycle.
     *
     * @param stuckTasks tasks with a cycle, failed or missing dependency
     */
    public void recordStall(int stuckTasks) {
        Counter.builder("storyline.cycle.stalls")
                .description("Cycles that ended with work blocked indefinitely")
                .register(registry)
                .increment();

        DistributionSummary.builder("storyline.cycle.stuck_tasks")
                .description("Tasks blocked indefinitely per stalled cycle")
                .register(registry)
                .record(stuckTasks);
    }
}
