package com.storyline.core.monitor;

import com.storyline.core.NotFoundException;
import com.storyline.core.model.AgentState;
import com.storyline.core.model.AgentStatus;
import com.storyline.core.model.AgentStatusTable;
import com.storyline.core.persistence.JsonFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Tracks the status record of each worker role and routes work along the pipeline.
 * <p>
 * Workers write their own record through {@link #updateAgentStatus}; the orchestrator reads
 * completions through {@link #pollStatusUpdates}, which reports each completion once.
 */
public class AgentStatusMonitor {

    private static final Logger log = LoggerFactory.getLogger(AgentStatusMonitor.class);

    private final JsonFileStore<AgentStatusTable> store;
    private final PipelineRouting routing;
    private final Clock clock;

    private final List<AgentStatus> agents;
    private Instant lastPoll;

    public AgentStatusMonitor(JsonFileStore<AgentStatusTable> store, PipelineRouting routing, Clock clock) {
        this.store = store;
        this.routing = routing;
        this.clock = clock;

        AgentStatusTable table = store.load();
        this.agents = new ArrayList<>(table.agents());
        this.lastPoll = table.lastPoll();
        log.debug("Loaded {} agent status records from {}", agents.size(), store.file());
    }

    /**
     * Returns every record that reports {@code complete} and has not been returned before,
     * marking each as processed. A second poll with no intervening report returns nothing.
     */
    public synchronized List<AgentStatus> pollStatusUpdates() {
        var completed = new ArrayList<AgentStatus>();
        var working = new ArrayList<>(agents);
        for (int i = 0; i < working.size(); i++) {
            AgentStatus agent = working.get(i);
            if (agent.status() == AgentState.COMPLETE && !agent.processed()) {
                AgentStatus processed = agent.markProcessed();
                working.set(i, processed);
                completed.add(processed);
            }
        }
        commit(working, clock.instant());
        if (!completed.isEmpty()) {
            log.info("Poll found {} completion(s): {}", completed.size(),
                    completed.stream().map(a -> a.role() + "/" + a.currentTaskId()).toList());
        }
        return completed;
    }

    /**
     * Role that runs after {@code currentRole}; empty when the pipeline ends with it.
     *
     * @throws NotFoundException if the role is not part of the pipeline
     */
    public Optional<String> determineNextAgent(String currentRole) {
        return routing.nextRole(currentRole);
    }

    /**
     * Records currently reporting {@code blocked}. Does not mutate state.
     */
    public synchronized List<AgentStatus> detectBlockers() {
        return agents.stream().filter(a -> a.status() == AgentState.BLOCKED).toList();
    }

    /**
     * Worker-side report. Creates the record on first report. Every report clears the
     * processed flag so a new completion is picked up by the next poll.
     *
     * @throws NotFoundException if the role is not part of the pipeline
     */
    public synchronized AgentStatus updateAgentStatus(String role, AgentState status, String currentTaskId) {
        if (!routing.isKnownRole(role)) {
            throw new NotFoundException("Agent role", role);
        }
        var updated = new AgentStatus(role, status, currentTaskId, false, clock.instant());
        var working = new ArrayList<>(agents);
        int index = indexOf(role);
        if (index >= 0) {
            working.set(index, updated);
        } else {
            working.add(updated);
        }
        commit(working, lastPoll);
        log.info("Agent {} reported {} (task {})", role, status.wireName(), currentTaskId);
        return updated;
    }

    public synchronized AgentStatus getStatus(String role) {
        int index = indexOf(role);
        if (index < 0) {
            throw new NotFoundException("Agent role", role);
        }
        return agents.get(index);
    }

    public synchronized List<AgentStatus> agents() {
        return List.copyOf(agents);
    }

    public synchronized AgentStatusTable snapshot() {
        return new AgentStatusTable(agents, lastPoll);
    }

    private int indexOf(String role) {
        for (int i = 0; i < agents.size(); i++) {
            if (agents.get(i).role().equals(role)) {
                return i;
            }
        }
        return -1;
    }

    /** Persists the new table, then swaps it in. A failed save leaves memory as it was. */
    private void commit(List<AgentStatus> working, Instant poll) {
        store.save(new AgentStatusTable(working, poll));
        agents.clear();
        agents.addAll(working);
        lastPoll = poll;
    }
}
