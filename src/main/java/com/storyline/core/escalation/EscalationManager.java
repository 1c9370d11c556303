package com.storyline.core.escalation;

import com.storyline.core.NotFoundException;
import com.storyline.core.model.Escalation;
import com.storyline.core.model.EscalationLog;
import com.storyline.core.persistence.JsonFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Durable log of questions awaiting a human decision.
 * <p>
 * Ids are "ESC-{n}" with {@code n} strictly increasing across restarts; resolved
 * escalations stay in the log.
 */
public class EscalationManager {

    private static final Logger log = LoggerFactory.getLogger(EscalationManager.class);

    static final String ID_PREFIX = "ESC-";
    private static final String RAISED_BY = "orchestrator";

    private final JsonFileStore<EscalationLog> store;
    private final Clock clock;

    private final List<Escalation> escalations;
    private int nextSequence;

    public EscalationManager(JsonFileStore<EscalationLog> store, Clock clock) {
        this.store = store;
        this.clock = clock;

        EscalationLog loaded = store.load();
        this.escalations = new ArrayList<>(loaded.escalations());
        this.nextSequence = Math.max(Math.max(loaded.nextSequence(), 1), highestSequence() + 1);
        log.debug("Loaded {} escalations from {}, next id {}{}", escalations.size(), store.file(),
                ID_PREFIX, nextSequence);
    }

    public synchronized String create(String storyId, String type, String question,
                                      Map<String, Object> context, String recommendation) {
        return create(storyId, null, type, question, context, recommendation);
    }

    /**
     * Appends an unresolved escalation and persists the log.
     *
     * @return the new escalation id
     */
    public synchronized String create(String storyId, String taskId, String type, String question,
                                      Map<String, Object> context, String recommendation) {
        String id = ID_PREFIX + nextSequence;
        var escalation = new Escalation(id, storyId, taskId, type, question, context,
                recommendation, RAISED_BY, clock.instant(), false, null, null);
        var working = new ArrayList<>(escalations);
        working.add(escalation);
        commit(working, nextSequence + 1);
        log.info("Raised {} ({}) for story {}: {}", id, type, storyId, question);
        return id;
    }

    public synchronized List<Escalation> getUnresolved() {
        return escalations.stream().filter(e -> !e.resolved()).toList();
    }

    /**
     * Marks an escalation resolved with the reviewer's notes.
     *
     * @throws NotFoundException     if no escalation has this id
     * @throws IllegalStateException if it was already resolved
     */
    public synchronized Escalation resolve(String escalationId, String resolutionText) {
        int index = indexOf(escalationId);
        Escalation current = escalations.get(index);
        if (current.resolved()) {
            throw new IllegalStateException(escalationId + " was already resolved at " + current.resolvedAt());
        }
        Escalation resolved = current.resolve(resolutionText, clock.instant());
        var working = new ArrayList<>(escalations);
        working.set(index, resolved);
        commit(working, nextSequence);
        log.info("Resolved {} for story {}: {}", escalationId, current.storyId(), resolutionText);
        return resolved;
    }

    public synchronized Escalation get(String escalationId) {
        return escalations.get(indexOf(escalationId));
    }

    public synchronized List<Escalation> all() {
        return List.copyOf(escalations);
    }

    /**
     * Stories with at least one unresolved escalation. Their tasks are held back from dispatch.
     */
    public synchronized Set<String> pausedStories() {
        var paused = new LinkedHashSet<String>();
        for (Escalation escalation : escalations) {
            if (!escalation.resolved()) {
                paused.add(escalation.storyId());
            }
        }
        return paused;
    }

    public synchronized EscalationLog snapshot() {
        return new EscalationLog(nextSequence, escalations);
    }

    private int indexOf(String escalationId) {
        for (int i = 0; i < escalations.size(); i++) {
            if (escalations.get(i).escalationId().equals(escalationId)) {
                return i;
            }
        }
        throw new NotFoundException("Escalation", escalationId);
    }

    private int highestSequence() {
        int highest = 0;
        for (Escalation escalation : escalations) {
            String id = escalation.escalationId();
            if (id != null && id.startsWith(ID_PREFIX)) {
                try {
                    highest = Math.max(highest, Integer.parseInt(id.substring(ID_PREFIX.length())));
                } catch (NumberFormatException e) {
                    log.warn("Ignoring non-sequential escalation id {}", id);
                }
            }
        }
        return highest;
    }

    /** Persists the new log, then swaps it in. A failed save leaves memory as it was. */
    private void commit(List<Escalation> working, int sequence) {
        store.save(new EscalationLog(sequence, working));
        escalations.clear();
        escalations.addAll(working);
        nextSequence = sequence;
    }
}
