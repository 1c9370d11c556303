package com.storyline.core.engine;

import com.storyline.core.NotFoundException;
import com.storyline.core.config.StorylineProperties;
import com.storyline.core.escalation.EscalationManager;
import com.storyline.core.events.EventBus;
import com.storyline.core.events.StorylineEvent;
import com.storyline.core.logging.MdcContext;
import com.storyline.core.metrics.StorylineMetrics;
import com.storyline.core.model.AgentStatus;
import com.storyline.core.model.Deliverable;
import com.storyline.core.model.DodResult;
import com.storyline.core.model.DorResult;
import com.storyline.core.model.Escalation;
import com.storyline.core.model.GateDecision;
import com.storyline.core.model.Story;
import com.storyline.core.model.Task;
import com.storyline.core.model.TaskStatus;
import com.storyline.core.monitor.AgentStatusMonitor;
import com.storyline.core.monitor.PipelineRouting;
import com.storyline.core.qualitygate.QualityGateValidator;
import com.storyline.core.queue.InvalidStoryException;
import com.storyline.core.queue.TaskQueue;
import com.storyline.core.scheduler.StallDetector;
import com.storyline.core.scheduler.StallReport;
import com.storyline.worker.DeliverableStore;
import com.storyline.worker.DispatchRequest;
import com.storyline.worker.TaskDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs the sprint: one scheduling cycle polls for finished work, puts each deliverable
 * through the quality gate, then hands the next pending tasks to their workers.
 * <p>
 * Cycles are re-entrant. All state lives in the injected stores, so a cycle can be run
 * by a fresh process after a restart. A problem with one completion record is logged
 * and reported; it does not stop the rest of the cycle.
 */
@Service
public class SprintOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SprintOrchestrator.class);

    static final String DOD_GAP = "dod_gap";
    static final String DOR_GAP = "dor_gap";

    private final TaskQueue taskQueue;
    private final AgentStatusMonitor monitor;
    private final QualityGateValidator validator;
    private final EscalationManager escalations;
    private final PipelineRouting routing;
    private final DeliverableStore deliverables;
    private final TaskDispatcher dispatcher;
    private final RetryPolicy retryPolicy;
    private final StallDetector stallDetector;
    private final EventBus eventBus;
    private final StorylineMetrics metrics;
    private final StorylineProperties properties;
    private final Clock clock;

    private long cycles;

    public SprintOrchestrator(TaskQueue taskQueue,
                              AgentStatusMonitor monitor,
                              QualityGateValidator validator,
                              EscalationManager escalations,
                              PipelineRouting routing,
                              DeliverableStore deliverables,
                              TaskDispatcher dispatcher,
                              RetryPolicy retryPolicy,
                              StallDetector stallDetector,
                              EventBus eventBus,
                              StorylineMetrics metrics,
                              StorylineProperties properties,
                              Clock clock) {
        this.taskQueue = taskQueue;
        this.monitor = monitor;
        this.validator = validator;
        this.escalations = escalations;
        this.routing = routing;
        this.deliverables = deliverables;
        this.dispatcher = dispatcher;
        this.retryPolicy = retryPolicy;
        this.stallDetector = stallDetector;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs one scheduling cycle.
     *
     * @return what the cycle decided and dispatched
     */
    public synchronized CycleReport runCycle() {
        long cycle = ++cycles;
        long start = clock.millis();
        MdcContext.setCycle(cycle);
        try {
            log.info("Cycle {} started (sprint {})", cycle, taskQueue.sprintId());

            var outcomes = new ArrayList<GateOutcome>();
            var errors = new ArrayList<String>();
            for (AgentStatus completion : monitor.pollStatusUpdates()) {
                processCompletion(completion, errors).ifPresent(outcomes::add);
            }

            var dispatched = dispatchPending(errors);

            List<AgentStatus> blockers = monitor.detectBlockers();
            for (AgentStatus blocker : blockers) {
                log.warn("Agent {} is blocked on {}", blocker.role(), blocker.currentTaskId());
            }

            StallReport stall = stallDetector.analyze(taskQueue.tasks(), escalations.pausedStories(),
                    abandonedTasks());
            if (stall.stalled()) {
                metrics.recordStall(stall.stuckTasks().size());
                publish("cycle.stalled", null, null, Map.of(
                        "stuck_tasks", stall.stuckTasks().size(),
                        "awaiting_escalation", stall.awaitingEscalation().size()));
            }

            long duration = clock.millis() - start;
            metrics.recordCycleDuration(duration);
            log.info("Cycle {} finished in {}ms: {} gate outcome(s), {} dispatched, {} blocker(s){}",
                    cycle, duration, outcomes.size(), dispatched.size(), blockers.size(),
                    stall.stalled() ? ", STALLED" : "");
            return new CycleReport(cycle, outcomes, dispatched, blockers, stall, errors, duration);
        } finally {
            MdcContext.clear();
        }
    }

    private Optional<GateOutcome> processCompletion(AgentStatus completion, List<String> errors) {
        String taskId = completion.currentTaskId();
        if (taskId == null || taskId.isBlank()) {
            recordError(errors, "Agent " + completion.role() + " reported complete without a task id");
            return Optional.empty();
        }
        try {
            Task task = taskQueue.getTask(taskId);
            MdcContext.setTask(task.storyId(), taskId, completion.role());
            if (task.status() != TaskStatus.IN_PROGRESS) {
                recordError(errors, "Task " + taskId + " reported complete by " + completion.role()
                        + " but is " + task.status().wireName());
                return Optional.empty();
            }
            return Optional.of(gate(task, completion.role()));
        } catch (NotFoundException | IllegalStateException e) {
            recordError(errors, "Skipped completion from " + completion.role() + " for " + taskId + ": " + e.getMessage());
            return Optional.empty();
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * Validates the task's deliverable against the Definition of Done and applies the decision.
     * A missing deliverable validates as an empty one.
     */
    private GateOutcome gate(Task task, String role) {
        String taskId = task.taskId();
        Deliverable deliverable = deliverables.find(taskId).orElseGet(() -> Deliverable.empty(taskId));
        DodResult dod = validator.validateDoD(deliverable);
        GateDecision decision = validator.gateDecision(dod.issues());
        metrics.recordGateDecision(decision);
        log.info("Gate decision for {}: {}", taskId, decision);

        return switch (decision) {
            case APPROVE -> approve(task, role, dod);
            case ESCALATE -> escalate(task, role, dod);
            case REJECT -> reject(task, role, dod);
        };
    }

    /**
     * In-progress tasks whose escalations are all resolved. Resolution always applies a
     * verdict or re-gates, so these only come from escalations closed outside the orchestrator.
     */
    private Set<String> abandonedTasks() {
        var open = new HashSet<String>();
        var closed = new HashSet<String>();
        for (Escalation escalation : escalations.all()) {
            if (escalation.taskId() != null) {
                (escalation.resolved() ? closed : open).add(escalation.taskId());
            }
        }
        closed.removeAll(open);
        var abandoned = new HashSet<String>();
        for (Task task : taskQueue.tasksByStatus(TaskStatus.IN_PROGRESS)) {
            if (closed.contains(task.taskId())) {
                abandoned.add(task.taskId());
            }
        }
        return abandoned;
    }

    private GateOutcome approve(Task task, String role, DodResult dod) {
        String followUp = completeAndAdvance(task);
        return new GateOutcome(task.taskId(), task.storyId(), role, GateDecision.APPROVE,
                dod.issues(), null, followUp);
    }

    /**
     * Completes the task and adds the next role's phase to the story when it is not there yet.
     *
     * @return id of the next task in the story's pipeline, or {@code null} at the end
     */
    private String completeAndAdvance(Task task) {
        taskQueue.updateStatus(task.taskId(), TaskStatus.COMPLETE);
        publish("task.completed", task.storyId(), task.taskId(), Map.of("phase", task.phase().wireName()));

        String role = routing.roleFor(task.phase());
        Optional<String> nextRole = monitor.determineNextAgent(role);
        if (nextRole.isEmpty()) {
            if (storyComplete(task.storyId())) {
                log.info("Story {} complete", task.storyId());
                publish("story.completed", task.storyId(), null, Map.of());
            }
            return null;
        }
        Task next = taskQueue.extendPipeline(task.storyId(), routing.phaseFor(nextRole.get()), task.taskId());
        log.debug("Next for story {}: {} ({})", task.storyId(), next.taskId(), next.status().wireName());
        return next.taskId();
    }

    /** Every phase of the story has a complete task; failed attempts with a completed retry are ignored. */
    private boolean storyComplete(String storyId) {
        var storyTasks = taskQueue.tasksForStory(storyId);
        return storyTasks.stream().allMatch(t -> storyTasks.stream()
                .anyMatch(other -> other.phase() == t.phase() && other.status() == TaskStatus.COMPLETE));
    }

    private GateOutcome escalate(Task task, String role, DodResult dod) {
        var context = new LinkedHashMap<String, Object>();
        context.put("task_id", task.taskId());
        context.put("phase", task.phase().wireName());
        context.put("issues", dod.issues());
        context.put("gate_decision", GateDecision.ESCALATE.name());

        String escalationId = escalations.create(task.storyId(), task.taskId(), DOD_GAP,
                "Deliverable for " + task.taskId() + " has " + dod.issues().size()
                        + " issue(s). Approve or reject?",
                context,
                "Review the listed issues and resolve with a verdict");
        metrics.incrementEscalations(DOD_GAP);
        publish("escalation.created", task.storyId(), task.taskId(),
                Map.of("escalation_id", escalationId, "issues", dod.issues()));
        log.info("Story {} paused until {} is resolved", task.storyId(), escalationId);
        return new GateOutcome(task.taskId(), task.storyId(), role, GateDecision.ESCALATE,
                dod.issues(), escalationId, null);
    }

    private GateOutcome reject(Task task, String role, DodResult dod) {
        Task failed = taskQueue.updateStatus(task.taskId(), TaskStatus.FAILED);
        publish("task.failed", task.storyId(), task.taskId(), Map.of("issues", dod.issues()));

        String retryId = null;
        if (retryPolicy.shouldRetry(failed, dod)) {
            retryId = taskQueue.reenqueue(task.taskId()).taskId();
            log.info("Retry policy re-enqueued {} as {}", task.taskId(), retryId);
        }
        return new GateOutcome(task.taskId(), task.storyId(), role, GateDecision.REJECT,
                dod.issues(), null, retryId);
    }

    private List<String> dispatchPending(List<String> errors) {
        var dispatched = new ArrayList<String>();
        Set<String> paused = escalations.pausedStories();
        int limit = Math.max(properties.getMaxDispatchPerCycle(), 0);

        while (dispatched.size() < limit) {
            Optional<Task> next = taskQueue.nextTask(paused);
            if (next.isEmpty()) {
                break;
            }
            Task task = next.get();
            String role = taskQueue.assignToAgent(task);
            MdcContext.setTask(task.storyId(), task.taskId(), role);
            try {
                boolean accepted = hand(DispatchRequest.of(task, role, clock.instant()));
                metrics.recordDispatch(role, accepted);
                if (!accepted) {
                    taskQueue.updateStatus(task.taskId(), TaskStatus.PENDING);
                    errors.add("Dispatcher declined " + task.taskId() + "; left pending");
                    log.warn("Dispatcher declined {}, will retry next cycle", task.taskId());
                    break;
                }
                taskQueue.updateStatus(task.taskId(), TaskStatus.IN_PROGRESS);
                dispatched.add(task.taskId());
                publish("task.dispatched", task.storyId(), task.taskId(), Map.of("role", role));
            } finally {
                MdcContext.clearTask();
            }
        }
        return dispatched;
    }

    private boolean hand(DispatchRequest request) {
        try {
            return dispatcher.dispatch(request);
        } catch (RuntimeException e) {
            log.error("Dispatcher failed for {}: {}", request.taskId(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Resolves an escalation. When it refers to a task still in progress, the verdict is
     * applied to that task: {@link Verdict#APPROVE} completes it and advances the story,
     * {@link Verdict#REJECT} fails it, and {@link Verdict#NONE} puts its current deliverable
     * through the quality gate again. A re-gate that still finds gaps raises a new escalation.
     *
     * @throws NotFoundException     if the escalation does not exist
     * @throws IllegalStateException if it was already resolved
     */
    public synchronized Resolution resolveEscalation(String escalationId, String resolutionText, Verdict verdict) {
        Escalation escalation = escalations.get(escalationId);
        if (escalation.resolved()) {
            throw new IllegalStateException(escalationId + " was already resolved at " + escalation.resolvedAt());
        }
        Optional<Task> task = escalation.taskId() == null
                ? Optional.empty()
                : taskQueue.findTask(escalation.taskId());

        Escalation resolved = escalations.resolve(escalationId, resolutionText);
        publish("escalation.resolved", resolved.storyId(), resolved.taskId(),
                Map.of("escalation_id", escalationId, "verdict", verdict.name()));

        if (task.isEmpty() || task.get().status() != TaskStatus.IN_PROGRESS) {
            if (verdict != Verdict.NONE) {
                log.info("{} recorded without applying {}: no task in progress", escalationId, verdict);
            }
            return new Resolution(resolved, Verdict.NONE, task.orElse(null), null);
        }

        Task current = task.get();
        MdcContext.setTask(current.storyId(), current.taskId(), current.assignedTo());
        try {
            GateOutcome regate = null;
            switch (verdict) {
                case APPROVE -> completeAndAdvance(current);
                case REJECT -> {
                    taskQueue.updateStatus(current.taskId(), TaskStatus.FAILED);
                    publish("task.failed", current.storyId(), current.taskId(), Map.of("escalation_id", escalationId));
                }
                case NONE -> regate = gate(current, current.assignedTo());
            }
            log.info("Applied {} from {} to {}{}", verdict, escalationId, current.taskId(),
                    regate != null ? " (re-gated: " + regate.decision() + ")" : "");
            return new Resolution(resolved, verdict, taskQueue.getTask(current.taskId()), regate);
        } finally {
            MdcContext.clearTask();
        }
    }

    /**
     * Starts a sprint and enqueues every ready story. Stories failing readiness get a
     * {@code dor_gap} escalation and are left out.
     */
    public synchronized SprintPlan planSprint(String sprintId, List<Story> stories) {
        return planSprint(sprintId, stories, Map.of());
    }

    /**
     * Like {@link #planSprint(String, List)}, reporting backlog entries that could not be
     * read as stories among the skipped ones.
     */
    public synchronized SprintPlan planSprint(String sprintId, List<Story> stories, Map<String, String> unreadable) {
        if (sprintId != null) {
            taskQueue.startSprint(sprintId);
        }

        var tasks = new ArrayList<Task>();
        var notReady = new LinkedHashMap<String, List<String>>();
        var escalationIds = new ArrayList<String>();
        var skipped = new LinkedHashMap<String, String>(unreadable);

        for (int i = 0; i < stories.size(); i++) {
            Story story = stories.get(i);
            if (story.storyId() == null || story.storyId().isBlank()) {
                skipped.put("#" + (i + 1), "missing story_id");
                log.warn("Skipping backlog entry #{}: missing story_id", i + 1);
                continue;
            }
            MdcContext.setStory(story.storyId());
            try {
                DorResult dor = validator.validateDoR(story);
                if (!dor.passed()) {
                    notReady.put(story.storyId(), dor.missingFields());
                    escalationIds.add(raiseReadinessGap(story, dor));
                    continue;
                }
                tasks.addAll(taskQueue.decompose(story));
            } catch (InvalidStoryException | IllegalStateException e) {
                skipped.put(story.storyId(), e.getMessage());
                log.warn("Skipping story {}: {}", story.storyId(), e.getMessage());
            } finally {
                MdcContext.clearTask();
            }
        }

        log.info("Sprint {} planned: {} task(s), {} not ready, {} skipped",
                sprintId, tasks.size(), notReady.size(), skipped.size());
        return new SprintPlan(sprintId, tasks, notReady, escalationIds, skipped);
    }

    private String raiseReadinessGap(Story story, DorResult dor) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("missing_fields", dor.missingFields());
        String id = escalations.create(story.storyId(), DOR_GAP,
                "Story " + story.storyId() + " is missing: " + String.join(", ", dor.missingFields()),
                context,
                "Complete the missing fields and re-plan the story");
        metrics.incrementEscalations(DOR_GAP);
        publish("escalation.created", story.storyId(), null, Map.of("escalation_id", id));
        return id;
    }

    private static void recordError(List<String> errors, String message) {
        log.warn(message);
        errors.add(message);
    }

    private void publish(String type, String storyId, String taskId, Map<String, Object> payload) {
        eventBus.publish(new StorylineEvent(type, storyId, taskId, payload, clock.instant()));
    }
}
