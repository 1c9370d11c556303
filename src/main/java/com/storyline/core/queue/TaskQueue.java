package com.storyline.core.queue;

import com.storyline.core.NotFoundException;
import com.storyline.core.model.Phase;
import com.storyline.core.model.Story;
import com.storyline.core.model.Task;
import com.storyline.core.model.TaskQueueState;
import com.storyline.core.model.TaskStatus;
import com.storyline.core.monitor.PipelineRouting;
import com.storyline.core.persistence.JsonFileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Durable queue of tasks derived from backlog stories.
 * <p>
 * Owns every task for its whole life. Each mutation is applied to a working copy, which
 * replaces the in-memory queue only once it has been persisted. A task is {@code blocked}
 * while any dependency is not complete and becomes {@code pending} only through
 * {@link #updateStatus} completing its last open dependency.
 */
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    private static final int TITLE_LENGTH = 50;
    private static final Pattern RETRY_SUFFIX = Pattern.compile("\\.r\\d+$");

    /** Highest priority first, then oldest first. Ties keep queue order (stream min is stable). */
    private static final Comparator<Task> DISPATCH_ORDER = Comparator
            .comparing(Task::priority)
            .thenComparing(Task::createdAt);

    private final JsonFileStore<TaskQueueState> store;
    private final PipelineRouting routing;
    private final List<Phase> phases;
    private final Clock clock;

    private final List<Task> tasks;
    private String sprintId;
    private Instant lastUpdated;

    public TaskQueue(JsonFileStore<TaskQueueState> store, PipelineRouting routing,
                     List<Phase> phases, Clock clock) {
        this.store = store;
        this.routing = routing;
        this.phases = List.copyOf(phases);
        this.clock = clock;
        validatePhases(this.phases);

        TaskQueueState state = store.load();
        this.sprintId = state.sprintId();
        this.tasks = new ArrayList<>(state.tasks());
        this.lastUpdated = state.lastUpdated();
        log.debug("Loaded task queue from {}: {} tasks, sprint {}", store.file(), tasks.size(), sprintId);
    }

    private static void validatePhases(List<Phase> phases) {
        if (phases.isEmpty()) {
            throw new IllegalArgumentException("At least one pipeline phase is required");
        }
        for (int i = 1; i < phases.size(); i++) {
            if (phases.get(i).ordinal() <= phases.get(i - 1).ordinal()) {
                throw new IllegalArgumentException("Pipeline phases must follow pipeline order: " + phases);
            }
        }
    }

    public synchronized void startSprint(String newSprintId) {
        log.info("Starting sprint {} (previous: {})", newSprintId, sprintId);
        commit(newSprintId, tasks);
    }

    /**
     * Splits a story into one task per configured phase. Phase <i>i</i> depends on phase
     * <i>i-1</i>; the first task is pending, the rest blocked.
     *
     * @throws InvalidStoryException if the story misses a readiness field
     * @throws IllegalStateException if the story already has tasks in this queue
     */
    public synchronized List<Task> decompose(Story story) {
        var missing = new ArrayList<String>();
        if (story.storyId() == null || story.storyId().isBlank()) {
            missing.add("story_id");
        }
        missing.addAll(story.missingReadinessFields());
        if (!missing.isEmpty()) {
            throw new InvalidStoryException(story.storyId(), missing);
        }
        if (!findStoryTasks(story.storyId()).isEmpty()) {
            throw new IllegalStateException("Story " + story.storyId() + " already has tasks in the queue");
        }

        Instant now = clock.instant();
        var created = new ArrayList<Task>();
        String previousId = null;
        for (Phase phase : phases) {
            String taskId = story.storyId() + "-" + phase.sequence();
            created.add(new Task(
                    taskId,
                    story.storyId(),
                    phase.label() + ": " + abbreviate(story.userStory()),
                    phase,
                    story.effectivePriority(),
                    previousId == null ? TaskStatus.PENDING : TaskStatus.BLOCKED,
                    null,
                    previousId == null ? List.of() : List.of(previousId),
                    story.acceptanceCriteria(),
                    now,
                    null,
                    null));
            previousId = taskId;
        }

        var working = new ArrayList<>(tasks);
        working.addAll(created);
        commit(working);
        log.info("Decomposed story {} into {} tasks ({})", story.storyId(), created.size(),
                created.stream().map(t -> t.phase().wireName()).toList());
        return created;
    }

    /**
     * Assigns a pending task to the role that owns its phase and marks it {@code assigned}.
     * Assigning an already assigned task again overwrites the assignment time.
     *
     * @return the role the task was assigned to
     * @throws IllegalStateException if the task is neither pending nor assigned
     */
    public synchronized String assignToAgent(Task task) {
        int index = indexOf(task.taskId());
        Task current = tasks.get(index);
        if (current.status() != TaskStatus.PENDING && current.status() != TaskStatus.ASSIGNED) {
            throw new IllegalStateException("Task " + current.taskId() + " cannot be assigned while "
                    + current.status().wireName());
        }
        String role = routing.roleFor(current.phase());
        var working = new ArrayList<>(tasks);
        working.set(index, current.withAssignment(role, clock.instant()));
        commit(working);
        log.info("Assigned {} ({}) to {}", current.taskId(), current.phase().wireName(), role);
        return role;
    }

    /**
     * Moves a task to {@code newStatus} along the lifecycle
     * {@code blocked -> pending -> assigned -> in_progress -> complete | failed}.
     * Completing a task promotes every blocked dependent whose dependencies are now all
     * complete to {@code pending}. Assignment goes through {@link #assignToAgent}.
     *
     * @throws NotFoundException     if no task has this id
     * @throws IllegalStateException if the lifecycle does not allow the move
     */
    public synchronized Task updateStatus(String taskId, TaskStatus newStatus) {
        int index = indexOf(taskId);
        Task current = tasks.get(index);
        if (newStatus == TaskStatus.ASSIGNED) {
            throw new IllegalStateException("Task " + taskId + " must be assigned through assignToAgent");
        }
        if (!current.status().canTransitionTo(newStatus)) {
            throw new IllegalStateException("Task " + taskId + " cannot move from "
                    + current.status().wireName() + " to " + newStatus.wireName());
        }
        if (newStatus == TaskStatus.PENDING && !allDependenciesComplete(current, tasks)) {
            throw new IllegalStateException("Task " + taskId + " has incomplete dependencies " + current.dependsOn());
        }

        Task updated = newStatus == TaskStatus.COMPLETE
                ? current.withCompletion(clock.instant())
                : current.withStatus(newStatus);
        var working = new ArrayList<>(tasks);
        working.set(index, updated);
        if (newStatus == TaskStatus.COMPLETE) {
            unblockDependents(taskId, working);
        }
        commit(working);
        log.info("Task {}: {} -> {}", taskId, current.status().wireName(), newStatus.wireName());
        return updated;
    }

    private static void unblockDependents(String completedTaskId, List<Task> working) {
        for (int i = 0; i < working.size(); i++) {
            Task task = working.get(i);
            if (task.status() != TaskStatus.BLOCKED || !task.dependsOn().contains(completedTaskId)) {
                continue;
            }
            if (allDependenciesComplete(task, working)) {
                working.set(i, task.withStatus(TaskStatus.PENDING));
                log.info("Unblocked {} (dependencies complete: {})", task.taskId(), task.dependsOn());
            } else {
                log.debug("{} still blocked on {}", task.taskId(), task.dependsOn());
            }
        }
    }

    private static boolean allDependenciesComplete(Task task, List<Task> in) {
        for (String dep : task.dependsOn()) {
            boolean complete = in.stream()
                    .anyMatch(t -> t.taskId().equals(dep) && t.status() == TaskStatus.COMPLETE);
            if (!complete) {
                return false;
            }
        }
        return true;
    }

    /**
     * Highest-priority pending task, oldest first within a priority.
     */
    public synchronized Optional<Task> nextTask() {
        return nextTask(Set.of());
    }

    /**
     * Like {@link #nextTask()}, skipping tasks that belong to {@code excludedStories}.
     */
    public synchronized Optional<Task> nextTask(Collection<String> excludedStories) {
        return tasks.stream()
                .filter(t -> t.status() == TaskStatus.PENDING)
                .filter(t -> !excludedStories.contains(t.storyId()))
                .min(DISPATCH_ORDER);
    }

    /**
     * Adds a task for a phase the story was not decomposed into, depending on {@code afterTaskId}.
     * Returns the existing task when the story already has one for that phase.
     */
    public synchronized Task extendPipeline(String storyId, Phase phase, String afterTaskId) {
        Task after = tasks.get(indexOf(afterTaskId));
        Optional<Task> existing = findStoryTasks(storyId).stream()
                .filter(t -> t.phase() == phase)
                .findFirst();
        if (existing.isPresent()) {
            return existing.get();
        }

        Task created = new Task(
                storyId + "-" + phase.sequence(),
                storyId,
                phase.label() + ": " + subjectOf(after.title()),
                phase,
                after.priority(),
                after.status() == TaskStatus.COMPLETE ? TaskStatus.PENDING : TaskStatus.BLOCKED,
                null,
                List.of(afterTaskId),
                after.acceptanceCriteria(),
                clock.instant(),
                null,
                null);
        var working = new ArrayList<>(tasks);
        working.add(created);
        commit(working);
        log.info("Extended story {} with {} ({}), status {}", storyId, created.taskId(),
                phase.wireName(), created.status().wireName());
        return created;
    }

    /**
     * Re-enqueues a failed task as a fresh task with the same story, phase and dependencies.
     * Tasks that depended on the failed one are rewired to the replacement.
     *
     * @throws IllegalStateException if the task has not failed
     */
    public synchronized Task reenqueue(String taskId) {
        Task failed = tasks.get(indexOf(taskId));
        if (failed.status() != TaskStatus.FAILED) {
            throw new IllegalStateException("Only failed tasks can be re-enqueued; " + taskId
                    + " is " + failed.status().wireName());
        }

        String baseId = RETRY_SUFFIX.matcher(taskId).replaceFirst("");
        int attempt = 1;
        while (findTask(baseId + ".r" + attempt).isPresent()) {
            attempt++;
        }
        String retryId = baseId + ".r" + attempt;

        Task retry = new Task(
                retryId,
                failed.storyId(),
                failed.title(),
                failed.phase(),
                failed.priority(),
                allDependenciesComplete(failed, tasks) ? TaskStatus.PENDING : TaskStatus.BLOCKED,
                null,
                failed.dependsOn(),
                failed.acceptanceCriteria(),
                clock.instant(),
                null,
                null);
        var working = new ArrayList<>(tasks);
        working.add(retry);

        for (int i = 0; i < working.size(); i++) {
            Task task = working.get(i);
            if (task.dependsOn().contains(taskId)) {
                var rewired = task.dependsOn().stream()
                        .map(dep -> dep.equals(taskId) ? retryId : dep)
                        .toList();
                working.set(i, task.withDependsOn(rewired));
                log.debug("Rewired {} from {} to {}", task.taskId(), taskId, retryId);
            }
        }
        commit(working);
        log.info("Re-enqueued failed task {} as {} ({})", taskId, retryId, retry.status().wireName());
        return retry;
    }

    public synchronized Task getTask(String taskId) {
        return tasks.get(indexOf(taskId));
    }

    public synchronized Optional<Task> findTask(String taskId) {
        return tasks.stream().filter(t -> t.taskId().equals(taskId)).findFirst();
    }

    public synchronized List<Task> tasks() {
        return List.copyOf(tasks);
    }

    public synchronized List<Task> tasksByStatus(TaskStatus status) {
        return tasks.stream().filter(t -> t.status() == status).toList();
    }

    public synchronized List<Task> tasksForStory(String storyId) {
        return findStoryTasks(storyId);
    }

    public synchronized Map<TaskStatus, Long> statusCounts() {
        var counts = new EnumMap<TaskStatus, Long>(TaskStatus.class);
        for (Task task : tasks) {
            counts.merge(task.status(), 1L, Long::sum);
        }
        return counts;
    }

    public synchronized String sprintId() {
        return sprintId;
    }

    public synchronized TaskQueueState snapshot() {
        return new TaskQueueState(sprintId, tasks, lastUpdated);
    }

    private List<Task> findStoryTasks(String storyId) {
        return tasks.stream().filter(t -> t.storyId().equals(storyId)).toList();
    }

    private int indexOf(String taskId) {
        for (int i = 0; i < tasks.size(); i++) {
            if (tasks.get(i).taskId().equals(taskId)) {
                return i;
            }
        }
        throw new NotFoundException("Task", taskId);
    }

    private void commit(List<Task> working) {
        commit(sprintId, working);
    }

    /** Persists the new state, then swaps it in. A failed save leaves memory as it was. */
    private void commit(String newSprintId, List<Task> working) {
        Instant now = clock.instant();
        store.save(new TaskQueueState(newSprintId, working, now));
        if (working != tasks) {
            tasks.clear();
            tasks.addAll(working);
        }
        sprintId = newSprintId;
        lastUpdated = now;
    }

    private static String subjectOf(String title) {
        int colon = title.indexOf(':');
        return colon >= 0 ? title.substring(colon + 1).strip() : title;
    }

    private static String abbreviate(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= TITLE_LENGTH ? trimmed : trimmed.substring(0, TITLE_LENGTH) + "...";
    }
}
