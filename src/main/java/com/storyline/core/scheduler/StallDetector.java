package com.storyline.core.scheduler;

import com.storyline.core.model.Task;
import com.storyline.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds tasks that can never complete. A blocked task is stuck when one of its dependency
 * chains contains a cycle, a failed or abandoned task, or an id the queue does not hold.
 * Work of paused stories is reported separately.
 */
@Service
public class StallDetector {

    private static final Logger log = LoggerFactory.getLogger(StallDetector.class);

    public StallReport analyze(List<Task> tasks, Collection<String> pausedStories) {
        return analyze(tasks, pausedStories, Set.of());
    }

    /**
     * @param abandonedTasks in-progress tasks no worker holds any more
     */
    public StallReport analyze(List<Task> tasks, Collection<String> pausedStories,
                               Collection<String> abandonedTasks) {
        var byId = new HashMap<String, Task>();
        for (Task task : tasks) {
            byId.put(task.taskId(), task);
        }

        var memo = new HashMap<String, StallReport.StuckTask>();
        var live = new HashSet<String>();
        var stuck = new ArrayList<StallReport.StuckTask>();
        var awaiting = new ArrayList<String>();
        int dispatchable = 0;
        int active = 0;

        for (Task task : tasks) {
            switch (task.status()) {
                case BLOCKED -> {
                    var blockage = findBlockage(task, byId, abandonedTasks, memo, live, new HashSet<>());
                    if (blockage != null) {
                        stuck.add(new StallReport.StuckTask(task.taskId(), blockage.cause(), blockage.culprit()));
                    }
                }
                case PENDING -> {
                    if (pausedStories.contains(task.storyId())) {
                        awaiting.add(task.taskId());
                    } else {
                        dispatchable++;
                    }
                }
                case ASSIGNED, IN_PROGRESS -> {
                    if (pausedStories.contains(task.storyId())) {
                        awaiting.add(task.taskId());
                    } else if (abandonedTasks.contains(task.taskId())) {
                        stuck.add(new StallReport.StuckTask(task.taskId(), StallReport.Cause.ABANDONED, task.taskId()));
                    } else {
                        active++;
                    }
                }
                default -> {
                }
            }
        }

        var report = new StallReport(stuck, awaiting, dispatchable, active);
        if (!stuck.isEmpty()) {
            log.warn("{} task(s) can never complete: {}", stuck.size(), stuck);
        }
        if (report.waitingOnEscalations()) {
            log.warn("All remaining work waits on unresolved escalations: {}", awaiting);
        }
        return report;
    }

    /**
     * Returns why {@code task} can never become pending, or {@code null} if it still can.
     */
    private StallReport.StuckTask findBlockage(Task task, Map<String, Task> byId,
                                               Collection<String> abandoned,
                                               Map<String, StallReport.StuckTask> memo,
                                               Set<String> live, Set<String> visiting) {
        if (memo.containsKey(task.taskId())) {
            return memo.get(task.taskId());
        }
        if (live.contains(task.taskId())) {
            return null;
        }
        if (!visiting.add(task.taskId())) {
            return new StallReport.StuckTask(task.taskId(), StallReport.Cause.DEPENDENCY_CYCLE, task.taskId());
        }

        StallReport.StuckTask blockage = null;
        for (String dep : task.dependsOn()) {
            Task dependency = byId.get(dep);
            if (dependency == null) {
                blockage = new StallReport.StuckTask(task.taskId(), StallReport.Cause.MISSING_DEPENDENCY, dep);
            } else if (dependency.status() == TaskStatus.FAILED) {
                blockage = new StallReport.StuckTask(task.taskId(), StallReport.Cause.FAILED_DEPENDENCY, dep);
            } else if (abandoned.contains(dep) && dependency.status() != TaskStatus.COMPLETE) {
                blockage = new StallReport.StuckTask(task.taskId(), StallReport.Cause.ABANDONED, dep);
            } else if (dependency.status() == TaskStatus.BLOCKED) {
                var upstream = findBlockage(dependency, byId, abandoned, memo, live, visiting);
                if (upstream != null) {
                    blockage = new StallReport.StuckTask(task.taskId(), upstream.cause(), upstream.culprit());
                }
            }
            if (blockage != null) {
                break;
            }
        }
        visiting.remove(task.taskId());

        if (blockage != null) {
            memo.put(task.taskId(), blockage);
        } else {
            live.add(task.taskId());
        }
        return blockage;
    }
}
