package com.storyline.dispatch.cli;

import com.storyline.core.escalation.EscalationManager;
import com.storyline.core.model.AgentStatus;
import com.storyline.core.model.TaskStatus;
import com.storyline.core.monitor.AgentStatusMonitor;
import com.storyline.core.queue.TaskQueue;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: storyline status
 * <p>
 * Displays queue counts by status, the task table, agent records and open escalations.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show sprint status")
@Component
public class StatusCommand implements Runnable {

    @Option(names = {"--story"}, description = "Only show tasks of this story")
    private String storyId;

    private final TaskQueue taskQueue;
    private final AgentStatusMonitor monitor;
    private final EscalationManager escalations;

    public StatusCommand(TaskQueue taskQueue, AgentStatusMonitor monitor, EscalationManager escalations) {
        this.taskQueue = taskQueue;
        this.monitor = monitor;
        this.escalations = escalations;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        System.out.println();
        System.out.println("SPRINT " + (taskQueue.sprintId() != null ? taskQueue.sprintId() : "(none)"));

        var counts = taskQueue.statusCounts();
        var summary = new StringBuilder();
        for (TaskStatus status : TaskStatus.values()) {
            if (summary.length() > 0) summary.append(" | ");
            summary.append(status.wireName()).append(": ").append(counts.getOrDefault(status, 0L));
        }
        ConsoleOutput.info(summary.toString());

        var tasks = storyId != null ? taskQueue.tasksForStory(storyId) : taskQueue.tasks();
        if (!tasks.isEmpty()) {
            System.out.println();
            System.out.printf("  %-16s %-4s %-12s %-13s %s%n", "TASK", "PRI", "STATUS", "AGENT", "TITLE");
            System.out.println("  " + "-".repeat(76));
            tasks.forEach(ConsoleOutput::taskRow);
        }

        var agents = monitor.agents();
        if (!agents.isEmpty()) {
            System.out.println();
            System.out.printf("  %-13s %-12s %-16s %s%n", "AGENT", "STATUS", "TASK", "PROCESSED");
            for (AgentStatus agent : agents) {
                System.out.printf("  %-13s %-12s %-16s %s%n", agent.role(), agent.status().wireName(),
                        agent.currentTaskId() != null ? agent.currentTaskId() : "-", agent.processed());
            }
        }

        int open = escalations.getUnresolved().size();
        System.out.println();
        if (open > 0) {
            ConsoleOutput.warn(open + " unresolved escalation(s), paused stories: "
                    + String.join(", ", escalations.pausedStories()));
        } else {
            ConsoleOutput.success("No unresolved escalations");
        }
    }
}
