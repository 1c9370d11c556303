package com.storyline.dispatch.cli;

import com.storyline.core.engine.GateOutcome;
import com.storyline.core.model.Escalation;
import com.storyline.core.model.GateDecision;
import com.storyline.core.model.Task;
import com.storyline.core.scheduler.StallReport;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Storyline CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) STORYLINE v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [STORYLINE]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void gateOutcome(GateOutcome outcome) {
        String decision = switch (outcome.decision()) {
            case APPROVE -> "@|fg(green),bold [APPROVE]|@";
            case ESCALATE -> "@|fg(yellow),bold [ESCALATE]|@";
            case REJECT -> "@|fg(red),bold [REJECT]|@";
        };
        String suffix = "";
        if (outcome.decision() == GateDecision.ESCALATE) {
            suffix = " -> " + outcome.escalationId();
        } else if (outcome.followUpTaskId() != null) {
            suffix = " -> " + outcome.followUpTaskId();
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + decision + " " + outcome.taskId() + " (" + outcome.role() + ")" + suffix));
        for (String issue : outcome.issues()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "    @|fg(red) -|@ " + issue));
        }
    }

    public static void dispatched(String taskId) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [DISPATCH]|@ " + taskId));
    }

    public static void stall(StallReport report) {
        for (var stuck : report.stuckTasks()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red),bold [STALLED]|@ " + stuck.taskId() + " "
                            + stuck.cause().name().toLowerCase() + " (" + stuck.culprit() + ")"));
        }
        if (report.waitingOnEscalations()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow),bold [WAITING]|@ " + report.awaitingEscalation().size()
                            + " task(s) wait on unresolved escalations"));
        }
    }

    public static void taskRow(Task task) {
        String color = switch (task.status()) {
            case COMPLETE -> "fg(green)";
            case FAILED -> "fg(red)";
            case IN_PROGRESS, ASSIGNED -> "fg(blue)";
            case PENDING -> "fg(cyan)";
            case BLOCKED -> "fg(white)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  %-16s %-4s @|%s %-12s|@ %-13s %s",
                task.taskId(), task.priority(), color, task.status().wireName(),
                task.assignedTo() != null ? task.assignedTo() : "-",
                truncate(task.title(), 40))));
    }

    public static void escalation(Escalation e) {
        String state = e.resolved() ? "@|fg(green) resolved|@" : "@|fg(yellow) open|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + e.escalationId() + "|@ [" + e.type() + "] " + state
                        + " story " + e.storyId() + (e.taskId() != null ? ", task " + e.taskId() : "")));
        System.out.println("    " + e.question());
        if (e.recommendation() != null) {
            System.out.println("    Recommendation: " + e.recommendation());
        }
        if (e.resolved()) {
            System.out.println("    Resolution: " + e.resolution());
        }
    }

    public static void watchEvent(String eventType, String data) {
        String prefix = switch (eventType) {
            case "task.dispatched" -> "@|fg(blue) [TASK]|@";
            case "task.completed" -> "@|fg(green) [TASK]|@";
            case "task.failed" -> "@|fg(red) [TASK]|@";
            case "escalation.created", "escalation.resolved" -> "@|fg(yellow) [ESCALATION]|@";
            case "story.completed" -> "@|fg(green),bold [STORY]|@";
            case "cycle.stalled" -> "@|fg(red),bold [STALLED]|@";
            default -> "@|fg(white) [" + eventType + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + data));
    }

    static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : s.substring(0, max - 3) + "...";
    }
}
