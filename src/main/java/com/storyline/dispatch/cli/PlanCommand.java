package com.storyline.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyline.core.engine.SprintOrchestrator;
import com.storyline.core.engine.SprintPlan;
import com.storyline.core.model.Backlog;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: storyline plan &lt;backlog.json&gt; --sprint &lt;id&gt;
 * <p>
 * Checks every backlog story for readiness and decomposes the ready ones into tasks.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Plan a sprint from a backlog file")
@Component
public class PlanCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Backlog JSON file: {\"stories\": [...]}")
    private Path backlogFile;

    @Option(names = {"--sprint", "-s"}, description = "Sprint id", required = true)
    private String sprintId;

    private final SprintOrchestrator orchestrator;
    private final ObjectMapper objectMapper;

    public PlanCommand(SprintOrchestrator orchestrator, ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (!Files.isRegularFile(backlogFile)) {
            ConsoleOutput.error("Backlog file not found: " + backlogFile);
            return 1;
        }
        Backlog backlog;
        try {
            backlog = Backlog.read(backlogFile, objectMapper);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read backlog " + backlogFile + ": " + e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Planning sprint " + sprintId + " from " + backlog.stories().size() + " stories");
        SprintPlan plan = orchestrator.planSprint(sprintId, backlog.stories(), backlog.rejected());

        System.out.println();
        for (String storyId : plan.plannedStories()) {
            ConsoleOutput.success("Story " + storyId + " enqueued");
        }
        plan.tasks().forEach(ConsoleOutput::taskRow);

        plan.notReady().forEach((storyId, missing) ->
                ConsoleOutput.warn("Story " + storyId + " not ready, missing: " + String.join(", ", missing)));
        if (!plan.escalationIds().isEmpty()) {
            ConsoleOutput.info("Escalations raised: " + String.join(", ", plan.escalationIds()));
        }
        plan.skipped().forEach((storyId, reason) ->
                ConsoleOutput.error("Story " + storyId + " skipped: " + reason));

        System.out.println();
        ConsoleOutput.info(plan.tasks().size() + " task(s) created for " + plan.plannedStories().size() + " story(ies)");
        return plan.skipped().isEmpty() ? 0 : 1;
    }
}
