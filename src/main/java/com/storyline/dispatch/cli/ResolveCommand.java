package com.storyline.dispatch.cli;

import com.storyline.core.NotFoundException;
import com.storyline.core.engine.Resolution;
import com.storyline.core.engine.SprintOrchestrator;
import com.storyline.core.engine.Verdict;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: storyline resolve &lt;ESC-N&gt; "&lt;resolution&gt;" [--verdict APPROVE|REJECT|NONE]
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "Resolve an escalation")
@Component
public class ResolveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Escalation id, e.g. ESC-1")
    private String escalationId;

    @Parameters(index = "1", description = "Resolution text")
    private String resolution;

    @Option(names = {"--verdict"}, description = "APPROVE, REJECT or NONE to re-check the deliverable (default: ${DEFAULT-VALUE})",
            defaultValue = "NONE")
    private Verdict verdict;

    private final SprintOrchestrator orchestrator;

    public ResolveCommand(SprintOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        Resolution result;
        try {
            result = orchestrator.resolveEscalation(escalationId, resolution, verdict);
        } catch (NotFoundException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.success("Resolved " + result.escalation().escalationId()
                + " for story " + result.escalation().storyId());
        if (result.regate() != null) {
            ConsoleOutput.info("Task " + result.task().taskId() + " re-checked against the Definition of Done:");
            ConsoleOutput.gateOutcome(result.regate());
        } else if (result.applied() != Verdict.NONE) {
            ConsoleOutput.info("Task " + result.task().taskId() + " is now " + result.task().status().wireName());
        } else if (verdict != Verdict.NONE) {
            ConsoleOutput.warn("Verdict " + verdict + " not applied: no task in progress for this escalation");
        }
        return 0;
    }
}
