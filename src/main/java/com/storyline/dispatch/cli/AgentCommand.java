package com.storyline.dispatch.cli;

import com.storyline.core.NotFoundException;
import com.storyline.core.model.AgentState;
import com.storyline.core.monitor.AgentStatusMonitor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: storyline agent &lt;role&gt; &lt;status&gt; [--task ID]
 * <p>
 * Worker-side status report.
 */
@Command(name = "agent", mixinStandardHelpOptions = true, description = "Report a worker's status")
@Component
public class AgentCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Worker role, e.g. writer")
    private String role;

    @Parameters(index = "1", description = "idle, in_progress, complete or blocked")
    private String status;

    @Option(names = {"--task", "-t"}, description = "Task the worker holds")
    private String taskId;

    private final AgentStatusMonitor monitor;

    public AgentCommand(AgentStatusMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public Integer call() {
        AgentState state;
        try {
            state = AgentState.fromWireName(status);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage() + ". Valid: idle, in_progress, complete, blocked");
            return 1;
        }
        try {
            var updated = monitor.updateAgentStatus(role, state, taskId);
            ConsoleOutput.success("Agent " + updated.role() + " is " + updated.status().wireName()
                    + (updated.currentTaskId() != null ? " (" + updated.currentTaskId() + ")" : ""));
            return 0;
        } catch (NotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
