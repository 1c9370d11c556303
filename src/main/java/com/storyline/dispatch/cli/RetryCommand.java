package com.storyline.dispatch.cli;

import com.storyline.core.NotFoundException;
import com.storyline.core.queue.TaskQueue;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: storyline retry &lt;taskId&gt;
 */
@Command(name = "retry", mixinStandardHelpOptions = true, description = "Re-enqueue a failed task")
@Component
public class RetryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Failed task id")
    private String taskId;

    private final TaskQueue taskQueue;

    public RetryCommand(TaskQueue taskQueue) {
        this.taskQueue = taskQueue;
    }

    @Override
    public Integer call() {
        try {
            var retry = taskQueue.reenqueue(taskId);
            ConsoleOutput.success("Re-enqueued " + taskId + " as " + retry.taskId()
                    + " (" + retry.status().wireName() + ")");
            return 0;
        } catch (NotFoundException | IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
