package com.storyline.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyline.core.NotFoundException;
import com.storyline.core.model.Deliverable;
import com.storyline.core.model.DodResult;
import com.storyline.core.qualitygate.QualityGateValidator;
import com.storyline.core.queue.TaskQueue;
import com.storyline.worker.DeliverableStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: storyline deliver &lt;taskId&gt; &lt;deliverable.json&gt;
 * <p>
 * Worker-side hand-in of a deliverable. The quality gate runs once the worker reports
 * {@code complete} through {@code agent}; this command only previews the result.
 */
@Command(name = "deliver", mixinStandardHelpOptions = true, description = "Hand in a worker's deliverable for a task")
@Component
public class DeliverCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task id, e.g. STORY-001-2")
    private String taskId;

    @Parameters(index = "1", description = "Deliverable JSON file")
    private Path file;

    private final TaskQueue taskQueue;
    private final DeliverableStore deliverables;
    private final QualityGateValidator validator;
    private final ObjectMapper objectMapper;

    public DeliverCommand(TaskQueue taskQueue, DeliverableStore deliverables,
                          QualityGateValidator validator, ObjectMapper objectMapper) {
        this.taskQueue = taskQueue;
        this.deliverables = deliverables;
        this.validator = validator;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        try {
            taskQueue.getTask(taskId);
        } catch (NotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
        if (!Files.isRegularFile(file)) {
            ConsoleOutput.error("Deliverable file not found: " + file);
            return 1;
        }

        Deliverable read;
        try {
            read = objectMapper.readValue(file.toFile(), Deliverable.class);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read deliverable " + file + ": " + e.getMessage());
            return 1;
        }
        if (read.taskId() != null && !read.taskId().equals(taskId)) {
            ConsoleOutput.error("Deliverable is for " + read.taskId() + ", not " + taskId);
            return 1;
        }

        var deliverable = new Deliverable(taskId, read.selfValidation(), read.output(),
                read.acceptanceCriteriaResults());
        deliverables.save(deliverable);
        ConsoleOutput.success("Deliverable stored for " + taskId);

        DodResult preview = validator.validateDoD(deliverable);
        if (preview.passed()) {
            ConsoleOutput.info("Definition of Done: no issues");
        } else {
            ConsoleOutput.warn("Definition of Done: " + preview.issues().size() + " issue(s)");
            preview.issues().forEach(issue -> ConsoleOutput.warn("  " + issue));
        }
        return 0;
    }
}
