package com.storyline.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyline.core.model.Deliverable;
import com.storyline.core.persistence.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes worker deliverables at {@code <directory>/<taskId>.json}. Workers hand them in
 * through the {@code deliver} command; the orchestrator reads them when a task completes.
 */
public class DeliverableStore {

    private static final Logger log = LoggerFactory.getLogger(DeliverableStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public DeliverableStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns the deliverable for a task, or empty when none was written or it cannot be parsed.
     */
    public Optional<Deliverable> find(String taskId) {
        Path file = fileFor(taskId);
        if (!Files.exists(file)) {
            log.debug("No deliverable for {} at {}", taskId, file);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), Deliverable.class));
        } catch (IOException e) {
            log.warn("Unreadable deliverable for {} at {}: {}", taskId, file, e.getMessage());
            return Optional.empty();
        }
    }

    public void save(Deliverable deliverable) {
        Path file = fileFor(deliverable.taskId());
        try {
            Files.createDirectories(directory);
            objectMapper.writeValue(file.toFile(), deliverable);
        } catch (IOException e) {
            throw new StoreException("Failed to write deliverable " + file, e);
        }
    }

    Path fileFor(String taskId) {
        return directory.resolve(taskId + ".json");
    }
}
