package com.storyline.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Default dispatcher: drops one instruction file per task into an outbox directory
 * that workers watch, named {@code <taskId>.json}.
 */
public class OutboxTaskDispatcher implements TaskDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxTaskDispatcher.class);

    private final Path outbox;
    private final ObjectMapper objectMapper;

    public OutboxTaskDispatcher(Path outbox, ObjectMapper objectMapper) {
        this.outbox = outbox;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean dispatch(DispatchRequest request) {
        Path file = outbox.resolve(request.taskId() + ".json");
        try {
            Files.createDirectories(outbox);
            objectMapper.writeValue(file.toFile(), request);
            log.info("Dispatched {} to {} via {}", request.taskId(), request.role(), file);
            return true;
        } catch (IOException e) {
            log.error("Failed to write dispatch instruction {}: {}", file, e.getMessage(), e);
            return false;
        }
    }

    public Path outbox() {
        return outbox;
    }
}
