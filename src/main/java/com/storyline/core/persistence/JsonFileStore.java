package com.storyline.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Persists one structure as a single JSON file.
 * <p>
 * Every {@link #save} rewrites the whole file through a sibling temp file and an atomic
 * rename, so a crash mid-write leaves the previous version intact. A missing file loads
 * as the supplied empty state.
 *
 * @param <T> persisted record type
 */
public class JsonFileStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final Path file;
    private final Class<T> type;
    private final ObjectMapper objectMapper;
    private final Supplier<T> emptyState;

    public JsonFileStore(Path file, Class<T> type, ObjectMapper objectMapper, Supplier<T> emptyState) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.emptyState = Objects.requireNonNull(emptyState, "emptyState must not be null");
    }

    public Path file() {
        return file;
    }

    public T load() {
        if (!Files.exists(file)) {
            log.debug("No store file at {}, starting empty", file);
            return emptyState.get();
        }
        try {
            T state = objectMapper.readValue(file.toFile(), type);
            return state != null ? state : emptyState.get();
        } catch (IOException e) {
            throw new StoreException("Failed to read " + file, e);
        }
    }

    public void save(T state) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move unsupported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved {}", file);
        } catch (IOException e) {
            throw new StoreException("Failed to write " + file, e);
        }
    }
}
