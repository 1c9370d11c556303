package com.storyline.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backlog file contents: {@code {"stories": [...]}}.
 *
 * @param stories  entries that parsed as stories, in file order
 * @param rejected entries that did not, keyed by story id ("#n" when the entry has none),
 *                 with the reason
 */
public record Backlog(List<Story> stories, Map<String, String> rejected) {

    private static final Logger log = LoggerFactory.getLogger(Backlog.class);

    public Backlog {
        stories = stories != null ? List.copyOf(stories) : List.of();
        rejected = rejected != null ? Collections.unmodifiableMap(new LinkedHashMap<>(rejected)) : Map.of();
    }

    /**
     * Reads a backlog file one entry at a time, so a malformed story is rejected on its own
     * instead of failing the whole file.
     *
     * @throws IOException if the file cannot be read or is not a backlog document
     */
    public static Backlog read(Path file, ObjectMapper objectMapper) throws IOException {
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Backlog must be a JSON object with a \"stories\" array");
        }
        JsonNode entries = root.path("stories");
        if (entries.isMissingNode() || entries.isNull()) {
            return new Backlog(List.of(), Map.of());
        }
        if (!entries.isArray()) {
            throw new IOException("\"stories\" must be an array");
        }

        var stories = new ArrayList<Story>();
        var rejected = new LinkedHashMap<String, String>();
        for (int i = 0; i < entries.size(); i++) {
            JsonNode entry = entries.get(i);
            try {
                stories.add(objectMapper.treeToValue(entry, Story.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                String id = entry.path("story_id").asText("");
                String key = id.isBlank() ? "#" + (i + 1) : id;
                String reason = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
                rejected.put(key, reason);
                log.warn("Rejected backlog entry {}: {}", key, reason);
            }
        }
        return new Backlog(stories, rejected);
    }
}
