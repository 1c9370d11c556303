package com.storyline.worker;

import com.storyline.core.model.Deliverable;
import com.storyline.core.persistence.StoreMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeliverableStoreTest {

    @TempDir
    Path tempDir;

    private DeliverableStore store;

    @BeforeEach
    void setUp() {
        store = new DeliverableStore(tempDir.resolve("deliverables"), StoreMapper.create());
    }

    @Test
    @DisplayName("Reads a worker-written deliverable")
    void readsWorkerJson() throws Exception {
        Files.createDirectories(tempDir.resolve("deliverables"));
        Files.writeString(tempDir.resolve("deliverables/STORY-001-1.json"), """
                {
                  "task_id": "STORY-001-1",
                  "self_validation": {"passed": true},
                  "output": {"path": "research/notes.md"},
                  "acceptance_criteria_results": [
                    {"criterion": "Covers feeding schedule", "passed": false}
                  ],
                  "worker_notes": "ignored"
                }
                """);

        Deliverable deliverable = store.find("STORY-001-1").orElseThrow();

        assertTrue(deliverable.selfValidationPassed());
        assertEquals("research/notes.md", deliverable.output().path());
        assertFalse(deliverable.acceptanceCriteriaResults().get(0).passed());
    }

    @Test
    @DisplayName("Saved deliverables can be found again")
    void saveAndFind() {
        var deliverable = new Deliverable("STORY-001-2", new Deliverable.SelfValidation(true),
                new Deliverable.Output("draft.md"), List.of());
        store.save(deliverable);

        assertEquals(deliverable, store.find("STORY-001-2").orElseThrow());
    }

    @Test
    @DisplayName("Missing or unreadable deliverables are empty")
    void missingOrCorrupt() throws Exception {
        assertTrue(store.find("STORY-404-1").isEmpty());

        Files.createDirectories(tempDir.resolve("deliverables"));
        Files.writeString(tempDir.resolve("deliverables/STORY-001-3.json"), "not json");
        assertTrue(store.find("STORY-001-3").isEmpty());
    }
}
