package com.storyline.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyline.core.model.AgentState;
import com.storyline.core.model.AgentStatus;
import com.storyline.core.model.AgentStatusTable;
import com.storyline.core.model.Escalation;
import com.storyline.core.model.EscalationLog;
import com.storyline.core.model.Phase;
import com.storyline.core.model.Priority;
import com.storyline.core.model.Task;
import com.storyline.core.model.TaskQueueState;
import com.storyline.core.model.TaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileStoreTest {

    private static final Instant T0 = Instant.parse("2025-01-06T09:00:00Z");

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = StoreMapper.create();
    }

    @Test
    @DisplayName("Missing file loads the empty state")
    void missingFileLoadsEmpty() {
        var store = new JsonFileStore<>(tempDir.resolve("task_queue.json"), TaskQueueState.class,
                mapper, TaskQueueState::empty);
        assertEquals(TaskQueueState.empty(), store.load());
    }

    @Test
    @DisplayName("Task queue survives save and load with snake_case keys")
    void taskQueueRoundTrip() throws Exception {
        Path file = tempDir.resolve("task_queue.json");
        var store = new JsonFileStore<>(file, TaskQueueState.class, mapper, TaskQueueState::empty);
        var task = new Task("STORY-001-2", "STORY-001", "Write: guide", Phase.WRITING, Priority.P0,
                TaskStatus.BLOCKED, null, List.of("STORY-001-1"), List.of("[ ] a"), T0, null, null);
        var state = new TaskQueueState("sprint-1", List.of(task), T0);

        store.save(state);

        String json = Files.readString(file);
        assertTrue(json.contains("\"sprint_id\" : \"sprint-1\""));
        assertTrue(json.contains("\"depends_on\""));
        assertTrue(json.contains("\"status\" : \"blocked\""));
        assertTrue(json.contains("\"phase\" : \"writing\""));
        assertTrue(json.contains("2025-01-06T09:00:00Z"));
        assertFalse(Files.exists(tempDir.resolve("task_queue.json.tmp")));
        assertEquals(state, store.load());
    }

    @Test
    @DisplayName("Agent table and escalation log survive save and load")
    void otherStoresRoundTrip() {
        var agents = new JsonFileStore<>(tempDir.resolve("agent_status.json"), AgentStatusTable.class,
                mapper, AgentStatusTable::empty);
        var table = new AgentStatusTable(List.of(
                new AgentStatus("writer", AgentState.COMPLETE, "STORY-001-2", true, T0)), T0);
        agents.save(table);
        assertEquals(table, agents.load());

        var escalations = new JsonFileStore<>(tempDir.resolve("escalations.json"), EscalationLog.class,
                mapper, EscalationLog::empty);
        var log = new EscalationLog(2, List.of(new Escalation("ESC-1", "STORY-001", null, "dor_gap",
                "Missing fields?", Map.of("missing_fields", List.of("story_points")), null,
                "orchestrator", T0, false, null, null)));
        escalations.save(log);
        assertEquals(log, escalations.load());
    }

    @Test
    @DisplayName("Corrupt file raises StoreException")
    void corruptFile() throws Exception {
        Path file = tempDir.resolve("escalations.json");
        Files.writeString(file, "{ not json");
        var store = new JsonFileStore<>(file, EscalationLog.class, mapper, EscalationLog::empty);

        var ex = assertThrows(StoreException.class, store::load);
        assertTrue(ex.getMessage().contains("escalations.json"));
    }

    @Test
    @DisplayName("Save creates missing parent directories")
    void createsParentDirectories() {
        Path file = tempDir.resolve("nested/state/agent_status.json");
        var store = new JsonFileStore<>(file, AgentStatusTable.class, mapper, AgentStatusTable::empty);
        store.save(AgentStatusTable.empty());
        assertTrue(Files.exists(file));
    }
}
