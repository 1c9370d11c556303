package com.storyline.core.monitor;

import com.storyline.TestClock;
import com.storyline.core.NotFoundException;
import com.storyline.core.model.AgentState;
import com.storyline.core.model.AgentStatus;
import com.storyline.core.model.AgentStatusTable;
import com.storyline.core.persistence.JsonFileStore;
import com.storyline.core.persistence.StoreException;
import com.storyline.core.persistence.StoreMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class AgentStatusMonitorTest {

    @TempDir
    Path tempDir;

    private TestClock clock;
    private JsonFileStore<AgentStatusTable> store;
    private AgentStatusMonitor monitor;

    @BeforeEach
    void setUp() {
        clock = new TestClock();
        store = new JsonFileStore<>(tempDir.resolve("agent_status.json"), AgentStatusTable.class,
                StoreMapper.create(), AgentStatusTable::empty);
        monitor = new AgentStatusMonitor(store, new PipelineRouting(), clock);
    }

    @Test
    @DisplayName("Poll returns each completion once")
    void pollReturnsCompletionOnce() {
        monitor.updateAgentStatus("writer", AgentState.COMPLETE, "STORY-001-2");
        monitor.updateAgentStatus("research", AgentState.IN_PROGRESS, "STORY-002-1");

        List<AgentStatus> first = monitor.pollStatusUpdates();
        List<AgentStatus> second = monitor.pollStatusUpdates();

        assertEquals(1, first.size());
        assertEquals("writer", first.get(0).role());
        assertEquals("STORY-001-2", first.get(0).currentTaskId());
        assertTrue(first.get(0).processed());
        assertTrue(second.isEmpty());
    }

    @Test
    @DisplayName("A new report clears the processed flag")
    void newReportClearsProcessed() {
        monitor.updateAgentStatus("writer", AgentState.COMPLETE, "STORY-001-2");
        monitor.pollStatusUpdates();
        clock.advance(Duration.ofMinutes(3));

        monitor.updateAgentStatus("writer", AgentState.COMPLETE, "STORY-002-2");

        assertFalse(monitor.getStatus("writer").processed());
        assertEquals("STORY-002-2", monitor.pollStatusUpdates().get(0).currentTaskId());
    }

    @Test
    @DisplayName("Processed flag and last poll survive a restart")
    void persistsPoll() {
        monitor.updateAgentStatus("writer", AgentState.COMPLETE, "STORY-001-2");
        monitor.pollStatusUpdates();

        var reloaded = new AgentStatusMonitor(store, new PipelineRouting(), clock);

        assertTrue(reloaded.pollStatusUpdates().isEmpty());
        assertEquals(clock.instant(), reloaded.snapshot().lastPoll());
    }

    @Test
    @DisplayName("determineNextAgent follows the pipeline and ends at final review")
    void nextAgent() {
        assertEquals(Optional.of("editor"), monitor.determineNextAgent("writer"));
        assertEquals(Optional.empty(), monitor.determineNextAgent("final-review"));
        assertThrows(NotFoundException.class, () -> monitor.determineNextAgent("nobody"));
    }

    @Test
    @DisplayName("detectBlockers lists blocked agents without changing them")
    void detectBlockers() {
        monitor.updateAgentStatus("editor", AgentState.BLOCKED, "STORY-001-3");
        monitor.updateAgentStatus("graphics", AgentState.IDLE, null);

        var blockers = monitor.detectBlockers();

        assertEquals(List.of("editor"), blockers.stream().map(AgentStatus::role).toList());
        assertEquals(blockers, monitor.detectBlockers());
        assertFalse(monitor.getStatus("editor").processed());
    }

    @Test
    @DisplayName("Unknown roles are rejected")
    void unknownRole() {
        assertThrows(NotFoundException.class,
                () -> monitor.updateAgentStatus("illustrator", AgentState.IDLE, null));
        assertThrows(NotFoundException.class, () -> monitor.getStatus("writer"));
        assertTrue(monitor.agents().isEmpty());
    }

    @Test
    @DisplayName("A failed save leaves the table as it was")
    void failedSaveRollsBack() {
        var failing = spy(store);
        monitor = new AgentStatusMonitor(failing, new PipelineRouting(), clock);
        monitor.updateAgentStatus("writer", AgentState.IN_PROGRESS, "STORY-001-2");
        doThrow(new StoreException("disk full", new IOException("No space left on device")))
                .when(failing).save(any());

        assertThrows(StoreException.class,
                () -> monitor.updateAgentStatus("writer", AgentState.COMPLETE, "STORY-001-2"));

        assertEquals(AgentState.IN_PROGRESS, monitor.getStatus("writer").status());
        assertEquals(AgentState.IN_PROGRESS,
                new AgentStatusMonitor(store, new PipelineRouting(), clock).getStatus("writer").status());
    }
}
