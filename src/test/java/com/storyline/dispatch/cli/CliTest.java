package com.storyline.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyline.TestClock;
import com.storyline.core.config.StorylineProperties;
import com.storyline.core.engine.NoRetryPolicy;
import com.storyline.core.engine.SprintOrchestrator;
import com.storyline.core.escalation.EscalationManager;
import com.storyline.core.events.EventBus;
import com.storyline.core.metrics.StorylineMetrics;
import com.storyline.core.model.AgentStatusTable;
import com.storyline.core.model.Deliverable;
import com.storyline.core.model.EscalationLog;
import com.storyline.core.model.Phase;
import com.storyline.core.model.TaskStatus;
import com.storyline.core.model.TaskQueueState;
import com.storyline.core.monitor.AgentStatusMonitor;
import com.storyline.core.monitor.PipelineRouting;
import com.storyline.core.persistence.JsonFileStore;
import com.storyline.core.persistence.StoreMapper;
import com.storyline.core.qualitygate.QualityGateValidator;
import com.storyline.core.queue.TaskQueue;
import com.storyline.core.scheduler.StallDetector;
import com.storyline.worker.DeliverableStore;
import com.storyline.worker.OutboxTaskDispatcher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Storyline CLI command structure.
 * Commands run through picocli directly, without a Spring context, over stores in a temp directory.
 */
class CliTest {

    private static final String READY_STORY = """
            {
              "story_id": "STORY-001",
              "user_story": "As a home baker, I want a sourdough starter guide",
              "acceptance_criteria": ["[ ] Feeding schedule", "[ ] Troubleshooting", "[ ] Two sources"],
              "quality_requirements": {"tone": "friendly"},
              "priority": "P0",
              "story_points": 5
            }""";

    private static final String UNREADY_STORY = """
            {
              "story_id": "STORY-002",
              "user_story": "As a reader, I want charts",
              "acceptance_criteria": ["[ ] One", "[ ] Two", "[ ] Three"]
            }""";

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;
    private TaskQueue queue;
    private AgentStatusMonitor monitor;
    private EscalationManager escalations;
    private DeliverableStore deliverables;
    private SprintOrchestrator orchestrator;
    private EventBus eventBus;

    private record CliResult(int exitCode, String output) {}

    @BeforeEach
    void setUp() {
        var properties = new StorylineProperties();
        properties.getStorage().setDirectory(tempDir.resolve("state").toString());
        properties.getPipeline().setPhases(List.of(Phase.RESEARCH, Phase.WRITING, Phase.EDITING));

        var clock = new TestClock();
        var routing = new PipelineRouting();
        mapper = StoreMapper.create();
        queue = new TaskQueue(new JsonFileStore<>(properties.getTaskQueuePath(), TaskQueueState.class,
                mapper, TaskQueueState::empty), routing, properties.getPhases(), clock);
        monitor = new AgentStatusMonitor(new JsonFileStore<>(properties.getAgentStatusPath(),
                AgentStatusTable.class, mapper, AgentStatusTable::empty), routing, clock);
        escalations = new EscalationManager(new JsonFileStore<>(properties.getEscalationsPath(),
                EscalationLog.class, mapper, EscalationLog::empty), clock);
        deliverables = new DeliverableStore(properties.getDeliverablesPath(), mapper);
        eventBus = new EventBus();
        orchestrator = new SprintOrchestrator(queue, monitor, new QualityGateValidator(), escalations, routing,
                deliverables, new OutboxTaskDispatcher(properties.getOutboxPath(), mapper), new NoRetryPolicy(),
                new StallDetector(), eventBus, new StorylineMetrics(new SimpleMeterRegistry()), properties, clock);
    }

    /**
     * Custom picocli IFactory that provides the test's components to commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == PlanCommand.class) {
                    return (K) new PlanCommand(orchestrator, mapper);
                }
                if (cls == CycleCommand.class) {
                    return (K) new CycleCommand(orchestrator, eventBus);
                }
                if (cls == StatusCommand.class) {
                    return (K) new StatusCommand(queue, monitor, escalations);
                }
                if (cls == EscalationsCommand.class) {
                    return (K) new EscalationsCommand(escalations);
                }
                if (cls == ResolveCommand.class) {
                    return (K) new ResolveCommand(orchestrator);
                }
                if (cls == AgentCommand.class) {
                    return (K) new AgentCommand(monitor);
                }
                if (cls == RetryCommand.class) {
                    return (K) new RetryCommand(queue);
                }
                if (cls == DeliverCommand.class) {
                    return (K) new DeliverCommand(queue, deliverables, new QualityGateValidator(), mapper);
                }
                // Default: use picocli's default factory for other classes
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new StorylineCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path backlog(String... stories) throws Exception {
        return Files.writeString(tempDir.resolve("backlog.json"),
                "{\"stories\": [" + String.join(",", stories) + "]}");
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String name : List.of("plan", "cycle", "status", "escalations", "resolve", "agent", "retry")) {
                assertTrue(result.output().contains(name), "Help should list '" + name + "' subcommand");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Storyline 0.1.0"));
        }
    }

    @Nested
    @DisplayName("plan")
    class PlanTests {

        @Test
        @DisplayName("Enqueues ready stories and escalates the rest")
        void plansBacklog() throws Exception {
            CliResult result = execute("plan", backlog(READY_STORY, UNREADY_STORY).toString(), "--sprint", "sprint-1");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("STORY-001-1"));
            assertTrue(result.output().contains("STORY-002 not ready"));
            assertEquals(3, queue.tasks().size());
            assertEquals(1, escalations.getUnresolved().size());
        }

        @Test
        @DisplayName("A story with a bad priority is skipped and the rest are planned")
        void badPrioritySkipsOneStory() throws Exception {
            String bad = READY_STORY.replace("STORY-001", "STORY-009").replace("\"P0\"", "\"high\"");

            CliResult result = execute("plan", backlog(bad, READY_STORY).toString(), "--sprint", "sprint-1");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("STORY-009 skipped"));
            assertEquals(3, queue.tasksForStory("STORY-001").size());
            assertTrue(queue.tasksForStory("STORY-009").isEmpty());
        }

        @Test
        @DisplayName("Missing backlog file exits 1")
        void missingFile() {
            CliResult result = execute("plan", tempDir.resolve("nope.json").toString(), "--sprint", "s");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Backlog file not found"));
        }
    }

    @Nested
    @DisplayName("cycle")
    class CycleTests {

        @Test
        @DisplayName("Dispatches to the outbox and exits 0")
        void dispatches() throws Exception {
            execute("plan", backlog(READY_STORY).toString(), "--sprint", "sprint-1");

            CliResult result = execute("cycle", "--verbose");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("STORY-001-1"));
            assertTrue(Files.exists(tempDir.resolve("state/outbox/STORY-001-1.json")));
        }

        @Test
        @DisplayName("--story prints the events of one story only")
        void storyEvents() throws Exception {
            String second = READY_STORY.replace("STORY-001", "STORY-003").replace("\"P0\"", "\"P1\"");
            execute("plan", backlog(READY_STORY, second).toString(), "--sprint", "sprint-1");

            CliResult result = execute("cycle", "--repeat", "2", "--story", "STORY-003");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("STORY-003-1 {role=research}"));
            assertFalse(result.output().contains("STORY-001-1 {"));
            assertTrue(Files.exists(tempDir.resolve("state/outbox/STORY-001-1.json")));
        }

        @Test
        @DisplayName("Exits 2 when rejected work leaves the story stalled")
        void stalledExitCode() throws Exception {
            execute("plan", backlog(READY_STORY).toString(), "--sprint", "sprint-1");
            execute("cycle");
            deliverables.save(new Deliverable("STORY-001-1", new Deliverable.SelfValidation(false),
                    null, List.of(new Deliverable.CriterionResult("Feeding schedule", false))));
            execute("agent", "research", "complete", "--task", "STORY-001-1");

            CliResult result = execute("cycle");

            assertEquals(CycleCommand.EXIT_STALLED, result.exitCode());
            assertTrue(result.output().contains("STORY-001-2"));
        }
    }

    @Nested
    @DisplayName("escalations and resolve")
    class EscalationTests {

        @Test
        @DisplayName("Lists open escalations and resolves them")
        void listAndResolve() throws Exception {
            execute("plan", backlog(UNREADY_STORY).toString(), "--sprint", "sprint-1");

            CliResult listed = execute("escalations");
            assertTrue(listed.output().contains("ESC-1"));
            assertTrue(listed.output().contains("dor_gap"));

            CliResult resolved = execute("resolve", "ESC-1", "Added points and requirements");
            assertEquals(0, resolved.exitCode());
            assertTrue(escalations.getUnresolved().isEmpty());

            assertTrue(execute("escalations").output().contains("No unresolved escalations"));
            assertTrue(execute("escalations", "--all").output().contains("ESC-1"));
        }

        @Test
        @DisplayName("Resolving without a verdict re-checks the deliverable and keeps the story waiting")
        void resolveWithoutVerdictRegates() throws Exception {
            execute("plan", backlog(READY_STORY).toString(), "--sprint", "sprint-1");
            execute("cycle");
            execute("agent", "research", "complete", "--task", "STORY-001-1");
            assertEquals(CycleCommand.EXIT_STALLED, execute("cycle").exitCode());

            CliResult resolved = execute("resolve", "ESC-1", "Looks fine");

            assertEquals(0, resolved.exitCode());
            assertTrue(resolved.output().contains("ESC-2"));
            assertEquals(1, escalations.getUnresolved().size());
            assertEquals(CycleCommand.EXIT_STALLED, execute("cycle").exitCode());
        }

        @Test
        @DisplayName("Unknown escalation exits 1")
        void unknownEscalation() {
            CliResult result = execute("resolve", "ESC-42", "whatever", "--verdict", "APPROVE");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("ESC-42"));
        }
    }

    @Nested
    @DisplayName("agent, deliver, retry and status")
    class WorkerTests {

        private static final String CLEAN_DELIVERABLE = """
                {
                  "task_id": "STORY-001-1",
                  "self_validation": {"passed": true},
                  "output": {"path": "research/sourdough.md"},
                  "acceptance_criteria_results": [{"criterion": "Feeding schedule", "passed": true}]
                }""";

        @Test
        @DisplayName("A handed-in deliverable passes the gate on the next cycle")
        void deliverThenComplete() throws Exception {
            execute("plan", backlog(READY_STORY).toString(), "--sprint", "sprint-1");
            execute("cycle");
            Path file = Files.writeString(tempDir.resolve("deliverable.json"), CLEAN_DELIVERABLE);

            CliResult delivered = execute("deliver", "STORY-001-1", file.toString());

            assertEquals(0, delivered.exitCode());
            assertTrue(delivered.output().contains("no issues"));
            assertTrue(deliverables.find("STORY-001-1").isPresent());

            execute("agent", "research", "complete", "--task", "STORY-001-1");
            assertEquals(0, execute("cycle").exitCode());
            assertEquals(TaskStatus.COMPLETE, queue.getTask("STORY-001-1").status());
            assertTrue(escalations.getUnresolved().isEmpty());
        }

        @Test
        @DisplayName("Deliverable for another task, unknown task or missing file exits 1")
        void deliverRejected() throws Exception {
            execute("plan", backlog(READY_STORY).toString(), "--sprint", "sprint-1");
            Path file = Files.writeString(tempDir.resolve("deliverable.json"), CLEAN_DELIVERABLE);

            assertEquals(1, execute("deliver", "STORY-001-2", file.toString()).exitCode());
            assertEquals(1, execute("deliver", "STORY-404-1", file.toString()).exitCode());
            assertEquals(1, execute("deliver", "STORY-001-1", tempDir.resolve("none.json").toString()).exitCode());
            assertTrue(deliverables.find("STORY-001-2").isEmpty());
        }

        @Test
        @DisplayName("Unknown role or status exits 1")
        void badAgentReport() {
            assertEquals(1, execute("agent", "illustrator", "idle").exitCode());
            assertEquals(1, execute("agent", "writer", "sleeping").exitCode());
            assertEquals(0, execute("agent", "writer", "idle").exitCode());
        }

        @Test
        @DisplayName("Retry of a task that has not failed exits 1")
        void retryNotFailed() throws Exception {
            execute("plan", backlog(READY_STORY).toString(), "--sprint", "sprint-1");
            CliResult result = execute("retry", "STORY-001-1");
            assertEquals(1, result.exitCode());
        }

        @Test
        @DisplayName("Status shows counts, tasks and agents")
        void status() throws Exception {
            execute("plan", backlog(READY_STORY).toString(), "--sprint", "sprint-1");
            execute("agent", "research", "in_progress", "--task", "STORY-001-1");

            CliResult result = execute("status");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("SPRINT sprint-1"));
            assertTrue(result.output().contains("pending: 1"));
            assertTrue(result.output().contains("STORY-001-3"));
            assertTrue(result.output().contains("research"));
        }
    }
}
