package com.storyline.dispatch.cli;

import com.storyline.core.engine.CycleReport;
import com.storyline.core.engine.SprintOrchestrator;
import com.storyline.core.events.EventBus;
import com.storyline.core.events.StorylineEvent;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;
import java.util.function.Consumer;

/**
 * CLI command: storyline cycle [--repeat N] [--interval S] [--verbose] [--story ID]
 * <p>
 * Exits 2 when the last cycle ends stalled.
 */
@Command(name = "cycle", mixinStandardHelpOptions = true, description = "Run scheduling cycle(s)")
@Component
public class CycleCommand implements Callable<Integer> {

    static final int EXIT_STALLED = 2;

    @Option(names = {"--repeat", "-n"}, description = "Number of cycles (default: ${DEFAULT-VALUE})",
            defaultValue = "1")
    private int repeat;

    @Option(names = {"--interval", "-i"}, description = "Seconds between cycles (default: ${DEFAULT-VALUE})",
            defaultValue = "0")
    private long intervalSeconds;

    @Option(names = {"--verbose", "-v"}, description = "Print orchestration events as they happen")
    private boolean verbose;

    @Option(names = {"--story", "-s"}, description = "Print events of this story only (implies --verbose)")
    private String storyId;

    private final SprintOrchestrator orchestrator;
    private final EventBus eventBus;

    public CycleCommand(SprintOrchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Consumer<StorylineEvent> printer = event -> ConsoleOutput.watchEvent(event.eventType(),
                (event.taskId() != null ? event.taskId() : event.storyId() != null ? event.storyId() : "-")
                        + " " + event.payload());
        EventBus.Subscription subscription = null;
        if (storyId != null) {
            subscription = eventBus.subscribe(storyId, printer);
        } else if (verbose) {
            subscription = eventBus.subscribeAll(printer);
        }
        try {
            CycleReport report = null;
            for (int i = 0; i < Math.max(repeat, 1); i++) {
                if (i > 0 && intervalSeconds > 0) {
                    try {
                        Thread.sleep(intervalSeconds * 1000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        ConsoleOutput.info("Interrupted.");
                        break;
                    }
                }
                report = orchestrator.runCycle();
                print(report);
            }
            return report != null && report.stalled() ? EXIT_STALLED : 0;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }

    private void print(CycleReport report) {
        System.out.println();
        ConsoleOutput.info("Cycle " + report.cycle() + " (" + report.durationMs() + "ms)");
        report.outcomes().forEach(ConsoleOutput::gateOutcome);
        report.dispatched().forEach(ConsoleOutput::dispatched);
        for (var blocker : report.blockers()) {
            ConsoleOutput.warn("Agent " + blocker.role() + " blocked on " + blocker.currentTaskId());
        }
        for (String error : report.errors()) {
            ConsoleOutput.error(error);
        }
        ConsoleOutput.stall(report.stall());
        if (report.outcomes().isEmpty() && report.dispatched().isEmpty()) {
            ConsoleOutput.info("Nothing to do");
        }
    }
}
