package com.storyline.dispatch.cli;

import com.storyline.core.escalation.EscalationManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: storyline escalations [--all]
 */
@Command(name = "escalations", mixinStandardHelpOptions = true, description = "List escalations awaiting a decision")
@Component
public class EscalationsCommand implements Runnable {

    @Option(names = {"--all", "-a"}, description = "Include resolved escalations")
    private boolean all;

    private final EscalationManager escalations;

    public EscalationsCommand(EscalationManager escalations) {
        this.escalations = escalations;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var listed = all ? escalations.all() : escalations.getUnresolved();
        if (listed.isEmpty()) {
            ConsoleOutput.success(all ? "No escalations" : "No unresolved escalations");
            return;
        }
        for (var escalation : listed) {
            ConsoleOutput.escalation(escalation);
        }
    }
}
