package com.mycelium.dispatch.cli;

import com.mycelium.core.bus.DeadLetter;
import com.mycelium.core.bus.DeadLetterReason;
import com.mycelium.core.bus.DeadLetterStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;

/**
 * CLI command: mycelium dead-letters [--reason REASON]
 */
@Command(name = "dead-letters", mixinStandardHelpOptions = true, description = "List recent dead letters")
@Component
public class DeadLettersCommand implements Runnable {

    @Option(names = {"--reason", "-r"}, description = "Only this reason: ${COMPLETION-CANDIDATES}")
    private DeadLetterReason reason;

    private final DeadLetterStore deadLetters;

    public DeadLettersCommand(DeadLetterStore deadLetters) {
        this.deadLetters = deadLetters;
    }

    @Override
    public void run() {
        List<DeadLetter> letters = reason != null ? deadLetters.byReason(reason) : deadLetters.list();
        ConsoleOutput.info(letters.size() + " retained of " + deadLetters.count() + " recorded");
        letters.forEach(ConsoleOutput::deadLetter);
    }
}
