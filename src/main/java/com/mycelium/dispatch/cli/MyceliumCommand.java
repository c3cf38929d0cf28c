package com.mycelium.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Mycelium.
 * Routes to subcommands: submit, health, dead-letters.
 */
@Command(
        name = "mycelium",
        mixinStandardHelpOptions = true,
        version = "Mycelium 0.1.0",
        description = "Hierarchical agent orchestration core",
        subcommands = {
                SubmitCommand.class,
                HealthCommand.class,
                DeadLettersCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MyceliumCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
