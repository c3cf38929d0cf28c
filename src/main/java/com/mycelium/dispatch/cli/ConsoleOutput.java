package com.mycelium.dispatch.cli;

import com.mycelium.core.bus.DeadLetter;
import com.mycelium.core.events.TelemetryEvent;
import com.mycelium.core.model.ReportPayload;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Mycelium CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(green) MYCELIUM v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MYCELIUM]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void report(ReportPayload report) {
        if (report.succeeded()) {
            success("SUCCESS " + report.data());
        } else {
            error("FAILED " + report.errorCode() + ": " + report.message()
                    + (report.retryable() ? " (retryable)" : ""));
        }
        if (!report.metrics().isEmpty()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) metrics|@ " + report.metrics()));
        }
    }

    public static void deadLetter(DeadLetter letter) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) " + letter.reason() + "|@ " + letter.envelope().kind() + " "
                        + letter.envelope().id() + " " + letter.envelope().senderId() + " -> "
                        + letter.recipientId() + " at " + letter.timestamp()));
    }

    public static void watchEvent(TelemetryEvent event) {
        String prefix = switch (event.eventType()) {
            case TelemetryEvent.AGENT_REGISTERED, TelemetryEvent.AGENT_UNREGISTERED -> "@|fg(cyan) [AGENT]|@";
            case TelemetryEvent.AGENT_STATE_CHANGED -> "@|fg(blue) [STATE]|@";
            case TelemetryEvent.DEAD_LETTERED -> "@|fg(red) [DEAD-LETTER]|@";
            case TelemetryEvent.BREAKER_TRANSITION -> "@|fg(magenta) [BREAKER]|@";
            case TelemetryEvent.RETRY_SCHEDULED, TelemetryEvent.CHILD_RESTARTED -> "@|fg(yellow) [SUPERVISOR]|@";
            case TelemetryEvent.DIRECTIVE_COMPLETED -> "@|fg(green) [DIRECTIVE]|@";
            case TelemetryEvent.SUMMARY_EMITTED, TelemetryEvent.CONTROL_ISSUED -> "@|bold,fg(yellow) [STRATEGY]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.agentId() + " " + event.data()));
    }
}
