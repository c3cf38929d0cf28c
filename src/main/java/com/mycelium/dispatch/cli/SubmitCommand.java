package com.mycelium.dispatch.cli;

import com.mycelium.core.bridge.ActionCatalog;
import com.mycelium.core.client.DirectiveFailedException;
import com.mycelium.core.client.Submission;
import com.mycelium.core.config.Hierarchy;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.model.ActionKind;
import com.mycelium.core.model.DirectivePayload;
import com.mycelium.core.model.ReportPayload;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * CLI command: mycelium submit capability:ACTION -p key=value ...
 * <p>
 * Sends one directive through the strategic coordinator and waits for its terminal
 * report.
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit a directive")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Action as capability:ACTION, e.g. echo:REVERSE")
    private String action;

    @Option(names = {"--param", "-p"}, description = "Directive parameter key=value (repeatable)")
    private Map<String, String> params = new LinkedHashMap<>();

    @Option(names = "--priority", description = "0 (lowest) to 10 (highest)", defaultValue = "5")
    private int priority;

    @Option(names = "--ttl-ms", description = "Time-to-live in milliseconds")
    private Long ttlMs;

    @Option(names = "--timeout-ms", description = "How long to wait for the report", defaultValue = "30000")
    private long timeoutMs;

    @Option(names = {"--watch", "-w"}, description = "Print hierarchy telemetry while waiting")
    private boolean watch;

    private final Hierarchy hierarchy;
    private final ActionCatalog catalog;
    private final TelemetryFeed telemetry;

    public SubmitCommand(Hierarchy hierarchy, ActionCatalog catalog, TelemetryFeed telemetry) {
        this.hierarchy = hierarchy;
        this.catalog = catalog;
        this.telemetry = telemetry;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ActionKind kind;
        try {
            kind = catalog.resolve(action);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        TelemetryFeed.Subscription subscription = watch ? telemetry.subscribeAll(ConsoleOutput::watchEvent) : null;
        try {
            hierarchy.awaitReady(Duration.ofMillis(timeoutMs));
            Submission submission = hierarchy.client().submit(
                    DirectivePayload.of(kind, new LinkedHashMap<>(params)),
                    priority,
                    ttlMs != null ? Duration.ofMillis(ttlMs) : null);
            ConsoleOutput.info("Submitted " + kind.qualifiedName() + " as " + submission.correlationId());

            ReportPayload report = submission.result().get(timeoutMs, TimeUnit.MILLISECONDS);
            ConsoleOutput.report(report);
            return 0;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof DirectiveFailedException failed) {
                ConsoleOutput.error("Directive failed " + failed.getMessage()
                        + (failed.isRetryable() ? " (retryable)" : ""));
            } else {
                ConsoleOutput.error("Directive failed: " + e.getCause().getMessage());
            }
            return 1;
        } catch (TimeoutException e) {
            ConsoleOutput.error("No report within " + timeoutMs + "ms");
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted");
            return 1;
        } catch (RuntimeException e) {
            ConsoleOutput.error("Submit failed: " + e.getMessage());
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }
}
