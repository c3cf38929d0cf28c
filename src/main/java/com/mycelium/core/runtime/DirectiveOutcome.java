package com.mycelium.core.runtime;

import com.mycelium.core.model.ReportPayload;

/**
 * What {@link Agent#onDirective} returns: either the terminal report, which the runtime
 * sends back to the directive's sender, or a promise that the agent will send it later
 * through {@link AgentContext#report}.
 */
public final class DirectiveOutcome {

    private static final DirectiveOutcome DEFERRED = new DirectiveOutcome(null);

    private final ReportPayload report;

    private DirectiveOutcome(ReportPayload report) {
        this.report = report;
    }

    public static DirectiveOutcome completed(ReportPayload report) {
        if (report == null) {
            throw new IllegalArgumentException("completed outcome needs a report");
        }
        return new DirectiveOutcome(report);
    }

    public static DirectiveOutcome deferred() {
        return DEFERRED;
    }

    public boolean isDeferred() {
        return report == null;
    }

    public ReportPayload report() {
        return report;
    }
}
