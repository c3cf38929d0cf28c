package com.mycelium.agents;

import com.mycelium.core.model.DirectivePayload;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.ErrorCode;
import com.mycelium.core.model.ReportPayload;
import com.mycelium.core.runtime.Agent;
import com.mycelium.core.runtime.AgentContext;
import com.mycelium.core.runtime.DirectiveOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Execution agent that returns its {@code text} parameter, as is or reversed.
 * An optional {@code delayMs} parameter simulates slow work.
 */
public class EchoAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(EchoAgent.class);

    @Override
    public DirectiveOutcome onDirective(Envelope directive, AgentContext context) throws InterruptedException {
        DirectivePayload request = directive.payloadAs(DirectivePayload.class);
        EchoAction action = request.actionAs(EchoAction.class);
        String text = request.param("text");
        if (text == null) {
            return DirectiveOutcome.completed(ReportPayload.failed(ErrorCode.HANDLER_ERROR,
                    "Missing parameter 'text'", false));
        }

        String delay = request.param("delayMs");
        if (delay != null) {
            Thread.sleep(Long.parseLong(delay));
        }

        String result = switch (action) {
            case ECHO -> text;
            case REVERSE -> new StringBuilder(text).reverse().toString();
        };
        log.debug("{} {} -> {}", context.id(), action, result);
        return DirectiveOutcome.completed(ReportPayload.success(Map.of("text", result, "agent", context.id())));
    }
}
