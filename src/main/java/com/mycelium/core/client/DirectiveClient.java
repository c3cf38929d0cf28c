package com.mycelium.core.client;

import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.bus.RoutingException;
import com.mycelium.core.bus.SendResult;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.DirectivePayload;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.ErrorCode;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.EventTypes;
import com.mycelium.core.model.GoalPayload;
import com.mycelium.core.model.MessageKind;
import com.mycelium.core.model.Payload;
import com.mycelium.core.model.ReportPayload;
import com.mycelium.core.model.Tier;
import com.mycelium.core.runtime.Agent;
import com.mycelium.core.runtime.AgentContext;
import com.mycelium.core.runtime.DirectiveOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for code outside the hierarchy. Runs as an ordinary agent so that
 * reports can be addressed to it, and turns each terminal report into the completion
 * of a {@link CompletableFuture}. {@link #submit} may be called from any thread.
 */
public class DirectiveClient implements Agent {

    private static final Logger log = LoggerFactory.getLogger(DirectiveClient.class);

    public static final String CAPABILITY = "gateway";

    private final String id;
    private final String targetId;
    private final MessageBus bus;
    private final Map<String, CompletableFuture<ReportPayload>> pending = new ConcurrentHashMap<>();

    public DirectiveClient(String id, String targetId, MessageBus bus) {
        this.id = id;
        this.targetId = targetId;
        this.bus = bus;
    }

    public AgentIdentity identity() {
        return AgentIdentity.of(id, Tier.EXECUTION, null, CAPABILITY);
    }

    public Submission submit(DirectivePayload directive) {
        return submit(directive, Envelope.DEFAULT_PRIORITY, null);
    }

    public Submission submit(GoalPayload goal, int priority, Duration ttl) {
        return send(goal, priority, ttl);
    }

    /**
     * Sends a directive to the target (normally the strategic coordinator).
     *
     * @throws RoutingException if the target cannot be reached at all
     */
    public Submission submit(DirectivePayload directive, int priority, Duration ttl) {
        return send(directive, priority, ttl);
    }

    private Submission send(Payload payload, int priority, Duration ttl) {
        Envelope envelope = Envelope.builder()
                .from(id)
                .to(targetId)
                .kind(MessageKind.DIRECTIVE)
                .payload(payload)
                .requiresResponse(true)
                .priority(priority)
                .ttl(ttl)
                .createdAt(bus.clock().instant())
                .build();
        var future = new CompletableFuture<ReportPayload>();
        pending.put(envelope.correlationKey(), future);
        SendResult result = bus.send(envelope);
        if (!result.allDelivered()) {
            pending.remove(envelope.correlationKey());
            result.requireDelivered();
        }
        log.debug("Submitted {} to {}", envelope.id(), targetId);
        return new Submission(envelope.correlationKey(), future);
    }

    /** Asks the target to give up on a submission; its future fails with ABANDONED. */
    public void abandon(String correlationId) {
        bus.send(Envelope.builder()
                .from(id)
                .to(targetId)
                .event(EventPayload.of(EventTypes.ABANDON, Map.of("correlationId", correlationId)))
                .createdAt(bus.clock().instant())
                .build());
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public DirectiveOutcome onDirective(Envelope directive, AgentContext context) {
        return DirectiveOutcome.completed(ReportPayload.failed(ErrorCode.UNSUPPORTED_ACTION,
                "Gateway " + id + " does not execute directives", false));
    }

    @Override
    public void onReport(Envelope envelope, AgentContext context) {
        if (!(envelope.payload() instanceof ReportPayload report)) {
            return;
        }
        String key = envelope.correlationKey();
        CompletableFuture<ReportPayload> future = pending.remove(key);
        if (future == null) {
            log.debug("Gateway {} got report for unknown submission {}", id, key);
            return;
        }
        if (report.succeeded()) {
            future.complete(report);
        } else {
            future.completeExceptionally(new DirectiveFailedException(key, report.errorCode(),
                    report.message(), report.retryable()));
        }
    }

    @Override
    public void onStop(AgentContext context) {
        pending.forEach((key, future) -> future.completeExceptionally(
                new DirectiveFailedException(key, ErrorCode.ABANDONED.name(), "Gateway stopped", false)));
        pending.clear();
    }
}
