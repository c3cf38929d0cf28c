package com.mycelium.core.strategic;

import com.mycelium.core.bus.SendResult;
import com.mycelium.core.events.TelemetryEvent;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.ControlAction;
import com.mycelium.core.model.DirectivePayload;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.ErrorCode;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.EventTypes;
import com.mycelium.core.model.Payload;
import com.mycelium.core.model.QueryPayload;
import com.mycelium.core.model.ReportPayload;
import com.mycelium.core.model.SummaryPayload;
import com.mycelium.core.model.Tier;
import com.mycelium.core.runtime.Agent;
import com.mycelium.core.runtime.AgentContext;
import com.mycelium.core.runtime.DirectiveOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root of the hierarchy. Breaks incoming goals into capability-scoped steps, routes
 * each step to a tactical supervisor, answers the originator once every step has
 * reported, and reacts to supervisor summaries with control directives.
 * <p>
 * A supervisor that sends nothing for longer than the silence threshold is announced
 * to the whole tactical tier once per silence episode. Nothing restarts it.
 */
public class StrategicCoordinator implements Agent {

    private static final Logger log = LoggerFactory.getLogger(StrategicCoordinator.class);

    public static final String CAPABILITY = "coordination";
    public static final String SUPERVISORS_QUERY = "supervisors";
    static final int CONTROL_PRIORITY = 9;

    /** A goal the coordinator owes one terminal report for. */
    private static final class Goal {
        final Envelope origin;
        final List<DirectivePayload> steps;
        final ReportPayload[] results;
        int remaining;

        Goal(Envelope origin, List<DirectivePayload> steps) {
            this.origin = origin;
            this.steps = steps;
            this.results = new ReportPayload[steps.size()];
            this.remaining = steps.size();
        }
    }

    private record StepRef(String goalKey, int index, String supervisorId) {}

    private final String id;
    private final GoalDecomposer decomposer;
    private final CoordinatorSettings settings;
    private final TelemetryFeed telemetry;
    private final Map<String, Goal> goals = new HashMap<>();
    private final Map<String, StepRef> steps = new HashMap<>();
    private final Set<String> controlPending = new HashSet<>();
    private final Map<String, Instant> lastSeen = new HashMap<>();
    private final Set<String> silent = new HashSet<>();
    private final Set<String> breached = new HashSet<>();
    private final Set<String> failedOver = new HashSet<>();

    public StrategicCoordinator(String id, GoalDecomposer decomposer, CoordinatorSettings settings,
                                TelemetryFeed telemetry) {
        this.id = id;
        this.decomposer = decomposer;
        this.settings = settings;
        this.telemetry = telemetry;
    }

    public AgentIdentity identity() {
        return AgentIdentity.of(id, Tier.STRATEGIC, null, CAPABILITY);
    }

    public String id() {
        return id;
    }

    @Override
    public void onInitialize(AgentContext context) {
        Instant now = context.now();
        for (String supervisorId : context.registry().findByTier(Tier.TACTICAL)) {
            lastSeen.put(supervisorId, now);
        }
        log.info("Coordinator {} watching {} supervisor(s)", id, lastSeen.size());
    }

    // --- Goals ---

    @Override
    public DirectiveOutcome onDirective(Envelope directive, AgentContext context) {
        List<DirectivePayload> plan = decomposer.decompose(directive.payload());
        if (plan.isEmpty()) {
            return DirectiveOutcome.completed(ReportPayload.failed(ErrorCode.HANDLER_ERROR,
                    "Goal has no steps", false));
        }
        String goalKey = directive.correlationKey();
        if (goals.containsKey(goalKey)) {
            return DirectiveOutcome.completed(ReportPayload.failed(ErrorCode.HANDLER_ERROR,
                    "Goal " + goalKey + " already in progress", false));
        }

        List<String> targets = new ArrayList<>(plan.size());
        for (DirectivePayload step : plan) {
            String supervisorId = supervisorFor(step.action().capability(), context);
            if (supervisorId == null) {
                log.warn("No supervisor can handle {} for goal {}", step.action().qualifiedName(), goalKey);
                return DirectiveOutcome.completed(ReportPayload.failed(ErrorCode.NO_CAPABLE_SUPERVISOR,
                        "No tactical supervisor advertises " + step.action().capability(), false));
            }
            targets.add(supervisorId);
        }

        var goal = new Goal(directive, plan);
        goals.put(goalKey, goal);
        log.info("Goal {} decomposed into {} step(s)", goalKey, plan.size());
        for (int i = 0; i < plan.size(); i++) {
            dispatchStep(goal, i, targets.get(i), context);
        }
        return DirectiveOutcome.deferred();
    }

    private void dispatchStep(Goal goal, int index, String supervisorId, AgentContext context) {
        String goalKey = goal.origin.correlationKey();
        String stepKey = goalKey + "/" + index;
        steps.put(stepKey, new StepRef(goalKey, index, supervisorId));
        Envelope step = context.envelope()
                .to(supervisorId)
                .directive(goal.steps.get(index))
                .priority(goal.origin.priority())
                .correlationId(stepKey)
                .createdAt(goal.origin.createdAt())
                .ttl(goal.origin.ttl())
                .build();
        SendResult result = context.send(step);
        if (!result.allDelivered()) {
            onStepReport(stepKey, ReportPayload.failed(ErrorCode.UNKNOWN_RECIPIENT,
                    "Supervisor " + supervisorId + " unreachable: " + result.faults(), true), context);
        }
    }

    /**
     * Picks a live tactical supervisor for the capability, honouring a failover to the
     * configured alternate. Silent supervisors are used only when nothing else fits.
     */
    private String supervisorFor(String capability, AgentContext context) {
        String alternate = settings.alternates().get(capability);
        if (alternate != null && failedOver.contains(capability)) {
            String target = pick(alternate, context);
            if (target != null) {
                return target;
            }
        }
        String target = pick(capability, context);
        if (target == null && alternate != null) {
            target = pick(alternate, context);
        }
        return target;
    }

    private String pick(String capability, AgentContext context) {
        List<String> candidates = context.findByCapability(capability).stream()
                .filter(candidate -> context.registry().identity(candidate)
                        .map(identity -> identity.tier() == Tier.TACTICAL)
                        .orElse(false))
                .toList();
        return candidates.stream()
                .filter(candidate -> !silent.contains(candidate))
                .findFirst()
                .orElse(candidates.isEmpty() ? null : candidates.get(0));
    }

    // --- Reports ---

    @Override
    public void onReport(Envelope envelope, AgentContext context) {
        lastSeen.put(envelope.senderId(), context.now());
        if (silent.remove(envelope.senderId())) {
            log.info("Supervisor {} is reporting again", envelope.senderId());
        }
        if (envelope.payload() instanceof SummaryPayload summary) {
            onAggregatedReport(summary, context);
            return;
        }
        ReportPayload report = envelope.payloadAs(ReportPayload.class);
        String key = envelope.correlationKey();
        if (controlPending.remove(key)) {
            log.debug("Supervisor {} acknowledged control {}: {}", envelope.senderId(), key, report.status());
            return;
        }
        onStepReport(key, report, context);
    }

    private void onStepReport(String stepKey, ReportPayload report, AgentContext context) {
        StepRef ref = steps.remove(stepKey);
        if (ref == null) {
            log.debug("Coordinator {} ignoring report for unknown step {}", id, stepKey);
            return;
        }
        Goal goal = goals.get(ref.goalKey());
        if (goal == null || goal.results[ref.index()] != null) {
            return;
        }
        goal.results[ref.index()] = report;
        goal.remaining--;
        if (goal.remaining == 0) {
            goals.remove(ref.goalKey());
            context.report(goal.origin, combine(goal));
        }
    }

    private ReportPayload combine(Goal goal) {
        if (goal.results.length == 1 && goal.origin.payload() instanceof DirectivePayload) {
            return goal.results[0];
        }
        List<Map<String, Object>> stepData = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        ReportPayload firstFailure = null;
        boolean retryable = false;
        for (int i = 0; i < goal.results.length; i++) {
            ReportPayload result = goal.results[i];
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("step", i);
            entry.put("action", goal.steps.get(i).action().qualifiedName());
            entry.put("status", result.status().name());
            entry.put("data", result.data());
            stepData.add(entry);
            if (!result.succeeded()) {
                failures.add(i + ":" + result.errorCode());
                retryable |= result.retryable();
                if (firstFailure == null) {
                    firstFailure = result;
                }
            }
        }
        if (firstFailure == null) {
            return ReportPayload.success(Map.of("steps", stepData));
        }
        return new ReportPayload(firstFailure.status(), Map.of("steps", stepData), firstFailure.errorCode(),
                failures.size() + " of " + goal.results.length + " step(s) failed " + failures,
                retryable, Map.of());
    }

    /**
     * Compares a summary against the thresholds. A breach sends one control directive
     * to the reporting supervisor; the first healthy summary afterwards restores it.
     */
    void onAggregatedReport(SummaryPayload summary, AgentContext context) {
        String scope = summary.supervisorId() + "/" + summary.capability();
        boolean failing = summary.count() > 0 && summary.successRate() < settings.minSuccessRate();
        boolean overloaded = (summary.count() > 0 && summary.avgLatencyMs() > settings.maxAvgLatencyMs())
                || summary.queueDepth() > settings.maxQueueDepth();

        if (failing || overloaded) {
            if (!breached.add(scope)) {
                return;
            }
            String alternate = settings.alternates().get(summary.capability());
            if (failing && alternate != null) {
                failedOver.add(summary.capability());
                sendControl(summary.supervisorId(), ControlAction.PREFER_ALTERNATE,
                        Map.of("capability", summary.capability(), "alternate", alternate), context);
            } else {
                sendControl(summary.supervisorId(), ControlAction.REDUCE_CONCURRENCY,
                        Map.of("capability", summary.capability()), context);
            }
        } else if (breached.remove(scope)) {
            failedOver.remove(summary.capability());
            sendControl(summary.supervisorId(), ControlAction.RESTORE_CONCURRENCY,
                    Map.of("capability", summary.capability()), context);
        }
    }

    private void sendControl(String supervisorId, ControlAction action, Map<String, Object> params,
                             AgentContext context) {
        Envelope control = context.envelope()
                .to(supervisorId)
                .directive(DirectivePayload.of(action, params))
                .priority(CONTROL_PRIORITY)
                .build();
        controlPending.add(control.correlationKey());
        log.info("Coordinator {} sending {} {} to {}", id, action, params, supervisorId);
        telemetry.publish(TelemetryEvent.of(TelemetryEvent.CONTROL_ISSUED, supervisorId, Map.of(
                "action", action.name(), "capability", String.valueOf(params.get("capability"))), context.now()));
        SendResult result = context.send(control);
        if (!result.allDelivered()) {
            controlPending.remove(control.correlationKey());
        }
    }

    // --- Events, ticks, queries ---

    @Override
    public void onEvent(Envelope envelope, AgentContext context) {
        EventPayload event = envelope.payloadAs(EventPayload.class);
        switch (event.eventType()) {
            case EventTypes.CAPACITY_REDUCED -> log.warn("Supervisor {} lost capacity in {}: {} left",
                    event.value("supervisorId"), event.value("capability"), event.value("remaining"));
            case EventTypes.AGENT_FATAL, EventTypes.AGENT_INIT_FAILED, EventTypes.AGENT_UNHEALTHY ->
                    log.error("Supervisor {} reported {}: {}", event.value("agentId"), event.eventType(),
                            event.value("message"));
            case EventTypes.ABANDON -> abandonGoal(event.value("correlationId"), context);
            default -> log.debug("Coordinator {} ignoring event {}", id, event.eventType());
        }
    }

    /**
     * Forwards an abandon request to every supervisor still working on a step of the
     * goal. The goal completes once their ABANDONED reports arrive.
     */
    private void abandonGoal(String goalKey, AgentContext context) {
        if (!goals.containsKey(goalKey)) {
            log.debug("No goal {} to abandon", goalKey);
            return;
        }
        steps.forEach((stepKey, ref) -> {
            if (ref.goalKey().equals(goalKey)) {
                context.emit(ref.supervisorId(), EventPayload.of(EventTypes.ABANDON,
                        Map.of("correlationId", stepKey)));
            }
        });
    }

    @Override
    public void onTick(AgentContext context) {
        sweep(context);
    }

    /**
     * Health sweep over the tactical tier.
     *
     * @return supervisors newly found silent
     */
    List<String> sweep(AgentContext context) {
        Instant now = context.now();
        List<String> supervisors = context.registry().findByTier(Tier.TACTICAL);
        lastSeen.keySet().retainAll(supervisors);
        silent.retainAll(supervisors);

        List<String> newlySilent = new ArrayList<>();
        for (String supervisorId : supervisors) {
            Instant seen = lastSeen.computeIfAbsent(supervisorId, k -> now);
            if (Duration.between(seen, now).compareTo(settings.silenceThreshold()) > 0
                    && silent.add(supervisorId)) {
                newlySilent.add(supervisorId);
                log.error("Supervisor {} silent since {}", supervisorId, seen);
                context.broadcast(Tier.TACTICAL, context.envelope()
                        .to(supervisorId)
                        .event(EventPayload.of(EventTypes.SUPERVISOR_SILENT, Map.of(
                                "supervisorId", supervisorId,
                                "lastSeen", seen.toString())))
                        .priority(CONTROL_PRIORITY)
                        .build());
            }
        }
        return newlySilent;
    }

    @Override
    public Payload onQuery(Envelope query, AgentContext context) {
        QueryPayload question = query.payloadAs(QueryPayload.class);
        if (!SUPERVISORS_QUERY.equals(question.question())) {
            return ReportPayload.failed(ErrorCode.UNSUPPORTED_ACTION, "Unknown query " + question.question(), false);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        lastSeen.forEach((supervisorId, seen) -> data.put(supervisorId, Map.of(
                "lastSeen", seen.toString(),
                "silent", silent.contains(supervisorId))));
        return ReportPayload.success(data);
    }

    public int goalsInProgress() {
        return goals.size();
    }
}
