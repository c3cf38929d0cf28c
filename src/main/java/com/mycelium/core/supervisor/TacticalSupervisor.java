package com.mycelium.core.supervisor;

import com.mycelium.core.bus.AgentHandle;
import com.mycelium.core.bus.DeadLetterReason;
import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.bus.RoutingException;
import com.mycelium.core.bus.RoutingFault;
import com.mycelium.core.bus.SendResult;
import com.mycelium.core.events.TelemetryEvent;
import com.mycelium.core.events.TelemetryFeed;
import com.mycelium.core.model.AgentHealth;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.ControlAction;
import com.mycelium.core.model.DirectivePayload;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.ErrorCode;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.EventTypes;
import com.mycelium.core.model.MessageKind;
import com.mycelium.core.model.Payload;
import com.mycelium.core.model.QueryPayload;
import com.mycelium.core.model.ReportPayload;
import com.mycelium.core.model.SummaryPayload;
import com.mycelium.core.model.Tier;
import com.mycelium.core.runtime.Agent;
import com.mycelium.core.runtime.AgentContext;
import com.mycelium.core.runtime.AgentRuntime;
import com.mycelium.core.runtime.DirectiveOutcome;
import com.mycelium.core.runtime.RuntimeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mid-tier supervisor: owns one pool of execution agents per capability, routes
 * directives to them, retries and circuit-breaks failing children, restarts unhealthy
 * ones and sends aggregated summaries upward.
 * <p>
 * Runs as an ordinary {@link Agent}; all pool and work state is touched only from its
 * own agent thread. Children are spawned during {@link #onInitialize}.
 */
public class TacticalSupervisor implements Agent {

    private static final Logger log = LoggerFactory.getLogger(TacticalSupervisor.class);

    public static final String POOL_STATUS_QUERY = "pool-status";
    static final int ABANDONED_MEMORY = 1024;

    private enum Phase { QUEUED, DISPATCHED, WAITING_RETRY }

    /** A directive this supervisor owes a terminal report for. */
    private static final class Work {
        final Envelope origin;
        final String capability;
        final String preferredTarget;
        Phase phase;
        String childId;
        Instant dispatchedAt;
        int retries;

        Work(Envelope origin, String capability, String preferredTarget) {
            this.origin = origin;
            this.capability = capability;
            this.preferredTarget = preferredTarget;
        }

        String key() {
            return origin.correlationKey();
        }
    }

    private final String id;
    private final String parentId;
    private final MessageBus bus;
    private final RuntimeSettings childSettings;
    private final SupervisorSettings settings;
    private final TelemetryFeed telemetry;
    private final Map<String, PoolSpec> specs = new LinkedHashMap<>();
    private final Map<String, ChildPool> pools = new LinkedHashMap<>();
    private final Map<String, ReportAggregator> aggregators = new LinkedHashMap<>();
    private final Map<String, Work> work = new HashMap<>();
    private final Map<String, String> alternates = new HashMap<>();
    private final Map<String, String> abandoned = new LinkedHashMap<>(16, 0.75f, false) {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
            return size() > ABANDONED_MEMORY;
        }
    };
    private AgentContext context;
    private int childSequence;

    public TacticalSupervisor(String id, String parentId, List<PoolSpec> poolSpecs, MessageBus bus,
                              RuntimeSettings childSettings, SupervisorSettings settings, TelemetryFeed telemetry) {
        if (poolSpecs.isEmpty()) {
            throw new IllegalArgumentException("Supervisor " + id + " needs at least one pool");
        }
        this.id = id;
        this.parentId = parentId;
        this.bus = bus;
        this.childSettings = childSettings;
        this.settings = settings;
        this.telemetry = telemetry;
        Instant now = bus.clock().instant();
        for (PoolSpec spec : poolSpecs) {
            if (specs.putIfAbsent(spec.capability(), spec) != null) {
                throw new IllegalArgumentException("Duplicate pool " + spec.capability() + " in supervisor " + id);
            }
            pools.put(spec.capability(), new ChildPool(spec.capability(), spec.size(), settings.queueDepth()));
            aggregators.put(spec.capability(), new ReportAggregator(id, spec.capability(),
                    settings.summaryEvery(), settings.summaryWindow(), now));
        }
    }

    public AgentIdentity identity() {
        return new AgentIdentity(id, specs.keySet(), Tier.TACTICAL, parentId);
    }

    public String id() {
        return id;
    }

    public Optional<PoolSnapshot> poolSnapshot(String capability) {
        return Optional.ofNullable(pools.get(capability)).map(ChildPool::snapshot);
    }

    public List<PoolSnapshot> poolSnapshots() {
        return pools.values().stream().map(ChildPool::snapshot).toList();
    }

    // --- Lifecycle ---

    @Override
    public void onInitialize(AgentContext context) {
        this.context = context;
        for (PoolSpec spec : specs.values()) {
            for (int i = 0; i < spec.size(); i++) {
                spawnChild(ChildSpec.of(spec.capability()));
            }
        }
        log.info("Supervisor {} initialised pools {}", id, specs.keySet());
    }

    @Override
    public void onStop(AgentContext context) {
        if (!work.isEmpty()) {
            log.warn("Supervisor {} stopping with {} directive(s) unfinished", id, work.size());
        }
        for (ChildPool pool : pools.values()) {
            for (ChildPool.Child child : pool.members()) {
                child.runtime().stop(id);
                bus.unregister(child.id());
            }
        }
    }

    /**
     * Creates, registers and starts one child in the pool for its capability.
     * Must be called from this supervisor's thread.
     *
     * @return the child id
     * @throws IllegalArgumentException if no pool was declared for the capability
     * @throws IllegalStateException    if the pool is already full
     */
    public String spawnChild(ChildSpec spec) {
        ChildPool pool = pools.get(spec.capability());
        if (pool == null) {
            throw new IllegalArgumentException("Supervisor " + id + " has no pool for " + spec.capability());
        }
        if (pool.isFull()) {
            throw new IllegalStateException("Pool " + spec.capability() + " of " + id + " is full");
        }
        String childId = spec.childId() != null
                ? spec.childId()
                : id + "." + spec.capability() + "-" + (++childSequence);
        var breaker = new CircuitBreaker(childId, settings.breaker(), bus.clock(), this::onBreakerTransition);
        var child = new ChildPool.Child(childId, launch(childId, spec.capability()), breaker);
        pool.add(child);
        log.info("Supervisor {} spawned {} ({}/{})", id, childId, pool.size(), specs.get(spec.capability()).size());
        return childId;
    }

    private AgentRuntime launch(String childId, String capability) {
        AgentIdentity identity = AgentIdentity.of(childId, Tier.EXECUTION, id, capability);
        AgentHandle handle = bus.register(identity, childSettings.mailboxCapacity());
        var runtime = new AgentRuntime(specs.get(capability).factory().create(), handle, bus, childSettings);
        runtime.start();
        return runtime;
    }

    // --- Directives ---

    @Override
    public DirectiveOutcome onDirective(Envelope directive, AgentContext context) {
        Payload payload = directive.payload();
        if (!(payload instanceof DirectivePayload request)) {
            return DirectiveOutcome.completed(ReportPayload.failed(ErrorCode.UNSUPPORTED_ACTION,
                    "Supervisor " + id + " only accepts single directives", false));
        }
        if (request.action() instanceof ControlAction control) {
            return DirectiveOutcome.completed(applyControl(control, request));
        }
        try {
            route(directive);
            return DirectiveOutcome.deferred();
        } catch (RoutingException e) {
            log.warn("Supervisor {} could not route {}: {}", id, directive.id(), e.getMessage());
            return DirectiveOutcome.completed(ReportPayload.failed(
                    e.getFault().name(), e.getMessage(), isRetryable(e.getFault())));
        } catch (IllegalArgumentException e) {
            return DirectiveOutcome.completed(ReportPayload.failed(ErrorCode.UNSUPPORTED_ACTION, e.getMessage(), false));
        }
    }

    /**
     * Sends a directive to a child of its capability's pool: the named target if it is
     * free, otherwise the next idle child (round-robin) whose breaker admits a call,
     * otherwise the pool's wait queue. The supervisor then owes the sender exactly one
     * terminal report.
     *
     * @throws RoutingException         POOL_EXHAUSTED when the queue is full, CIRCUIT_OPEN
     *                                  when every child's breaker is open
     * @throws IllegalArgumentException when no pool serves the capability or the
     *                                  correlation is already in flight
     */
    public RouteDecision route(Envelope directive) {
        DirectivePayload request = directive.payloadAs(DirectivePayload.class);
        String capability = resolveCapability(request.action().capability());
        if (!pools.containsKey(capability)) {
            throw new IllegalArgumentException("Supervisor " + id + " has no pool for " + capability);
        }
        if (work.containsKey(directive.correlationKey())) {
            throw new IllegalArgumentException("Correlation " + directive.correlationKey() + " already in flight");
        }
        var item = new Work(directive, capability, request.preferredTarget());
        work.put(item.key(), item);
        try {
            return place(item);
        } catch (RoutingException e) {
            work.remove(item.key());
            throw e;
        }
    }

    private RouteDecision place(Work item) {
        ChildPool pool = pools.get(item.capability);
        ChildPool.Child child = pool.select(preferredFor(item));
        if (child != null) {
            dispatch(item, pool, child);
            return RouteDecision.dispatched(child.id());
        }
        if (!pool.enqueue(item.key())) {
            throw new RoutingException(RoutingFault.POOL_EXHAUSTED, "Pool " + item.capability + " of " + id
                    + " is busy and its queue is full (" + settings.queueDepth() + ")");
        }
        item.phase = Phase.QUEUED;
        log.debug("Queued {} in pool {} ({} waiting)", item.key(), item.capability, pool.queued());
        return RouteDecision.queued();
    }

    private void dispatch(Work item, ChildPool pool, ChildPool.Child child) {
        pool.markBusy(child);
        item.phase = Phase.DISPATCHED;
        item.childId = child.id();
        item.dispatchedAt = context.now();
        Envelope forward = item.origin.derive()
                .from(id)
                .to(child.id())
                .createdAt(item.origin.createdAt())
                .build();
        SendResult result = context.send(forward);
        if (!result.allDelivered()) {
            // the copy is already dead-lettered; release the child and count it against it
            pool.markIdle(child);
            child.breaker().recordFailure();
            item.phase = Phase.WAITING_RETRY;
            item.childId = null;
            onFailure(item, pool, ReportPayload.failed(ErrorCode.CHILD_LOST,
                    "Child " + child.id() + " unreachable: " + result.faults(), true));
        } else {
            log.debug("Dispatched {} to {} (attempt {})", item.key(), child.id(), item.retries + 1);
        }
    }

    /** The named target applies to the first attempt; retries go to any admitted child. */
    private static String preferredFor(Work item) {
        return item.retries == 0 ? item.preferredTarget : null;
    }

    /**
     * Places waiting directives in queue order. A directive whose preferred child is
     * busy stays queued without holding back the ones behind it.
     */
    private void drain(ChildPool pool) {
        for (String key : pool.waitingKeys()) {
            Work item = work.get(key);
            if (item == null || item.phase != Phase.QUEUED) {
                pool.removeWaiting(key);
                continue;
            }
            if (item.origin.isExpired(context.now())) {
                pool.removeWaiting(key);
                finish(item, ReportPayload.failed(ErrorCode.EXPIRED, "Expired while queued", false));
                continue;
            }
            ChildPool.Child child;
            try {
                child = pool.select(preferredFor(item));
            } catch (RoutingException e) {
                pool.removeWaiting(key);
                finish(item, ReportPayload.failed(e.getFault().name(), e.getMessage(), isRetryable(e.getFault())));
                continue;
            }
            if (child == null) {
                if (!pool.hasIdleCapacity()) {
                    return;
                }
                continue;
            }
            pool.removeWaiting(key);
            dispatch(item, pool, child);
        }
    }

    // --- Reports from children ---

    @Override
    public void onReport(Envelope envelope, AgentContext context) {
        if (!(envelope.payload() instanceof ReportPayload report)) {
            log.debug("Supervisor {} ignoring {} from {}", id, envelope.payload().getClass().getSimpleName(),
                    envelope.senderId());
            return;
        }
        onChildReport(envelope, report);
    }

    private void onChildReport(Envelope envelope, ReportPayload report) {
        String key = envelope.correlationKey();
        String sender = envelope.senderId();
        Work item = work.get(key);

        if (item == null || item.phase != Phase.DISPATCHED || !sender.equals(item.childId)) {
            if (sender.equals(abandoned.get(key))) {
                abandoned.remove(key);
                bus.deadLetters().record(envelope, id, DeadLetterReason.ABANDONED);
                childOf(sender).ifPresent(c -> release(c.pool, c.child, report.succeeded()));
            } else {
                log.debug("Supervisor {} ignoring stale report {} from {}", id, key, sender);
            }
            return;
        }

        ChildPool pool = pools.get(item.capability);
        ChildPool.Child child = pool.member(sender).orElse(null);
        double latencyMs = Duration.between(item.dispatchedAt, context.now()).toNanos() / 1_000_000.0;
        boolean due = aggregators.get(item.capability).record(report.succeeded(), latencyMs);

        if (child != null) {
            pool.markIdle(child);
            if (report.succeeded()) {
                child.breaker().recordSuccess();
            } else if (ErrorCode.EXPIRED.name().equals(report.errorCode())) {
                // expiry is not a child failure
                child.breaker().releaseTrial();
            } else {
                child.breaker().recordFailure();
            }
        }

        if (report.succeeded()) {
            finish(item, report.withMetric(ReportPayload.LATENCY_MS, latencyMs));
        } else {
            item.phase = Phase.WAITING_RETRY;
            item.childId = null;
            onFailure(item, pool, report);
        }
        if (due) {
            emitSummary(item.capability);
        }
        drain(pool);
    }

    private void onFailure(Work item, ChildPool pool, ReportPayload failure) {
        boolean supervisorRetries = settings.ownershipFor(item.capability) == RetryOwnership.SUPERVISOR;
        if (!failure.retryable() || !supervisorRetries) {
            finish(item, failure);
            return;
        }
        if (!settings.retry().canRetry(item.retries)) {
            finish(item, ReportPayload.failed(ErrorCode.RETRIES_EXHAUSTED,
                    "Gave up after " + (item.retries + 1) + " attempt(s): " + failure.message(), false));
            return;
        }
        if (!pool.anyAdmits()) {
            finish(item, ReportPayload.failed(ErrorCode.CIRCUIT_OPEN,
                    "All " + item.capability + " circuits open after: " + failure.message(), true));
            return;
        }
        scheduleRetry(item, failure);
    }

    private void scheduleRetry(Work item, ReportPayload failure) {
        item.retries++;
        item.phase = Phase.WAITING_RETRY;
        item.childId = null;
        Duration delay = settings.retry().delayFor(item.retries);
        log.info("Retrying {} in {} (retry {}/{}): {}", item.key(), delay, item.retries,
                settings.retry().maxRetries(), failure.message());
        telemetry.publish(TelemetryEvent.of(TelemetryEvent.RETRY_SCHEDULED, id, Map.of(
                "correlationId", item.key(),
                "capability", item.capability,
                "retry", item.retries,
                "delayMs", delay.toMillis()), context.now()));
        Envelope due = context.envelope()
                .to(id)
                .event(EventPayload.of(EventTypes.RETRY_DUE, Map.of("correlationId", item.key())))
                .priority(item.origin.priority())
                .build();
        context.sendLater(due, delay);
    }

    private void onRetryDue(String key) {
        Work item = work.get(key);
        if (item == null || item.phase != Phase.WAITING_RETRY) {
            return;
        }
        if (item.origin.isExpired(context.now())) {
            finish(item, ReportPayload.failed(ErrorCode.EXPIRED, "Expired before retry " + item.retries, false));
            return;
        }
        try {
            place(item);
        } catch (RoutingException e) {
            finish(item, ReportPayload.failed(e.getFault().name(), e.getMessage(), isRetryable(e.getFault())));
        }
    }

    private void finish(Work item, ReportPayload report) {
        work.remove(item.key());
        context.report(item.origin, report);
        Map<String, Object> data = new HashMap<>();
        data.put("capability", item.capability);
        data.put("status", report.status().name());
        data.put("attempts", item.retries + 1);
        if (report.metric(ReportPayload.LATENCY_MS) != null) {
            data.put("latencyMs", report.metric(ReportPayload.LATENCY_MS));
        }
        if (report.errorCode() != null) {
            data.put("errorCode", report.errorCode());
        }
        telemetry.publish(TelemetryEvent.of(TelemetryEvent.DIRECTIVE_COMPLETED, id, data, context.now()));
    }

    // --- Events ---

    @Override
    public void onEvent(Envelope envelope, AgentContext context) {
        EventPayload event = envelope.payloadAs(EventPayload.class);
        switch (event.eventType()) {
            case EventTypes.RETRY_DUE -> onRetryDue(event.value("correlationId"));
            case EventTypes.ABANDON -> abandon(event.value("correlationId"));
            case EventTypes.AGENT_UNHEALTHY -> onChildUnhealthy(event);
            case EventTypes.AGENT_FATAL, EventTypes.AGENT_INIT_FAILED -> {
                String childId = event.value("agentId") != null ? event.value("agentId") : envelope.senderId();
                childOf(childId).ifPresent(c -> restart(c.pool, c.child, event.eventType()));
            }
            case EventTypes.SUPERVISOR_SILENT -> log.warn("Coordinator reports supervisor {} silent",
                    event.value("supervisorId"));
            default -> log.debug("Supervisor {} ignoring event {}", id, event.eventType());
        }
    }

    private void onChildUnhealthy(EventPayload event) {
        String childId = event.value("agentId");
        var located = childOf(childId).orElse(null);
        if (located == null) {
            log.debug("Unhealthy agent {} is not a child of {}", childId, id);
            return;
        }
        String reported = event.value("lastHeartbeat");
        Optional<AgentHealth> current = context.registry().health(childId);
        if (reported != null && current.isPresent()
                && current.get().lastHeartbeat().isAfter(Instant.parse(reported))) {
            log.debug("Child {} heartbeat recovered since alert, ignoring", childId);
            return;
        }
        restart(located.pool, located.child, "stale heartbeat");
    }

    /**
     * Restarts a child in place under the same id, or retires it once it has used up
     * its restart tolerance. Work it was running is treated as a retryable failure.
     */
    private void restart(ChildPool pool, ChildPool.Child child, String reason) {
        int restarts = child.incrementRestarts();
        log.warn("Supervisor {} restarting {} ({}), restart {}/{}", id, child.id(), reason, restarts,
                settings.maxRestarts());
        child.runtime().stop(id);
        bus.unregister(child.id());

        Work lost = work.values().stream()
                .filter(w -> w.phase == Phase.DISPATCHED && child.id().equals(w.childId))
                .findFirst()
                .orElse(null);
        if (child.isBusy() && lost == null) {
            abandoned.values().remove(child.id());
        }
        pool.markIdle(child);

        boolean restarted = false;
        if (restarts <= settings.maxRestarts()) {
            try {
                child.replaceRuntime(launch(child.id(), pool.capability()));
                restarted = true;
                telemetry.publish(TelemetryEvent.of(TelemetryEvent.CHILD_RESTARTED, child.id(), Map.of(
                        "supervisorId", id, "reason", reason, "restarts", restarts), context.now()));
            } catch (RuntimeException e) {
                log.error("Supervisor {} failed to restart {}: {}", id, child.id(), e.getMessage(), e);
            }
        }
        if (!restarted) {
            retire(pool, child);
        }

        if (lost != null) {
            if (restarted) {
                child.breaker().recordFailure();
            }
            lost.phase = Phase.WAITING_RETRY;
            lost.childId = null;
            onFailure(lost, pool, ReportPayload.failed(ErrorCode.CHILD_LOST,
                    "Child " + child.id() + " lost: " + reason, true));
        }
        drain(pool);
    }

    private void retire(ChildPool pool, ChildPool.Child child) {
        pool.remove(child);
        log.warn("Supervisor {} retired {}; pool {} down to {}", id, child.id(), pool.capability(), pool.size());
        context.emitToParent(EventPayload.of(EventTypes.CAPACITY_REDUCED, Map.of(
                "supervisorId", id,
                "capability", pool.capability(),
                "childId", child.id(),
                "remaining", pool.size())));
    }

    /**
     * Stops working on a correlation: the originator gets one failed ABANDONED report
     * and reports that arrive for it later are dead-lettered.
     *
     * @return false if nothing was in flight for it
     */
    public boolean abandon(String correlationId) {
        Work item = work.get(correlationId);
        if (item == null) {
            log.debug("Nothing in flight for {} to abandon", correlationId);
            return false;
        }
        if (item.phase == Phase.QUEUED) {
            pools.get(item.capability).removeWaiting(correlationId);
        }
        if (item.phase == Phase.DISPATCHED) {
            abandoned.put(correlationId, item.childId);
        }
        log.info("Supervisor {} abandoning {} ({})", id, correlationId, item.phase);
        finish(item, ReportPayload.failed(ErrorCode.ABANDONED, "Abandoned by request", false));
        return true;
    }

    // --- Control ---

    private ReportPayload applyControl(ControlAction action, DirectivePayload request) {
        String capability = request.param("capability");
        List<ChildPool> targets = new ArrayList<>();
        if (capability == null) {
            targets.addAll(pools.values());
        } else if (pools.containsKey(capability)) {
            targets.add(pools.get(capability));
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("action", action.name());
        switch (action) {
            case REDUCE_CONCURRENCY -> targets.forEach(p -> data.put(p.capability(), p.reduceConcurrency()));
            case RESTORE_CONCURRENCY -> targets.forEach(p -> {
                data.put(p.capability(), p.restoreConcurrency());
                alternates.remove(p.capability());
            });
            case PREFER_ALTERNATE -> {
                String alternate = request.param("alternate");
                boolean applied = capability != null && alternate != null && pools.containsKey(alternate);
                if (applied) {
                    alternates.put(capability, alternate);
                } else {
                    log.warn("Supervisor {} cannot prefer {} over {}: no such pool", id, alternate, capability);
                }
                data.put("applied", applied);
            }
        }
        log.info("Supervisor {} applied {} to {}", id, action, capability != null ? capability : "all pools");
        targets.forEach(this::drain);
        return ReportPayload.success(data);
    }

    private String resolveCapability(String capability) {
        String alternate = alternates.get(capability);
        return alternate != null && pools.containsKey(alternate) ? alternate : capability;
    }

    // --- Queries, ticks, summaries ---

    @Override
    public Payload onQuery(Envelope query, AgentContext context) {
        QueryPayload question = query.payloadAs(QueryPayload.class);
        if (!POOL_STATUS_QUERY.equals(question.question())) {
            return ReportPayload.failed(ErrorCode.UNSUPPORTED_ACTION, "Unknown query " + question.question(), false);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (PoolSnapshot snapshot : poolSnapshots()) {
            data.put(snapshot.capability(), Map.of(
                    "size", snapshot.size(),
                    "busy", snapshot.busy(),
                    "queued", snapshot.queued(),
                    "limit", snapshot.concurrencyLimit()));
        }
        return ReportPayload.success(data);
    }

    @Override
    public void onTick(AgentContext context) {
        Instant now = context.now();
        for (var entry : aggregators.entrySet()) {
            if (entry.getValue().windowElapsed(now)) {
                emitSummary(entry.getKey());
            }
        }
        pools.values().forEach(this::drain);
    }

    private void emitSummary(String capability) {
        ChildPool pool = pools.get(capability);
        SummaryPayload summary = aggregators.get(capability)
                .close(context.now(), pool.queued(), pool.busyCount(), pool.size());
        telemetry.publish(TelemetryEvent.of(TelemetryEvent.SUMMARY_EMITTED, id, Map.of(
                "capability", capability,
                "count", summary.count(),
                "successRate", summary.successRate()), context.now()));
        if (parentId == null) {
            return;
        }
        context.send(context.envelope()
                .to(parentId)
                .kind(MessageKind.REPORT)
                .payload(summary)
                .build());
    }

    // --- Helpers ---

    private record Located(ChildPool pool, ChildPool.Child child) {}

    private Optional<Located> childOf(String childId) {
        if (childId == null) {
            return Optional.empty();
        }
        for (ChildPool pool : pools.values()) {
            Optional<ChildPool.Child> child = pool.member(childId);
            if (child.isPresent()) {
                return Optional.of(new Located(pool, child.get()));
            }
        }
        return Optional.empty();
    }

    private void release(ChildPool pool, ChildPool.Child child, boolean success) {
        pool.markIdle(child);
        if (success) {
            child.breaker().recordSuccess();
        } else {
            child.breaker().recordFailure();
        }
        drain(pool);
    }

    private void onBreakerTransition(String childId, CircuitState from, CircuitState to) {
        telemetry.publish(TelemetryEvent.of(TelemetryEvent.BREAKER_TRANSITION, childId, Map.of(
                "supervisorId", id, "from", from.name(), "to", to.name()), bus.clock().instant()));
    }

    private static boolean isRetryable(RoutingFault fault) {
        return fault == RoutingFault.POOL_EXHAUSTED || fault == RoutingFault.CIRCUIT_OPEN;
    }
}
