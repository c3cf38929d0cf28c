package com.mycelium.core.runtime;

import com.mycelium.core.bus.AgentHandle;
import com.mycelium.core.bus.DeadLetterReason;
import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.logging.MdcContext;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.AgentState;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.ErrorCode;
import com.mycelium.core.model.EventPayload;
import com.mycelium.core.model.EventTypes;
import com.mycelium.core.model.MessageKind;
import com.mycelium.core.model.Payload;
import com.mycelium.core.model.ReportPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Drives one {@link Agent} on a dedicated thread: initialisation, the mailbox loop,
 * heartbeats and the lifecycle state machine
 * {@code CREATED -> INITIALIZING -> RUNNING <-> DEGRADED -> STOPPED}.
 * <p>
 * Envelopes are handled strictly one at a time in mailbox order. A failed handler call
 * moves the agent to DEGRADED and the next successful one moves it back to RUNNING.
 */
public class AgentRuntime {

    private static final Logger log = LoggerFactory.getLogger(AgentRuntime.class);

    /** Requester id allowed to stop agents that have no parent. */
    public static final String OWNER = "process-owner";

    private final Agent agent;
    private final AgentHandle handle;
    private final AgentIdentity identity;
    private final RuntimeSettings settings;
    private final AgentContext context;
    private final CompletableFuture<AgentState> started = new CompletableFuture<>();
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();

    private volatile AgentState state = AgentState.CREATED;
    private volatile boolean stopRequested;
    private Thread thread;
    private long lastTickNanos;

    public AgentRuntime(Agent agent, AgentHandle handle, MessageBus bus, RuntimeSettings settings) {
        this.agent = agent;
        this.handle = handle;
        this.identity = handle.identity();
        this.settings = settings;
        this.context = new AgentContext(identity, bus, () -> stopRequested);
    }

    /**
     * Starts the agent thread.
     *
     * @return completes with RUNNING once initialisation succeeded, or exceptionally
     *         if it failed
     */
    public synchronized CompletableFuture<AgentState> start() {
        if (thread != null) {
            throw new IllegalStateException("Agent " + identity.id() + " already started");
        }
        thread = new Thread(this::run, "agent-" + identity.id());
        thread.setDaemon(true);
        thread.start();
        return started;
    }

    /**
     * Forces the agent to STOPPED. Only the agent's parent may do this, or
     * {@link #OWNER} for agents without a parent. Does not wait for a handler that is
     * currently running; use {@link #terminated()} for that.
     *
     * @throws IllegalStateException if the requester does not own this agent
     */
    public void stop(String requesterId) {
        boolean allowed = identity.parentId() == null
                ? OWNER.equals(requesterId)
                : identity.parentId().equals(requesterId);
        if (!allowed) {
            throw new IllegalStateException("Agent " + identity.id() + " can only be stopped by "
                    + (identity.parentId() != null ? identity.parentId() : OWNER) + ", not " + requesterId);
        }
        requestStop("stopped by " + requesterId);
    }

    public AgentState state() {
        return state;
    }

    public AgentIdentity identity() {
        return identity;
    }

    public String id() {
        return identity.id();
    }

    public AgentContext context() {
        return context;
    }

    public CompletableFuture<Void> terminated() {
        return terminated;
    }

    public boolean isAlive() {
        return state.isLive() || state == AgentState.INITIALIZING;
    }

    private void requestStop(String reason) {
        if (stopRequested) {
            return;
        }
        stopRequested = true;
        log.info("Stopping agent {}: {}", identity.id(), reason);
        int drained = handle.close();
        if (drained > 0) {
            log.info("Agent {} dead-lettered {} pending envelope(s) on stop", identity.id(), drained);
        }
        Thread current;
        synchronized (this) {
            current = thread;
        }
        if (current != null && current != Thread.currentThread()) {
            current.interrupt();
        }
    }

    private void run() {
        MdcContext.setAgent(identity);
        try {
            if (!initialize()) {
                return;
            }
            lastTickNanos = System.nanoTime();
            loop();
        } finally {
            finish();
            MdcContext.clear();
        }
    }

    private boolean initialize() {
        transition(AgentState.INITIALIZING);
        try {
            agent.onInitialize(context);
        } catch (Exception e) {
            log.error("Agent {} failed to initialise: {}", identity.id(), e.getMessage(), e);
            context.emitToParent(EventPayload.of(EventTypes.AGENT_INIT_FAILED, Map.of(
                    "agentId", identity.id(),
                    "message", String.valueOf(e.getMessage()))));
            requestStop("initialisation failed");
            started.completeExceptionally(e);
            return false;
        }
        if (stopRequested) {
            started.completeExceptionally(new IllegalStateException("Agent " + identity.id() + " stopped during initialisation"));
            return false;
        }
        transition(AgentState.RUNNING);
        log.info("Agent {} running", identity.id());
        started.complete(AgentState.RUNNING);
        return true;
    }

    private void loop() {
        Duration interval = settings.heartbeatInterval();
        while (!stopRequested) {
            Envelope envelope;
            try {
                envelope = handle.poll(interval);
            } catch (InterruptedException e) {
                if (stopRequested) {
                    break;
                }
                log.debug("Agent {} interrupted while idle, continuing", identity.id());
                continue;
            }
            if (envelope == null) {
                if (handle.isClosed()) {
                    // unregistered from outside
                    stopRequested = true;
                    break;
                }
                handle.heartbeat(state);
                tick();
                continue;
            }
            dispatch(envelope);
            handle.heartbeat(state);
            if (System.nanoTime() - lastTickNanos >= interval.toNanos()) {
                tick();
            }
        }
    }

    private void dispatch(Envelope envelope) {
        if (envelope.isExpired(context.now())) {
            handle.reject(envelope, DeadLetterReason.EXPIRED);
            if (envelope.kind() == MessageKind.DIRECTIVE && envelope.requiresResponse()) {
                // the sender is waiting on a report
                context.report(envelope, ReportPayload.failed(ErrorCode.EXPIRED,
                        "Expired in the mailbox of " + identity.id(), false));
            }
            return;
        }
        MdcContext.setEnvelope(envelope);
        try {
            log.debug("Handling {} {} from {}", envelope.kind(), envelope.id(), envelope.senderId());
            switch (envelope.kind()) {
                case DIRECTIVE -> handleDirective(envelope);
                case QUERY -> handleQuery(envelope);
                case REPORT -> invoke(envelope, () -> agent.onReport(envelope, context));
                case COORDINATE -> invoke(envelope, () -> agent.onCoordinate(envelope, context));
                case EVENT -> invoke(envelope, () -> agent.onEvent(envelope, context));
            }
        } finally {
            MdcContext.clearEnvelope();
        }
    }

    private void handleDirective(Envelope envelope) {
        DirectiveOutcome outcome;
        try {
            outcome = agent.onDirective(envelope, context);
        } catch (FatalAgentException e) {
            context.report(envelope, ReportPayload.failed(ErrorCode.FATAL, e.getMessage(), true));
            fatal(e);
            return;
        } catch (UnsupportedActionException e) {
            log.warn("Agent {} rejected directive {}: {}", identity.id(), envelope.id(), e.getMessage());
            context.report(envelope, ReportPayload.failed(ErrorCode.UNSUPPORTED_ACTION, e.getMessage(), false));
            return;
        } catch (Exception e) {
            boolean retryable = isRetryable(e);
            restoreInterrupt(e);
            log.warn("Agent {} failed directive {}: {}", identity.id(), envelope.id(), e.getMessage(), e);
            context.report(envelope, ReportPayload.failed(
                    retryable ? ErrorCode.TRANSIENT_FAILURE : ErrorCode.HANDLER_ERROR,
                    String.valueOf(e.getMessage()), retryable));
            failed();
            return;
        }
        if (outcome == null || outcome.isDeferred()) {
            succeeded();
            return;
        }
        context.report(envelope, outcome.report());
        if (outcome.report().succeeded()) {
            succeeded();
        } else {
            handle.reportOutcome(false);
        }
    }

    private void handleQuery(Envelope envelope) {
        Payload reply;
        try {
            reply = agent.onQuery(envelope, context);
        } catch (FatalAgentException e) {
            fatal(e);
            return;
        } catch (Exception e) {
            restoreInterrupt(e);
            log.warn("Agent {} failed query {}: {}", identity.id(), envelope.id(), e.getMessage(), e);
            context.reply(envelope, ReportPayload.failed(ErrorCode.HANDLER_ERROR,
                    String.valueOf(e.getMessage()), isRetryable(e)));
            failed();
            return;
        }
        if (reply != null) {
            context.reply(envelope, reply);
        }
        succeeded();
    }

    @FunctionalInterface
    private interface Handler {
        void handle() throws Exception;
    }

    private void invoke(Envelope envelope, Handler handler) {
        try {
            handler.handle();
            succeeded();
        } catch (FatalAgentException e) {
            fatal(e);
        } catch (Exception e) {
            restoreInterrupt(e);
            log.warn("Agent {} failed handling {} {}: {}", identity.id(), envelope.kind(), envelope.id(),
                    e.getMessage(), e);
            failed();
        }
    }

    private void tick() {
        lastTickNanos = System.nanoTime();
        try {
            agent.onTick(context);
        } catch (FatalAgentException e) {
            fatal(e);
        } catch (Exception e) {
            restoreInterrupt(e);
            log.warn("Agent {} tick failed: {}", identity.id(), e.getMessage(), e);
            failed();
        }
    }

    private void succeeded() {
        handle.reportOutcome(true);
        if (state == AgentState.DEGRADED && !stopRequested) {
            transition(AgentState.RUNNING);
            log.info("Agent {} recovered", identity.id());
        }
    }

    private void failed() {
        handle.reportOutcome(false);
        if (state == AgentState.RUNNING && !stopRequested) {
            transition(AgentState.DEGRADED);
        }
    }

    private void fatal(FatalAgentException e) {
        log.error("Agent {} hit a fatal error: {}", identity.id(), e.getMessage(), e);
        context.emitToParent(EventPayload.of(EventTypes.AGENT_FATAL, Map.of(
                "agentId", identity.id(),
                "message", String.valueOf(e.getMessage()))));
        requestStop("fatal error");
    }

    private void finish() {
        try {
            agent.onStop(context);
        } catch (RuntimeException e) {
            log.warn("Agent {} onStop failed: {}", identity.id(), e.getMessage(), e);
        }
        transition(AgentState.STOPPED);
        handle.close();
        if (!started.isDone()) {
            started.completeExceptionally(new IllegalStateException("Agent " + identity.id() + " stopped"));
        }
        log.info("Agent {} stopped", identity.id());
        terminated.complete(null);
    }

    private void transition(AgentState next) {
        state = next;
        handle.heartbeat(next);
    }

    static boolean isRetryable(Throwable e) {
        return e instanceof TransientAgentException
                || e instanceof IOException
                || e instanceof TimeoutException;
    }

    private void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }
}
