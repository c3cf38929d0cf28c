package com.mycelium.core.bridge;

import com.mycelium.core.bus.AgentHandle;
import com.mycelium.core.bus.MessageBus;
import com.mycelium.core.bus.SendResult;
import com.mycelium.core.model.AgentIdentity;
import com.mycelium.core.model.Envelope;
import com.mycelium.core.model.Payload;
import com.mycelium.core.runtime.Agent;
import com.mycelium.core.runtime.AgentContext;
import com.mycelium.core.runtime.AgentRuntime;
import com.mycelium.core.runtime.DirectiveOutcome;
import com.mycelium.core.runtime.RuntimeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connects the local bus to a remote one. Every remote agent the bridge knows about
 * gets a local proxy under the same id; envelopes addressed to a proxy are encoded and
 * shipped unchanged, and envelopes arriving from the remote side are sent on the local
 * bus unchanged.
 */
public class RemoteBridge implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RemoteBridge.class);

    private final MessageBus bus;
    private final EnvelopeCodec codec;
    private final BridgeTransport transport;
    private final RuntimeSettings proxySettings;
    private final List<AgentRuntime> proxies = new ArrayList<>();
    private final AtomicLong dropped = new AtomicLong();

    public RemoteBridge(MessageBus bus, EnvelopeCodec codec, BridgeTransport transport, RuntimeSettings proxySettings) {
        this.bus = bus;
        this.codec = codec;
        this.transport = transport;
        this.proxySettings = proxySettings;
        transport.onFrame(this::receive);
    }

    /**
     * Registers a local proxy for a remote agent. The proxy has no local parent; it is
     * stopped when the bridge closes.
     */
    public synchronized AgentRuntime expose(AgentIdentity remote) {
        AgentIdentity local = new AgentIdentity(remote.id(), remote.capabilities(), remote.tier(), null);
        AgentHandle handle = bus.register(local, proxySettings.mailboxCapacity());
        var runtime = new AgentRuntime(new Forwarder(), handle, bus, proxySettings);
        runtime.start();
        proxies.add(runtime);
        log.info("Bridge proxy registered for remote agent {}", remote.id());
        return runtime;
    }

    void receive(String frame) {
        Envelope envelope;
        try {
            envelope = codec.decode(frame);
        } catch (IllegalArgumentException e) {
            dropped.incrementAndGet();
            log.warn("Bridge dropped undecodable frame: {}", e.getMessage());
            return;
        }
        SendResult result = bus.send(envelope);
        if (!result.allDelivered()) {
            log.warn("Bridged envelope {} not fully delivered: {}", envelope.id(), result.faults());
        }
    }

    void forward(Envelope envelope, String proxyId) throws IOException {
        transport.send(codec.encode(envelope.withRecipients(List.of(proxyId))));
        log.debug("Bridged {} {} to remote {}", envelope.kind(), envelope.id(), envelope.recipients());
    }

    public long droppedFrames() {
        return dropped.get();
    }

    @Override
    public synchronized void close() throws IOException {
        for (AgentRuntime proxy : proxies) {
            proxy.stop(AgentRuntime.OWNER);
            bus.unregister(proxy.id());
        }
        proxies.clear();
        transport.close();
    }

    /** Proxy behaviour: every envelope goes over the wire, nothing is answered locally. */
    private final class Forwarder implements Agent {

        @Override
        public DirectiveOutcome onDirective(Envelope directive, AgentContext context) throws IOException {
            forward(directive, context.id());
            return DirectiveOutcome.deferred();
        }

        @Override
        public void onReport(Envelope report, AgentContext context) throws IOException {
            forward(report, context.id());
        }

        @Override
        public Payload onQuery(Envelope query, AgentContext context) throws IOException {
            forward(query, context.id());
            return null;
        }

        @Override
        public void onCoordinate(Envelope proposal, AgentContext context) throws IOException {
            forward(proposal, context.id());
        }

        @Override
        public void onEvent(Envelope event, AgentContext context) throws IOException {
            forward(event, context.id());
        }
    }
}
