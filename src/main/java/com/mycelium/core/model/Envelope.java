package com.mycelium.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.UUID;

/**
 * Immutable message exchanged between agents.
 * <p>
 * An envelope is never mutated after construction. Retries and forwards go through
 * {@link #derive()}, which yields a fresh id while keeping the correlation key, so a
 * reply can always be matched to the work that caused it.
 *
 * @param id               unique envelope id
 * @param senderId         sending agent id
 * @param recipients       ordered, de-duplicated recipient ids
 * @param kind             message kind; selects the handler on the receiver
 * @param payload          kind-specific payload
 * @param createdAt        creation time
 * @param priority         0 (lowest) to 10 (highest)
 * @param correlationId    id of the envelope this one belongs to, or {@code null}
 * @param ttl              time-to-live measured from {@code createdAt}, or {@code null}
 * @param requiresResponse whether the receiver must send a report or reply
 */
public record Envelope(
    String id,
    String senderId,
    List<String> recipients,
    MessageKind kind,
    Payload payload,
    Instant createdAt,
    int priority,
    String correlationId,
    Duration ttl,
    boolean requiresResponse
) {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 10;
    public static final int DEFAULT_PRIORITY = 5;

    public Envelope {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("envelope id is required");
        }
        if (senderId == null || senderId.isBlank()) {
            throw new IllegalArgumentException("senderId is required");
        }
        if (recipients == null || recipients.isEmpty()) {
            throw new IllegalArgumentException("at least one recipient is required");
        }
        if (kind == null) {
            throw new IllegalArgumentException("message kind is required");
        }
        if (!kind.accepts(payload)) {
            throw new IllegalArgumentException("payload "
                    + (payload == null ? "null" : payload.getClass().getSimpleName())
                    + " is not valid for kind " + kind);
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt is required");
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("priority must be within 0..10, got " + priority);
        }
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        recipients = List.copyOf(new LinkedHashSet<>(recipients));
    }

    /**
     * Key used to match reports to the work they answer: the correlation id when set,
     * otherwise this envelope's own id.
     */
    public String correlationKey() {
        return correlationId != null ? correlationId : id;
    }

    public boolean isExpired(Instant now) {
        return ttl != null && !now.isBefore(createdAt.plus(ttl));
    }

    /**
     * Same envelope (same id) addressed to a different recipient set. Used for
     * broadcast fan-out.
     */
    public Envelope withRecipients(List<String> newRecipients) {
        return new Envelope(id, senderId, newRecipients, kind, payload, createdAt, priority,
                correlationId, ttl, requiresResponse);
    }

    public <P extends Payload> P payloadAs(Class<P> type) {
        return type.cast(payload);
    }

    /**
     * Starts a builder for a new envelope that carries this envelope's correlation key,
     * payload, priority, ttl and response flag. Sender, recipients and creation time
     * must be supplied again.
     */
    public Builder derive() {
        return new Builder()
                .kind(kind)
                .payload(payload)
                .priority(priority)
                .correlationId(correlationKey())
                .ttl(ttl)
                .requiresResponse(requiresResponse);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public static final class Builder {

        private String id;
        private String senderId;
        private final List<String> recipients = new ArrayList<>();
        private MessageKind kind;
        private Payload payload;
        private Instant createdAt;
        private int priority = DEFAULT_PRIORITY;
        private String correlationId;
        private Duration ttl;
        private boolean requiresResponse;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder from(String senderId) {
            this.senderId = senderId;
            return this;
        }

        public Builder to(String recipient) {
            this.recipients.add(recipient);
            return this;
        }

        public Builder to(Collection<String> recipients) {
            this.recipients.addAll(recipients);
            return this;
        }

        public Builder clearRecipients() {
            this.recipients.clear();
            return this;
        }

        public Builder kind(MessageKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder payload(Payload payload) {
            this.payload = payload;
            return this;
        }

        public Builder directive(DirectivePayload directive) {
            return kind(MessageKind.DIRECTIVE).payload(directive).requiresResponse(true);
        }

        public Builder report(ReportPayload report) {
            return kind(MessageKind.REPORT).payload(report).requiresResponse(false);
        }

        public Builder event(EventPayload event) {
            return kind(MessageKind.EVENT).payload(event).requiresResponse(false);
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder requiresResponse(boolean requiresResponse) {
            this.requiresResponse = requiresResponse;
            return this;
        }

        public Envelope build() {
            return new Envelope(
                    id != null ? id : newId(),
                    senderId,
                    recipients,
                    kind,
                    payload,
                    createdAt,
                    priority,
                    correlationId,
                    ttl,
                    requiresResponse);
        }
    }
}
