package com.mycelium.core.model;

import java.util.Set;

/**
 * Kind of an envelope. The kind selects exactly one handler on the receiving agent
 * and fixes which payload types the envelope may carry.
 */
public enum MessageKind {
    DIRECTIVE(Set.of(DirectivePayload.class, GoalPayload.class)),
    REPORT(Set.of(ReportPayload.class, SummaryPayload.class)),
    QUERY(Set.of(QueryPayload.class)),
    COORDINATE(Set.of(CoordinatePayload.class)),
    EVENT(Set.of(EventPayload.class));

    private final Set<Class<? extends Payload>> payloadTypes;

    MessageKind(Set<Class<? extends Payload>> payloadTypes) {
        this.payloadTypes = payloadTypes;
    }

    public boolean accepts(Payload payload) {
        return payload != null && payloadTypes.contains(payload.getClass());
    }
}
