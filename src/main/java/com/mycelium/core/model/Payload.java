package com.mycelium.core.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Marker for everything an {@link Envelope} can carry. The concrete type is written
 * as a {@code type} property when an envelope crosses the remote bridge.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DirectivePayload.class, name = "directive"),
    @JsonSubTypes.Type(value = GoalPayload.class, name = "goal"),
    @JsonSubTypes.Type(value = ReportPayload.class, name = "report"),
    @JsonSubTypes.Type(value = SummaryPayload.class, name = "summary"),
    @JsonSubTypes.Type(value = QueryPayload.class, name = "query"),
    @JsonSubTypes.Type(value = CoordinatePayload.class, name = "coordinate"),
    @JsonSubTypes.Type(value = EventPayload.class, name = "event")
})
public interface Payload {
}
