package com.mycelium.core.model;

import java.util.Map;

/**
 * Peer-to-peer proposal exchange between agents of the same tier.
 */
public record CoordinatePayload(
    String proposalId,
    Stage stage,
    Map<String, Object> terms
) implements Payload {

    public enum Stage { PROPOSE, ACCEPT, REJECT }

    public CoordinatePayload {
        if (proposalId == null || proposalId.isBlank()) {
            throw new IllegalArgumentException("proposalId is required");
        }
        terms = terms == null ? Map.of() : Map.copyOf(terms);
    }
}
