package com.mycelium.core.model;

import java.util.Map;

public record QueryPayload(
    String question,
    Map<String, Object> params
) implements Payload {

    public QueryPayload {
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
