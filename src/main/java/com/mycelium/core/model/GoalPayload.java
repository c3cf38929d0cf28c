package com.mycelium.core.model;

import java.util.List;

/**
 * A high-level goal submitted to the strategic coordinator, already broken into
 * domain steps by the caller. A {@link com.mycelium.core.strategic.GoalDecomposer}
 * may refine the steps further.
 */
public record GoalPayload(
    String description,
    List<DirectivePayload> steps
) implements Payload {

    public GoalPayload {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
