package com.mycelium.core.strategic;

import com.mycelium.core.model.DirectivePayload;
import com.mycelium.core.model.GoalPayload;
import com.mycelium.core.model.Payload;

import java.util.List;

/**
 * Turns a directive received by the coordinator into the steps that get routed to
 * tactical supervisors, one step per capability-scoped directive.
 */
@FunctionalInterface
public interface GoalDecomposer {

    List<DirectivePayload> decompose(Payload directive);

    /**
     * Uses the steps a {@link GoalPayload} already lists, or the directive itself as
     * the only step.
     */
    static GoalDecomposer explicitSteps() {
        return payload -> {
            if (payload instanceof GoalPayload goal) {
                return goal.steps();
            }
            if (payload instanceof DirectivePayload directive) {
                return List.of(directive);
            }
            return List.of();
        };
    }
}
