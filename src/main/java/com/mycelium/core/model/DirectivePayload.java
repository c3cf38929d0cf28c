package com.mycelium.core.model;

import com.mycelium.core.runtime.UnsupportedActionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request for work: a typed action plus free-form parameters.
 *
 * @param action          the requested action; its capability drives routing
 * @param params          action parameters
 * @param preferredTarget child id to prefer when routing, or {@code null}
 */
public record DirectivePayload(
    ActionKind action,
    Map<String, Object> params,
    String preferredTarget
) implements Payload {

    public DirectivePayload {
        if (action == null) {
            throw new IllegalArgumentException("directive action is required");
        }
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static DirectivePayload of(ActionKind action, Map<String, Object> params) {
        return new DirectivePayload(action, params, null);
    }

    public static DirectivePayload of(ActionKind action) {
        return new DirectivePayload(action, Map.of(), null);
    }

    public DirectivePayload withPreferredTarget(String target) {
        return new DirectivePayload(action, params, target);
    }

    /**
     * Narrows the action to the enum a handler understands.
     *
     * @throws UnsupportedActionException if the action belongs to a different enum
     */
    public <A extends Enum<A> & ActionKind> A actionAs(Class<A> type) {
        if (!type.isInstance(action)) {
            throw new UnsupportedActionException(action.qualifiedName(), type.getSimpleName());
        }
        return type.cast(action);
    }

    public String param(String key) {
        Object value = params.get(key);
        return value != null ? value.toString() : null;
    }
}
