package com.mycelium.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fire-and-forget notification.
 *
 * @param eventType event name, see {@link EventTypes} for the ones the core emits
 * @param data      free-form event data
 */
public record EventPayload(
    String eventType,
    Map<String, Object> data
) implements Payload {

    public EventPayload {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType is required");
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static EventPayload of(String eventType, Map<String, Object> data) {
        return new EventPayload(eventType, data);
    }

    public String value(String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }
}
