package io.streamvault.core;

import java.util.Map;
import java.util.Objects;

/**
 * Registered JSON schema for the payload of one event type. Appends enforce a subset of JSON Schema:
 * type, required, properties, boolean additionalProperties, items, enum, minimum, maximum,
 * minLength and minItems.
 */
public record EventTypeRegistration(String eventType, int schemaVersion, Map<String, Object> jsonSchema, String description) {
    public EventTypeRegistration {
        Objects.requireNonNull(eventType);
        Objects.requireNonNull(jsonSchema);
        if (schemaVersion < 1) schemaVersion = 1;
    }
}
