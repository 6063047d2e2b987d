package io.streamvault.core.error;

import java.util.List;

/** Payload rejected by the registered schema of its event type. Nothing was written. */
public class SchemaValidationException extends EventStoreException {

    private final String eventType;
    private final List<String> violations;

    public SchemaValidationException(String eventType, List<String> violations) {
        super("payload of " + eventType + " violates its schema: " + String.join("; ", violations));
        this.eventType = eventType;
        this.violations = List.copyOf(violations);
    }

    public String eventType() {
        return eventType;
    }

    public List<String> violations() {
        return violations;
    }
}
