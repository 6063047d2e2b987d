package io.streamvault.store;

import io.streamvault.core.EventTypeRegistration;

import java.util.Collection;
import java.util.Optional;

/** Optional per event type payload schemas. Types without a registration are not validated. */
public interface SchemaRegistry {

    Optional<EventTypeRegistration> lookup(String eventType);

    /**
     * Adds or replaces the schema for an event type. Only the JSON Schema subset that
     * {@link io.streamvault.store.schema.PayloadSchemaValidator} understands is enforced on append;
     * other keywords such as {@code $ref} or {@code oneOf} are stored but never checked.
     */
    void register(EventTypeRegistration registration);

    Collection<EventTypeRegistration> registrations();
}
