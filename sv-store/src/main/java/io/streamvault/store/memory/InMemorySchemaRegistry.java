package io.streamvault.store.memory;

import io.streamvault.core.EventTypeRegistration;
import io.streamvault.store.SchemaRegistry;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySchemaRegistry implements SchemaRegistry {
    private final Map<String, EventTypeRegistration> byType = new ConcurrentHashMap<>();

    @Override
    public Optional<EventTypeRegistration> lookup(String eventType) {
        return Optional.ofNullable(byType.get(eventType));
    }

    @Override
    public void register(EventTypeRegistration registration) {
        byType.put(registration.eventType(), registration);
    }

    @Override
    public Collection<EventTypeRegistration> registrations() {
        return List.copyOf(byType.values());
    }
}
