package io.streamvault.store.memory;

import io.streamvault.core.ProjectionStatus;
import io.streamvault.store.ProjectionStatusStore;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryProjectionStatusStore implements ProjectionStatusStore {
    private final Map<String, ProjectionStatus> byName = new ConcurrentHashMap<>();

    @Override
    public Optional<ProjectionStatus> find(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public List<ProjectionStatus> findAll() {
        return byName.values().stream().sorted(Comparator.comparing(ProjectionStatus::name)).toList();
    }

    @Override
    public void save(ProjectionStatus status) {
        byName.put(status.name(), status);
    }
}
