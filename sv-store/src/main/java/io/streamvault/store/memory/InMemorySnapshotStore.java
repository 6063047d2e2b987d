package io.streamvault.store.memory;

import io.streamvault.core.Snapshot;
import io.streamvault.store.SnapshotStore;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySnapshotStore implements SnapshotStore {
    private final Map<String, Snapshot> byStream = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySnapshotStore() {
        this(Clock.systemUTC());
    }

    public InMemorySnapshotStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Snapshot> latest(String streamId) {
        return Optional.ofNullable(byStream.get(streamId));
    }

    @Override
    public void save(String streamId, String streamType, long version, Map<String, Object> state) {
        byStream.put(streamId, new Snapshot(streamId, streamType, version, state, clock.instant()));
    }
}
