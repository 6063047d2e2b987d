package io.streamvault.store;

import io.streamvault.core.Snapshot;

import java.util.Map;
import java.util.Optional;

/** Keeps the single latest snapshot per stream. */
public interface SnapshotStore {

    Optional<Snapshot> latest(String streamId);

    /** Upsert: replaces any earlier snapshot of the stream, last write wins. */
    void save(String streamId, String streamType, long version, Map<String, Object> state);
}
