package io.streamvault.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Latest materialized state of one stream at {@code version}. */
public record Snapshot(String streamId, String streamType, long version, Map<String, Object> state, Instant createdAt) {
    public Snapshot {
        Objects.requireNonNull(streamId);
        Objects.requireNonNull(streamType);
        Objects.requireNonNull(createdAt);
        if (version < 0) throw new IllegalArgumentException("version must be >= 0, was " + version);
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }
}
