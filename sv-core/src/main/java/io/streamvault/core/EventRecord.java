package io.streamvault.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A committed, immutable event.
 *
 * {@code version} is the 1-based position inside the stream, {@code globalSequence}
 * the position across all streams. {@code timestamp} is informational only.
 */
public record EventRecord(
        UUID id,
        String streamId,
        String streamType,
        String eventType,
        long version,
        long globalSequence,
        Map<String, Object> payload,
        Map<String, Object> metadata,
        Instant timestamp
) {
    public EventRecord {
        Objects.requireNonNull(id);
        Objects.requireNonNull(streamId);
        Objects.requireNonNull(streamType);
        Objects.requireNonNull(eventType);
        Objects.requireNonNull(timestamp);
        if (version < 1) throw new IllegalArgumentException("version must be >= 1, was " + version);
        // values may be JSON null
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Builds the record an append of {@code event} commits as. */
    public static EventRecord committed(NewEvent event, UUID id, long version, long globalSequence, Instant at) {
        return new EventRecord(id, event.streamId(), event.streamType(), event.eventType(),
                version, globalSequence, event.payload(), event.metadata(), at);
    }
}
