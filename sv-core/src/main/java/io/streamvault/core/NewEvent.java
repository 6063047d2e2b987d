package io.streamvault.core;

import java.util.Map;
import java.util.Objects;

/** An event a caller wants to append; the engine assigns id, version, sequence and time. */
public record NewEvent(
        String streamId,
        String streamType,
        String eventType,
        Map<String, Object> payload,
        Map<String, Object> metadata
) {
    public NewEvent {
        if (streamId == null || streamId.isBlank()) throw new IllegalArgumentException("streamId is required");
        if (streamType == null || streamType.isBlank()) throw new IllegalArgumentException("streamType is required");
        if (eventType == null || eventType.isBlank()) throw new IllegalArgumentException("eventType is required");
        Objects.requireNonNull(payload, "payload is required");
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static NewEvent of(String streamId, String streamType, String eventType, Map<String, Object> payload) {
        return new NewEvent(streamId, streamType, eventType, payload, Map.of());
    }
}
