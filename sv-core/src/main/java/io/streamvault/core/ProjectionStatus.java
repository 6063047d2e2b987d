package io.streamvault.core;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public record ProjectionStatus(
        String name,
        ProjectionState state,
        UUID lastProcessedEventId,
        Instant lastProcessedTimestamp,
        int schemaVersion,
        String errorMessage,
        Instant updatedAt
) {
    public ProjectionStatus {
        Objects.requireNonNull(name);
        Objects.requireNonNull(state);
        Objects.requireNonNull(updatedAt);
    }

    public static ProjectionStatus declared(String name, int schemaVersion, Instant at) {
        return new ProjectionStatus(name, ProjectionState.FRESH, null, null, schemaVersion, null, at);
    }

    public String status() {
        return state.status();
    }

    public ProjectionStatus withState(ProjectionState next, Instant at) {
        return new ProjectionStatus(name, next, lastProcessedEventId, lastProcessedTimestamp, schemaVersion, errorMessage, at);
    }

    /** Successful refresh up to {@code event}; clears any previous error. */
    public ProjectionStatus refreshed(EventRecord event, Instant at) {
        var eventId = event == null ? lastProcessedEventId : event.id();
        var eventTime = event == null ? lastProcessedTimestamp : event.timestamp();
        return new ProjectionStatus(name, ProjectionState.FRESH, eventId, eventTime, schemaVersion, null, at);
    }

    /** Failed refresh; the last processed event stays where the last good refresh left it. */
    public ProjectionStatus failed(String message, Instant at) {
        return new ProjectionStatus(name, ProjectionState.ERROR, lastProcessedEventId, lastProcessedTimestamp, schemaVersion, message, at);
    }
}
