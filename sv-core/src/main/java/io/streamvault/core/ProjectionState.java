package io.streamvault.core;

/**
 * Refresh lifecycle of a projection.
 * FRESH -> STALE on a dependency event, STALE -> REFRESHING, REFRESHING -> FRESH or ERROR.
 */
public enum ProjectionState {
    FRESH,
    STALE,
    REFRESHING,
    ERROR;

    /** Persisted status column value: {@code error} or {@code active}. */
    public String status() {
        return this == ERROR ? "error" : "active";
    }
}
