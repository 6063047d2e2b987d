package io.streamvault.projection;

/**
 * A named read model the engine keeps current.
 *
 * Implementations must build the new view completely before exposing it, so a failed
 * {@link #refresh()} leaves the previous view queryable. Refreshing twice with no new events
 * in between must leave the view unchanged.
 */
public interface Projection {

    String name();

    default int schemaVersion() {
        return 1;
    }

    /** Brings the view up to date with the event log. Any exception marks the projection as failed. */
    void refresh() throws Exception;
}
