package io.streamvault.projection;

/** What the router does with an event type that has no entry in its routing table. */
public enum UnmappedEventPolicy {
    /** Refresh every registered projection. */
    REFRESH_ALL,
    /** Refresh nothing. */
    IGNORE
}
