package io.streamvault.core.error;

/**
 * The stream moved on since the caller read it. Nothing was written; re-read the
 * current version and retry.
 */
public class ConcurrencyConflictException extends EventStoreException {

    private final String streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String streamId, long expectedVersion, long actualVersion) {
        super("Concurrency conflict on stream " + streamId + ": expected version "
                + expectedVersion + ", but current version is " + actualVersion);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String streamId() {
        return streamId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    /** Current version at the time of the check, or -1 when the storage could not tell. */
    public long actualVersion() {
        return actualVersion;
    }
}
