package io.streamvault.core.error;

/** A replay found a hole in a stream's version sequence, typically after a partial archival. */
public class StreamGapException extends EventStoreException {

    private final String streamId;
    private final long expectedVersion;
    private final long foundVersion;

    public StreamGapException(String streamId, long expectedVersion, long foundVersion) {
        super("stream " + streamId + " expected version " + expectedVersion + " but found " + foundVersion);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.foundVersion = foundVersion;
    }

    public String streamId() {
        return streamId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long foundVersion() {
        return foundVersion;
    }
}
