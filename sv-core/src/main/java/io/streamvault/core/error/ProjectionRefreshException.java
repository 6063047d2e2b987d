package io.streamvault.core.error;

public class ProjectionRefreshException extends EventStoreException {

    private final String projection;

    public ProjectionRefreshException(String projection, String message, Throwable cause) {
        super("refresh of " + projection + " failed: " + message, cause);
        this.projection = projection;
    }

    public String projection() {
        return projection;
    }
}
