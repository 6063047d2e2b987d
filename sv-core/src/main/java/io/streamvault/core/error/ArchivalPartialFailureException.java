package io.streamvault.core.error;

import io.streamvault.core.ArchiveResult;

public class ArchivalPartialFailureException extends EventStoreException {

    private final ArchiveResult result;

    public ArchivalPartialFailureException(ArchiveResult result) {
        super("archival moved " + result.moved() + " events but left " + result.leftover().size()
                + " behind: " + result.leftover());
        this.result = result;
    }

    public ArchiveResult result() {
        return result;
    }
}
