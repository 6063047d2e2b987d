package io.streamvault.core;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one archival run. {@code leftover} lists the events older than the cutoff
 * that could not be moved; an empty list means the run was complete.
 */
public record ArchiveResult(Instant cutoff, int moved, List<UUID> leftover) {
    public ArchiveResult {
        leftover = leftover == null ? List.of() : List.copyOf(leftover);
    }

    public static ArchiveResult complete(Instant cutoff, int moved) {
        return new ArchiveResult(cutoff, moved, List.of());
    }

    public boolean isComplete() {
        return leftover.isEmpty();
    }
}
