package io.streamvault.store.archive;

import io.streamvault.core.ArchiveResult;
import io.streamvault.core.error.ArchivalPartialFailureException;
import io.streamvault.store.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Moves events older than a retention period out of the hot log.
 *
 * After a run, {@link EventLog#readStream} on a partially archived stream starts at the first
 * hot version, not at 1. Replays that need the whole history go through
 * {@link io.streamvault.store.replay.StreamReplayer#readFullStream}.
 */
public final class ArchivalService {
    private static final Logger log = LoggerFactory.getLogger(ArchivalService.class);

    private final EventLog eventLog;
    private final Clock clock;

    public ArchivalService(EventLog eventLog, Clock clock) {
        this.eventLog = Objects.requireNonNull(eventLog);
        this.clock = Objects.requireNonNull(clock);
    }

    /** Archives every event with a timestamp before {@code now - retentionPeriod}. */
    public ArchiveResult archive(Duration retentionPeriod) {
        if (retentionPeriod == null || retentionPeriod.isNegative()) {
            throw new IllegalArgumentException("retentionPeriod must be >= 0");
        }
        var cutoff = clock.instant().minus(retentionPeriod);
        var result = eventLog.archiveBefore(cutoff);
        if (result.isComplete()) {
            log.info("Archived {} events older than {}", result.moved(), cutoff);
        } else {
            log.error("Archival before {} moved {} events, {} left in the hot log: {}",
                    cutoff, result.moved(), result.leftover().size(), result.leftover());
        }
        return result;
    }

    /** Like {@link #archive} but raises when any event could not be moved. */
    public ArchiveResult archiveOrThrow(Duration retentionPeriod) {
        var result = archive(retentionPeriod);
        if (!result.isComplete()) {
            throw new ArchivalPartialFailureException(result);
        }
        return result;
    }
}
