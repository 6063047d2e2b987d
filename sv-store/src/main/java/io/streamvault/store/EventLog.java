package io.streamvault.store;

import io.streamvault.core.ArchiveResult;
import io.streamvault.core.EventRecord;
import io.streamvault.core.NewEvent;
import io.streamvault.core.StreamStats;

import java.time.Instant;
import java.util.List;

/**
 * Durable, append-only log of events, ordered per stream by version and globally by sequence.
 *
 * Implementations serialize the read-check-write of {@link #append} per stream only; appends
 * to different streams share nothing but the global sequence allocation.
 */
public interface EventLog {

    /**
     * Appends {@code events}, all belonging to {@code streamId}, as one atomic unit with
     * contiguous versions following the current one.
     *
     * @param expectedVersion required current version, or {@code null} to skip the check
     * @throws io.streamvault.core.error.ConcurrencyConflictException when the stream is not at {@code expectedVersion}
     * @throws io.streamvault.core.error.StorageFailureException when the write could not be made durable
     */
    List<EventRecord> append(String streamId, List<NewEvent> events, Long expectedVersion);

    default EventRecord append(NewEvent event, Long expectedVersion) {
        return append(event.streamId(), List.of(event), expectedVersion).get(0);
    }

    /** Highest version ever committed to the stream, 0 if it was never written. */
    long currentVersion(String streamId);

    /** Hot events of the stream with {@code version >= fromVersion}, in version order. */
    List<EventRecord> readStream(String streamId, long fromVersion);

    default List<EventRecord> readStream(String streamId) {
        return readStream(streamId, 1);
    }

    /** Archived events of the stream with {@code version >= fromVersion}, in version order. */
    List<EventRecord> readArchivedStream(String streamId, long fromVersion);

    /** Up to {@code limit} hot events with a global sequence above {@code afterGlobalSequence}, in sequence order. */
    List<EventRecord> readAll(long afterGlobalSequence, int limit);

    long lastGlobalSequence();

    /** Moves every hot event with a timestamp before {@code cutoff} into the archive, verbatim. */
    ArchiveResult archiveBefore(Instant cutoff);

    List<StreamStats> streamStats();
}
