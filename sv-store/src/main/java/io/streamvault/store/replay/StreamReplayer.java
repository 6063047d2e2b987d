package io.streamvault.store.replay;

import io.streamvault.core.EventRecord;
import io.streamvault.core.error.StreamGapException;
import io.streamvault.store.EventLog;
import io.streamvault.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rebuilds stream state from the log, starting at the latest snapshot when there is one.
 *
 * Reads go through {@link #readFullStream}, which stitches archived and hot events, so a
 * stream that was partially archived still replays from its true beginning.
 */
public final class StreamReplayer {
    private static final Logger log = LoggerFactory.getLogger(StreamReplayer.class);

    private final EventLog eventLog;
    private final SnapshotStore snapshots;

    public StreamReplayer(EventLog eventLog, SnapshotStore snapshots) {
        this.eventLog = Objects.requireNonNull(eventLog);
        this.snapshots = Objects.requireNonNull(snapshots);
    }

    /** Latest snapshot plus every later event, or the whole stream when no snapshot exists. */
    public <S> Replay<S> replay(String streamId, Aggregator<S> aggregator) {
        var snapshot = snapshots.latest(streamId);
        if (snapshot.isEmpty()) {
            return replayFromScratch(streamId, aggregator);
        }
        var snap = snapshot.get();
        var state = aggregator.fromSnapshot(snap.state());
        return fold(streamId, aggregator, state, snap.version(), snap.version());
    }

    /** Ignores snapshots; the reference result every snapshot-based replay must equal. */
    public <S> Replay<S> replayFromScratch(String streamId, Aggregator<S> aggregator) {
        return fold(streamId, aggregator, aggregator.initial(), 0, -1);
    }

    /** Replays and stores the result as the stream's new snapshot. Empty streams are not snapshotted. */
    public <S> Replay<S> snapshot(String streamId, String streamType, Aggregator<S> aggregator) {
        var replay = replay(streamId, aggregator);
        if (replay.version() > 0) {
            snapshots.save(streamId, streamType, replay.version(), aggregator.toSnapshot(replay.state()));
            log.debug("Saved snapshot of {} at version {}", streamId, replay.version());
        }
        return replay;
    }

    /** Archived events followed by hot events, with {@code version >= fromVersion}. */
    public List<EventRecord> readFullStream(String streamId, long fromVersion) {
        // hot first: an event archived between the two reads then shows up on both sides, never on neither
        var hot = eventLog.readStream(streamId, fromVersion);
        var cold = eventLog.readArchivedStream(streamId, fromVersion);
        if (cold.isEmpty()) return hot;

        var merged = new ArrayList<EventRecord>(cold.size() + hot.size());
        merged.addAll(cold);
        long lastCold = cold.get(cold.size() - 1).version();
        for (var e : hot) {
            if (e.version() > lastCold) merged.add(e);
        }
        return merged;
    }

    private <S> Replay<S> fold(String streamId, Aggregator<S> aggregator, S state, long afterVersion, long snapshotVersion) {
        long expected = afterVersion + 1;
        for (var e : readFullStream(streamId, expected)) {
            if (e.version() != expected) {
                throw new StreamGapException(streamId, expected, e.version());
            }
            state = aggregator.apply(state, e);
            expected++;
        }
        return new Replay<>(state, expected - 1, snapshotVersion);
    }

    /**
     * @param version         last version folded into {@code state}
     * @param snapshotVersion version of the snapshot the replay started from, -1 for a full replay
     */
    public record Replay<S>(S state, long version, long snapshotVersion) {
        public boolean fromSnapshot() {
            return snapshotVersion >= 0;
        }
    }
}
