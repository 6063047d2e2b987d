package io.streamvault.store.pg;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.ArchiveResult;
import io.streamvault.core.EventRecord;
import io.streamvault.core.NewEvent;
import io.streamvault.core.StreamStats;
import io.streamvault.core.error.ConcurrencyConflictException;
import io.streamvault.core.error.StorageFailureException;
import io.streamvault.store.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

/**
 * {@link EventLog} over the {@code events} and {@code events_archive} tables.
 *
 * An append holds a transaction scoped advisory lock on its stream for the version check and
 * insert; the {@code UNIQUE (stream_id, event_version)} constraint backs it up. After the version
 * check it takes a second, global advisory lock ({@link #SEQUENCE_LOCK}) and keeps it until commit,
 * so the {@code BIGSERIAL} global sequence becomes visible in the order it was drawn.
 *
 * <p>That global lock serializes the insert and commit of every append, across all streams. Only
 * the stream lock, the version read and a conflicting append's rollback run in parallel.
 */
public final class PostgresEventLog implements EventLog {
    private static final Logger log = LoggerFactory.getLogger(PostgresEventLog.class);

    static final long SEQUENCE_LOCK = 0x5356_5345_5100L;

    private static final String COLUMNS = """
            event_id, stream_id, stream_type, event_type, event_version, global_sequence,
            event_data, event_metadata, created_at""";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final JsonColumns json;
    private final Clock clock;

    public PostgresEventLog(JdbcTemplate jdbc, TransactionTemplate tx, ObjectMapper json, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.tx = Objects.requireNonNull(tx);
        this.json = new JsonColumns(json);
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public List<EventRecord> append(String streamId, List<NewEvent> events, Long expectedVersion) {
        if (events == null || events.isEmpty()) return List.of();
        for (var e : events) {
            if (!streamId.equals(e.streamId())) {
                throw new IllegalArgumentException("event for stream " + e.streamId() + " in batch for " + streamId);
            }
        }
        try {
            return tx.execute(status -> {
                lockStream(streamId);
                long current = currentVersion(streamId);
                if (expectedVersion != null && expectedVersion != current) {
                    throw new ConcurrencyConflictException(streamId, expectedVersion, current);
                }
                jdbc.queryForList("SELECT pg_advisory_xact_lock(?)", SEQUENCE_LOCK);

                var at = clock.instant();
                var committed = new ArrayList<EventRecord>(events.size());
                long version = current;
                for (var e : events) {
                    var id = UUID.randomUUID();
                    Long sequence = jdbc.queryForObject("""
                            INSERT INTO events (event_id, stream_id, stream_type, event_type, event_version,
                                                event_data, event_metadata, created_at)
                            VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?)
                            RETURNING global_sequence
                            """, Long.class,
                            id, streamId, e.streamType(), e.eventType(), ++version,
                            json.write(e.payload()), json.write(e.metadata()), Timestamp.from(at));
                    committed.add(EventRecord.committed(e, id, version, Objects.requireNonNull(sequence), at));
                }
                return List.copyOf(committed);
            });
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(streamId, expectedVersion == null ? -1 : expectedVersion, -1);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageFailureException("append to stream " + streamId + " failed", e);
        }
    }

    @Override
    public long currentVersion(String streamId) {
        return storage("current version of " + streamId, () -> {
            Long v = jdbc.queryForObject("""
                    SELECT GREATEST(
                        (SELECT COALESCE(MAX(event_version), 0) FROM events WHERE stream_id = ?),
                        (SELECT COALESCE(MAX(event_version), 0) FROM events_archive WHERE stream_id = ?))
                    """, Long.class, streamId, streamId);
            return v == null ? 0L : v;
        });
    }

    @Override
    public List<EventRecord> readStream(String streamId, long fromVersion) {
        return storage("read of " + streamId, () -> jdbc.query(
                "SELECT " + COLUMNS + " FROM events WHERE stream_id = ? AND event_version >= ? ORDER BY event_version",
                mapper(), streamId, fromVersion));
    }

    @Override
    public List<EventRecord> readArchivedStream(String streamId, long fromVersion) {
        return storage("archived read of " + streamId, () -> jdbc.query(
                "SELECT " + COLUMNS + " FROM events_archive WHERE stream_id = ? AND event_version >= ? ORDER BY event_version",
                mapper(), streamId, fromVersion));
    }

    @Override
    public List<EventRecord> readAll(long afterGlobalSequence, int limit) {
        if (limit <= 0) return List.of();
        return storage("global read after " + afterGlobalSequence, () -> jdbc.query(
                "SELECT " + COLUMNS + " FROM events WHERE global_sequence > ? ORDER BY global_sequence LIMIT ?",
                mapper(), afterGlobalSequence, limit));
    }

    @Override
    public long lastGlobalSequence() {
        return storage("last global sequence", () -> {
            Long v = jdbc.queryForObject("""
                    SELECT GREATEST(
                        (SELECT COALESCE(MAX(global_sequence), 0) FROM events),
                        (SELECT COALESCE(MAX(global_sequence), 0) FROM events_archive))
                    """, Long.class);
            return v == null ? 0L : v;
        });
    }

    /**
     * Moves old events stream by stream, one transaction each. A stream that fails keeps all of
     * its candidates in the hot table and reports them as leftover; the other streams proceed.
     */
    @Override
    public ArchiveResult archiveBefore(Instant cutoff) {
        var candidates = new LinkedHashMap<String, List<UUID>>();
        storage("archival candidates before " + cutoff, () -> {
            jdbc.query("SELECT stream_id, event_id FROM events WHERE created_at < ? ORDER BY stream_id, event_version",
                    (RowCallbackHandler) rs -> candidates
                            .computeIfAbsent(rs.getString("stream_id"), k -> new ArrayList<>())
                            .add(UUID.fromString(rs.getString("event_id"))),
                    Timestamp.from(cutoff));
            return null;
        });

        int moved = 0;
        var leftover = new ArrayList<UUID>();
        for (var entry : candidates.entrySet()) {
            var streamId = entry.getKey();
            try {
                Integer n = tx.execute(status -> {
                    lockStream(streamId);
                    return jdbc.update("""
                            WITH moved AS (
                                DELETE FROM events WHERE stream_id = ? AND created_at < ?
                                RETURNING %s
                            )
                            INSERT INTO events_archive (%s) SELECT %s FROM moved
                            """.formatted(COLUMNS, COLUMNS, COLUMNS), streamId, Timestamp.from(cutoff));
                });
                moved += n == null ? 0 : n;
            } catch (DataAccessException | TransactionException e) {
                log.warn("Archival of stream {} failed, {} events stay hot: {}", streamId, entry.getValue().size(), e.getMessage());
                leftover.addAll(entry.getValue());
            }
        }
        return new ArchiveResult(cutoff, moved, leftover);
    }

    @Override
    public List<StreamStats> streamStats() {
        return storage("stream stats", () -> jdbc.query("""
                SELECT stream_type,
                       COUNT(DISTINCT stream_id) AS unique_streams,
                       COUNT(*)                  AS total_events,
                       MAX(event_version)        AS max_version,
                       MIN(created_at)           AS first_event,
                       MAX(created_at)           AS last_event
                FROM events
                GROUP BY stream_type
                ORDER BY total_events DESC
                """, (rs, rn) -> new StreamStats(
                rs.getString("stream_type"),
                rs.getLong("unique_streams"),
                rs.getLong("total_events"),
                rs.getLong("max_version"),
                rs.getTimestamp("first_event").toInstant(),
                rs.getTimestamp("last_event").toInstant())));
    }

    private void lockStream(String streamId) {
        jdbc.queryForList("SELECT pg_advisory_xact_lock(hashtext(?))", streamId);
    }

    private <T> T storage(String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StorageFailureException(what + " failed", e);
        }
    }

    RowMapper<EventRecord> mapper() {
        return (ResultSet rs, int rowNum) -> new EventRecord(
                UUID.fromString(rs.getString("event_id")),
                rs.getString("stream_id"),
                rs.getString("stream_type"),
                rs.getString("event_type"),
                rs.getLong("event_version"),
                rs.getLong("global_sequence"),
                json.readObject(rs.getString("event_data")),
                json.readObject(rs.getString("event_metadata")),
                rs.getTimestamp("created_at").toInstant());
    }
}
