package io.streamvault.store.pg;

import io.streamvault.core.ProjectionState;
import io.streamvault.core.ProjectionStatus;
import io.streamvault.store.ProjectionStatusStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Rows of the {@code projections} table. {@code status} keeps the coarse
 * {@code active}/{@code error} value readers of the table know; {@code state} holds the full one.
 */
public final class PostgresProjectionStatusStore implements ProjectionStatusStore {
    private static final String COLUMNS = """
            projection_name, state, last_processed_event_id, last_processed_timestamp,
            projection_version, error_message, updated_at""";

    private final JdbcTemplate jdbc;

    public PostgresProjectionStatusStore(JdbcTemplate jdbc) {
        this.jdbc = Objects.requireNonNull(jdbc);
    }

    @Override
    public Optional<ProjectionStatus> find(String name) {
        return jdbc.query("SELECT " + COLUMNS + " FROM projections WHERE projection_name = ?", mapper(), name)
                .stream().findFirst();
    }

    @Override
    public List<ProjectionStatus> findAll() {
        return jdbc.query("SELECT " + COLUMNS + " FROM projections ORDER BY projection_name", mapper());
    }

    @Override
    public void save(ProjectionStatus s) {
        jdbc.update("""
          INSERT INTO projections (projection_name, status, state, last_processed_event_id, last_processed_timestamp,
                                   projection_version, error_message, updated_at)
          VALUES (?, ?, ?, ?, ?, ?, ?, ?)
          ON CONFLICT (projection_name)
          DO UPDATE SET status = EXCLUDED.status,
                        state = EXCLUDED.state,
                        last_processed_event_id = EXCLUDED.last_processed_event_id,
                        last_processed_timestamp = EXCLUDED.last_processed_timestamp,
                        projection_version = EXCLUDED.projection_version,
                        error_message = EXCLUDED.error_message,
                        updated_at = EXCLUDED.updated_at
          """,
                s.name(), s.status(), s.state().name(),
                s.lastProcessedEventId(),
                s.lastProcessedTimestamp() == null ? null : Timestamp.from(s.lastProcessedTimestamp()),
                s.schemaVersion(), s.errorMessage(), Timestamp.from(s.updatedAt()));
    }

    private RowMapper<ProjectionStatus> mapper() {
        return (rs, rn) -> {
            var eventId = rs.getString("last_processed_event_id");
            var eventTime = rs.getTimestamp("last_processed_timestamp");
            return new ProjectionStatus(
                    rs.getString("projection_name"),
                    ProjectionState.valueOf(rs.getString("state")),
                    eventId == null ? null : UUID.fromString(eventId),
                    eventTime == null ? null : eventTime.toInstant(),
                    rs.getInt("projection_version"),
                    rs.getString("error_message"),
                    rs.getTimestamp("updated_at").toInstant());
        };
    }
}
