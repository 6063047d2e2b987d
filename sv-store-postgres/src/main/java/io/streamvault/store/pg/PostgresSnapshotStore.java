package io.streamvault.store.pg;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.Snapshot;
import io.streamvault.store.SnapshotStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class PostgresSnapshotStore implements SnapshotStore {
    private final JdbcTemplate jdbc;
    private final JsonColumns json;

    public PostgresSnapshotStore(JdbcTemplate jdbc, ObjectMapper json) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.json = new JsonColumns(json);
    }

    @Override
    public Optional<Snapshot> latest(String streamId) {
        var sql = "SELECT stream_id, stream_type, snapshot_version, snapshot_data, created_at FROM snapshots WHERE stream_id = ?";
        return jdbc.query(sql, mapper(), streamId).stream().findFirst();
    }

    @Override
    public void save(String streamId, String streamType, long version, Map<String, Object> state) {
        var sql = """
          INSERT INTO snapshots (stream_id, stream_type, snapshot_version, snapshot_data, created_at)
          VALUES (?, ?, ?, ?::jsonb, now())
          ON CONFLICT (stream_id)
          DO UPDATE SET stream_type = EXCLUDED.stream_type,
                        snapshot_version = EXCLUDED.snapshot_version,
                        snapshot_data = EXCLUDED.snapshot_data,
                        created_at = now()
          """;
        jdbc.update(sql, streamId, streamType, version, json.write(state));
    }

    private RowMapper<Snapshot> mapper() {
        return (rs, rn) -> new Snapshot(
                rs.getString("stream_id"),
                rs.getString("stream_type"),
                rs.getLong("snapshot_version"),
                json.readObject(rs.getString("snapshot_data")),
                rs.getTimestamp("created_at").toInstant()
        );
    }
}
