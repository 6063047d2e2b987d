package io.streamvault.store.pg;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventTypeRegistration;
import io.streamvault.store.SchemaRegistry;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;

/** The {@code event_types} table. Registering a known type replaces its schema. */
public final class PostgresSchemaRegistry implements SchemaRegistry {
    private final JdbcTemplate jdbc;
    private final JsonColumns json;

    public PostgresSchemaRegistry(JdbcTemplate jdbc, ObjectMapper json) {
        this.jdbc = Objects.requireNonNull(jdbc);
        this.json = new JsonColumns(json);
    }

    @Override
    public Optional<EventTypeRegistration> lookup(String eventType) {
        return jdbc.query("SELECT event_type, schema_version, json_schema, description FROM event_types WHERE event_type = ?",
                mapper(), eventType).stream().findFirst();
    }

    @Override
    public void register(EventTypeRegistration r) {
        jdbc.update("""
          INSERT INTO event_types (event_type, schema_version, json_schema, description, created_at)
          VALUES (?, ?, ?::jsonb, ?, now())
          ON CONFLICT (event_type)
          DO UPDATE SET schema_version = EXCLUDED.schema_version,
                        json_schema = EXCLUDED.json_schema,
                        description = EXCLUDED.description
          """, r.eventType(), r.schemaVersion(), json.write(r.jsonSchema()), r.description());
    }

    @Override
    public Collection<EventTypeRegistration> registrations() {
        return jdbc.query("SELECT event_type, schema_version, json_schema, description FROM event_types ORDER BY event_type", mapper());
    }

    private RowMapper<EventTypeRegistration> mapper() {
        return (rs, rn) -> new EventTypeRegistration(
                rs.getString("event_type"),
                rs.getInt("schema_version"),
                json.readObject(rs.getString("json_schema")),
                rs.getString("description"));
    }
}
