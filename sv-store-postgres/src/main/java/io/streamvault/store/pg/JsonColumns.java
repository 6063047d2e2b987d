package io.streamvault.store.pg;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.error.StorageFailureException;

import java.util.Map;
import java.util.Objects;

/** Reads and writes the {@code jsonb} columns. */
final class JsonColumns {
    private static final TypeReference<Map<String, Object>> OBJECT = new TypeReference<>() {};

    private final ObjectMapper json;

    JsonColumns(ObjectMapper json) {
        this.json = Objects.requireNonNull(json);
    }

    String write(Object value) {
        try {
            return json.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not serializable to JSON: " + e.getOriginalMessage(), e);
        }
    }

    Map<String, Object> readObject(String column) {
        if (column == null) return Map.of();
        try {
            return json.readValue(column, OBJECT);
        } catch (JsonProcessingException e) {
            throw new StorageFailureException("stored JSON could not be read", e);
        }
    }
}
