package io.streamvault.app;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventTypeRegistration;
import io.streamvault.store.SchemaRegistry;
import io.streamvault.store.schema.PayloadSchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/** Registers the payload schemas shipped in {@code schemas/event-types.json}. */
public final class BuiltinSchemas {
    private static final Logger log = LoggerFactory.getLogger(BuiltinSchemas.class);

    static final String LOCATION = "schemas/event-types.json";

    private BuiltinSchemas() {}

    public static List<EventTypeRegistration> load(ObjectMapper json) {
        try (var in = new ClassPathResource(LOCATION).getInputStream()) {
            return json.readValue(in, new TypeReference<List<EventTypeRegistration>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("could not read " + LOCATION, e);
        }
    }

    /** Registers every built-in schema the registry does not know yet; operator edits survive restarts. */
    public static int registerMissing(SchemaRegistry registry, ObjectMapper json) {
        int added = 0;
        for (var registration : load(json)) {
            if (registry.lookup(registration.eventType()).isEmpty()) {
                var unsupported = PayloadSchemaValidator.unsupportedKeywords(registration.jsonSchema());
                if (!unsupported.isEmpty()) {
                    log.warn("Schema for {} uses {}, which appends do not enforce", registration.eventType(), unsupported);
                }
                registry.register(registration);
                added++;
            }
        }
        log.info("Registered {} built-in event type schema(s)", added);
        return added;
    }
}
