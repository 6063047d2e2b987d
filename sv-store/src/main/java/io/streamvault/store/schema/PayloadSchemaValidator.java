package io.streamvault.store.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.streamvault.core.EventTypeRegistration;
import io.streamvault.core.error.SchemaValidationException;
import io.streamvault.store.SchemaRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Checks payloads against the JSON schema registered for their event type.
 *
 * Understands the subset of JSON Schema the registry entries use: {@code type} (single or list),
 * {@code required}, {@code properties}, {@code additionalProperties: false}, {@code items},
 * {@code enum}, {@code minimum}, {@code maximum}, {@code minLength}, {@code minItems}.
 * Anything else ({@code $ref}, {@code oneOf}, {@code pattern}, a schema valued
 * {@code additionalProperties}, unknown type names) is not enforced, so a payload that breaks only
 * such a rule is accepted. {@link #unsupportedKeywords} lists them for a schema about to be registered.
 */
public final class PayloadSchemaValidator {

    private static final Set<String> KEYWORDS = Set.of("type", "required", "properties", "additionalProperties",
            "items", "enum", "minimum", "maximum", "minLength", "minItems");
    private static final Set<String> ANNOTATIONS = Set.of("$schema", "$id", "title", "description", "examples");
    private static final Set<String> TYPES = Set.of("object", "array", "string", "number", "integer", "boolean", "null");

    private final SchemaRegistry registry;
    private final ObjectMapper json;

    public PayloadSchemaValidator(SchemaRegistry registry, ObjectMapper json) {
        this.registry = Objects.requireNonNull(registry);
        this.json = Objects.requireNonNull(json);
    }

    /** @throws SchemaValidationException when a schema is registered for the type and the payload breaks it */
    public void validate(String eventType, Map<String, Object> payload) {
        var registration = registry.lookup(eventType);
        if (registration.isEmpty()) return;
        var violations = violations(registration.get(), payload);
        if (!violations.isEmpty()) {
            throw new SchemaValidationException(eventType, violations);
        }
    }

    public List<String> violations(EventTypeRegistration registration, Map<String, Object> payload) {
        var violations = new ArrayList<String>();
        check(json.valueToTree(registration.jsonSchema()), json.valueToTree(payload), "payload", violations);
        return violations;
    }

    /** Keywords and type names in {@code schema} that validation does not enforce, in document order. */
    public static Set<String> unsupportedKeywords(Map<String, Object> schema) {
        var found = new LinkedHashSet<String>();
        collectUnsupported(schema, found);
        return found;
    }

    private static void collectUnsupported(Object node, Set<String> out) {
        if (!(node instanceof Map<?, ?> schema)) return;
        schema.forEach((key, value) -> {
            var keyword = String.valueOf(key);
            switch (keyword) {
                case "properties" -> {
                    if (value instanceof Map<?, ?> properties) {
                        properties.values().forEach(p -> collectUnsupported(p, out));
                    }
                }
                case "items" -> collectUnsupported(value, out);
                case "additionalProperties" -> {
                    if (!(value instanceof Boolean)) out.add("additionalProperties (schema)");
                }
                case "type" -> {
                    var names = value instanceof Collection<?> list ? list : Collections.singletonList(value);
                    for (var name : names) {
                        if (!TYPES.contains(String.valueOf(name))) out.add("type " + name);
                    }
                }
                default -> {
                    if (!KEYWORDS.contains(keyword) && !ANNOTATIONS.contains(keyword)) out.add(keyword);
                }
            }
        });
    }

    private void check(JsonNode schema, JsonNode value, String path, List<String> out) {
        if (schema == null || !schema.isObject()) return;

        var type = schema.get("type");
        if (type != null && !matchesType(type, value)) {
            out.add(path + " must be of type " + describe(type) + " but was " + value.getNodeType().name().toLowerCase());
            return;
        }

        var allowed = schema.get("enum");
        if (allowed != null && allowed.isArray()) {
            boolean found = false;
            for (var option : allowed) {
                if (option.equals(value)) { found = true; break; }
            }
            if (!found) out.add(path + " must be one of " + allowed);
        }

        if (value.isNumber()) {
            var min = schema.get("minimum");
            if (min != null && value.decimalValue().compareTo(min.decimalValue()) < 0) {
                out.add(path + " must be >= " + min.asText());
            }
            var max = schema.get("maximum");
            if (max != null && value.decimalValue().compareTo(max.decimalValue()) > 0) {
                out.add(path + " must be <= " + max.asText());
            }
        }

        if (value.isTextual()) {
            var minLength = schema.get("minLength");
            if (minLength != null && value.asText().length() < minLength.asInt()) {
                out.add(path + " must have at least " + minLength.asInt() + " characters");
            }
        }

        if (value.isArray()) {
            var minItems = schema.get("minItems");
            if (minItems != null && value.size() < minItems.asInt()) {
                out.add(path + " must contain at least " + minItems.asInt() + " items");
            }
            var items = schema.get("items");
            for (int i = 0; items != null && i < value.size(); i++) {
                check(items, value.get(i), path + "[" + i + "]", out);
            }
        }

        if (value.isObject()) {
            var required = schema.get("required");
            if (required != null && required.isArray()) {
                for (var name : required) {
                    var field = value.get(name.asText());
                    if (field == null || field.isNull()) {
                        out.add(path + "." + name.asText() + " is required");
                    }
                }
            }
            var properties = schema.get("properties");
            if (properties != null && properties.isObject()) {
                properties.fields().forEachRemaining(p -> {
                    var field = value.get(p.getKey());
                    if (field != null && !field.isNull()) {
                        check(p.getValue(), field, path + "." + p.getKey(), out);
                    }
                });
            }
            var additional = schema.get("additionalProperties");
            if (additional != null && additional.isBoolean() && !additional.asBoolean()) {
                value.fieldNames().forEachRemaining(name -> {
                    if (properties == null || !properties.has(name)) {
                        out.add(path + "." + name + " is not allowed");
                    }
                });
            }
        }
    }

    private boolean matchesType(JsonNode type, JsonNode value) {
        if (type.isArray()) {
            for (var t : type) {
                if (matchesType(t.asText(), value)) return true;
            }
            return false;
        }
        return matchesType(type.asText(), value);
    }

    private boolean matchesType(String type, JsonNode value) {
        return switch (type) {
            case "object" -> value.isObject();
            case "array" -> value.isArray();
            case "string" -> value.isTextual();
            case "number" -> value.isNumber();
            case "integer" -> value.isIntegralNumber()
                    || (value.isNumber() && value.decimalValue().stripTrailingZeros().scale() <= 0);
            case "boolean" -> value.isBoolean();
            case "null" -> value.isNull();
            default -> true;
        };
    }

    private String describe(JsonNode type) {
        return type.isArray() ? type.toString() : type.asText();
    }
}
