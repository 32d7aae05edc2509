package com.goormthonuniv.trialguard.boundary;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.goormthonuniv.trialguard.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * "Get with default" access to a JSON object that still refuses wrong types.
 *
 * <p>An absent or {@code null} field yields the documented default. A present field of the
 * wrong JSON type is recorded as an error against its dotted path and also yields the default,
 * so one pass reports every problem. Views created with {@link #child(String)} share the error
 * list of their parent; call {@link #throwIfInvalid(String)} on any of them at the end.</p>
 */
public final class JsonFieldReader {

    private final JsonNode node;
    private final String path;
    private final List<String> errors;

    private JsonFieldReader(JsonNode node, String path, List<String> errors) {
        this.node = node == null ? MissingNode.getInstance() : node;
        this.path = path;
        this.errors = errors;
    }

    public static JsonFieldReader root(JsonNode node) {
        return new JsonFieldReader(node, "", new ArrayList<>());
    }

    public static JsonFieldReader root(JsonNode node, String path) {
        return new JsonFieldReader(node, path, new ArrayList<>());
    }

    /** Nested object view. Absent → empty view; present but not an object → error + empty view. */
    public JsonFieldReader child(String field) {
        JsonNode v = value(field);
        if (v != null && !v.isObject()) {
            reject(field, "an object", v);
            v = null;
        }
        return new JsonFieldReader(v, pathOf(field), errors);
    }

    public boolean has(String field) {
        return value(field) != null;
    }

    public String text(String field) {
        JsonNode v = value(field);
        if (v == null) return null;
        if (!v.isTextual()) {
            reject(field, "a string", v);
            return null;
        }
        return v.asText();
    }

    public Integer integer(String field) {
        JsonNode v = value(field);
        if (v == null) return null;
        if (v.isIntegralNumber() && v.canConvertToInt()) return v.intValue();
        if (v.isFloatingPointNumber() && v.canConvertToInt() && v.doubleValue() == Math.rint(v.doubleValue())) {
            return v.intValue();
        }
        reject(field, "an integer", v);
        return null;
    }

    public int integer(String field, int defaultValue) {
        Integer v = integer(field);
        return v == null ? defaultValue : v;
    }

    public Double decimal(String field) {
        JsonNode v = value(field);
        if (v == null) return null;
        if (!v.isNumber()) {
            reject(field, "a number", v);
            return null;
        }
        return v.doubleValue();
    }

    public double decimal(String field, double defaultValue) {
        Double v = decimal(field);
        return v == null ? defaultValue : v;
    }

    public boolean flag(String field, boolean defaultValue) {
        JsonNode v = value(field);
        if (v == null) return defaultValue;
        if (!v.isBoolean()) {
            reject(field, "a boolean", v);
            return defaultValue;
        }
        return v.booleanValue();
    }

    /** Array of strings. A bare string is accepted as a single-element list. */
    public List<String> textList(String field) {
        JsonNode v = value(field);
        if (v == null) return List.of();
        if (v.isTextual()) return List.of(v.asText());
        if (!v.isArray()) {
            reject(field, "an array of strings", v);
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (int i = 0; i < v.size(); i++) {
            JsonNode item = v.get(i);
            if (item.isTextual()) {
                out.add(item.asText());
            } else if (!item.isNull()) {
                errors.add(pathOf(field) + "[" + i + "]: expected a string but was " + item.getNodeType().name().toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }

    /** Array elements as views; non-array values are an error. */
    public List<JsonFieldReader> children(String field) {
        JsonNode v = value(field);
        if (v == null) return List.of();
        if (!v.isArray()) {
            reject(field, "an array", v);
            return List.of();
        }
        List<JsonFieldReader> out = new ArrayList<>();
        for (int i = 0; i < v.size(); i++) {
            out.add(new JsonFieldReader(v.get(i), pathOf(field) + "[" + i + "]", errors));
        }
        return out;
    }

    /** Closed value set. Unknown strings are errors, absent values are null. */
    public <E> E enumValue(String field, Function<String, Optional<E>> parser) {
        String raw = text(field);
        if (raw == null || raw.isBlank()) return null;
        Optional<E> parsed = parser.apply(raw);
        if (parsed.isEmpty()) {
            errors.add(pathOf(field) + ": unknown value '" + raw + "'");
            return null;
        }
        return parsed.get();
    }

    public JsonNode node() {
        return node;
    }

    public String path() {
        return path;
    }

    public boolean isObject() {
        return node.isObject();
    }

    public void addError(String message) {
        errors.add((path.isEmpty() ? "" : path + ": ") + message);
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    public void throwIfInvalid(String subject) {
        if (!errors.isEmpty()) {
            throw new InvalidInputException(subject, errors);
        }
    }

    // ===================== helpers =====================

    private JsonNode value(String field) {
        JsonNode v = node.get(field);
        return (v == null || v.isNull() || v.isMissingNode()) ? null : v;
    }

    private void reject(String field, String expected, JsonNode actual) {
        errors.add(pathOf(field) + ": expected " + expected + " but was " + actual.getNodeType().name().toLowerCase(Locale.ROOT));
    }

    private String pathOf(String field) {
        return path.isEmpty() ? field : path + "." + field;
    }
}
