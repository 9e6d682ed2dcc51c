package com.firesql.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * A dynamically-typed document value tagged with its {@link ValueKind}.
 *
 * All loose conversions used by query evaluation live here:
 * <ul>
 *   <li>{@link #asText()} renders the value the way string columns, group keys
 *       and equality filters see it</li>
 *   <li>{@link #looselyEquals(Object)} compares two values through their text
 *       rendering, so {@code 7} matches {@code "7"} but {@code 7.0} does not</li>
 *   <li>{@link #toDouble()} is the float coercion used by aggregates and sorting</li>
 * </ul>
 */
public final class FieldValue {

    public static final FieldValue NULL = new FieldValue(ValueKind.NULL, null);

    private static final Pattern DECIMAL =
        Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final ObjectMapper JSON = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final ValueKind kind;
    private final Object raw;

    private FieldValue(ValueKind kind, Object raw) {
        this.kind = kind;
        this.raw = raw;
    }

    /**
     * Wrap a raw value as produced by the document store or the delegated executor.
     * Integral numbers widen to {@code Long}, floating point to {@code Double},
     * {@link Date} to {@link Instant}. Unknown types are kept as strings.
     */
    public static FieldValue of(Object raw) {
        if (raw == null) {
            return NULL;
        }
        if (raw instanceof FieldValue) {
            return (FieldValue) raw;
        }
        if (raw instanceof Boolean) {
            return new FieldValue(ValueKind.BOOL, raw);
        }
        if (raw instanceof Long || raw instanceof Integer || raw instanceof Short
                || raw instanceof Byte || raw instanceof BigInteger) {
            return new FieldValue(ValueKind.INT64, ((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
            return new FieldValue(ValueKind.FLOAT64, ((Number) raw).doubleValue());
        }
        if (raw instanceof String) {
            return new FieldValue(ValueKind.STRING, raw);
        }
        if (raw instanceof Instant) {
            return new FieldValue(ValueKind.TIMESTAMP, raw);
        }
        if (raw instanceof Date) {
            return new FieldValue(ValueKind.TIMESTAMP, ((Date) raw).toInstant());
        }
        if (raw instanceof Map) {
            return new FieldValue(ValueKind.MAPPING, raw);
        }
        if (raw instanceof List) {
            return new FieldValue(ValueKind.SEQUENCE, raw);
        }
        return new FieldValue(ValueKind.STRING, raw.toString());
    }

    public ValueKind kind() {
        return kind;
    }

    public Object raw() {
        return raw;
    }

    public boolean isNull() {
        return kind == ValueKind.NULL;
    }

    /**
     * Text rendering of the value. Null renders as the empty string, mappings and
     * sequences as JSON, timestamps as ISO-8601, numbers through their Java
     * {@code toString} (so {@code 7L} is "7" and {@code 7.0d} is "7.0").
     */
    public String asText() {
        switch (kind) {
            case NULL:
                return "";
            case MAPPING:
            case SEQUENCE:
                return toJson();
            default:
                return raw.toString();
        }
    }

    /**
     * Equality through text rendering. This tolerates numbers stored as strings
     * and vice versa, at the cost of false matches across types.
     */
    public boolean looselyEquals(Object expected) {
        return asText().equals(FieldValue.of(expected).asText());
    }

    /**
     * Float coercion: integers, floats and base-10 numeric strings convert,
     * everything else (booleans, timestamps, nested values, null) does not.
     */
    public OptionalDouble toDouble() {
        switch (kind) {
            case INT64:
                return OptionalDouble.of(((Long) raw).doubleValue());
            case FLOAT64:
                return OptionalDouble.of((Double) raw);
            case STRING:
                String text = (String) raw;
                if (DECIMAL.matcher(text).matches()) {
                    return OptionalDouble.of(Double.parseDouble(text));
                }
                return OptionalDouble.empty();
            default:
                return OptionalDouble.empty();
        }
    }

    public Optional<Instant> toInstant() {
        if (kind == ValueKind.TIMESTAMP) {
            return Optional.of((Instant) raw);
        }
        return Optional.empty();
    }

    /**
     * Nested mapping view, present only for {@link ValueKind#MAPPING}.
     */
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> asMapping() {
        if (kind == ValueKind.MAPPING) {
            return Optional.of((Map<String, Object>) raw);
        }
        return Optional.empty();
    }

    private String toJson() {
        try {
            return JSON.writeValueAsString(raw);
        } catch (JsonProcessingException e) {
            return raw.toString();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValue)) {
            return false;
        }
        FieldValue other = (FieldValue) o;
        return kind == other.kind && Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, raw);
    }

    @Override
    public String toString() {
        return kind + "(" + asText() + ")";
    }
}
