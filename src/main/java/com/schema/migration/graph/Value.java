package com.schema.migration.graph;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single decoded value returned by the store, tagged with its {@link Kind}.
 * Values are decoded once at the connection boundary so callers never cast raw objects.
 */
public final class Value {

    public enum Kind { NONE, TEXT, INTEGER, DOUBLE, BOOLEAN, TIMESTAMP, LIST }

    private static final Value NONE = new Value(Kind.NONE, null);

    private final Kind kind;
    private final Object raw;
    private final List<Value> items;

    private Value(Kind kind, Object raw) {
        this.kind = kind;
        this.raw = raw;
        this.items = null;
    }

    private Value(List<Value> items) {
        this.kind = Kind.LIST;
        this.raw = items;
        this.items = items;
    }

    public static Value none() {
        return NONE;
    }

    public static Value text(String value) {
        return value == null ? NONE : new Value(Kind.TEXT, value);
    }

    public static Value integer(long value) {
        return new Value(Kind.INTEGER, value);
    }

    public static Value decimal(double value) {
        return new Value(Kind.DOUBLE, value);
    }

    public static Value bool(boolean value) {
        return new Value(Kind.BOOLEAN, value);
    }

    public static Value timestamp(Instant value) {
        return value == null ? NONE : new Value(Kind.TIMESTAMP, value);
    }

    public static Value list(List<Value> values) {
        return values == null ? NONE
                : new Value(Collections.unmodifiableList(new ArrayList<>(values)));
    }

    /**
     * Decodes a plain driver object into a tagged value.
     * Unknown types are kept as their string form.
     */
    public static Value of(Object object) {
        if (object == null) {
            return NONE;
        }
        if (object instanceof Value value) {
            return value;
        }
        if (object instanceof String s) {
            return text(s);
        }
        if (object instanceof Integer || object instanceof Long || object instanceof Short) {
            return integer(((Number) object).longValue());
        }
        if (object instanceof Number n) {
            return decimal(n.doubleValue());
        }
        if (object instanceof Boolean b) {
            return bool(b);
        }
        if (object instanceof Instant i) {
            return timestamp(i);
        }
        if (object instanceof LocalDateTime ldt) {
            return timestamp(ldt.toInstant(ZoneOffset.UTC));
        }
        if (object instanceof List<?> list) {
            List<Value> values = new ArrayList<>(list.size());
            for (Object item : list) {
                values.add(of(item));
            }
            return list(values);
        }
        return text(object.toString());
    }

    public Kind kind() {
        return kind;
    }

    public boolean isNone() {
        return kind == Kind.NONE;
    }

    public String asText() {
        return (String) expect(Kind.TEXT);
    }

    public long asLong() {
        if (kind == Kind.DOUBLE) {
            return ((Double) raw).longValue();
        }
        return (Long) expect(Kind.INTEGER);
    }

    public double asDouble() {
        if (kind == Kind.INTEGER) {
            return ((Long) raw).doubleValue();
        }
        return (Double) expect(Kind.DOUBLE);
    }

    public boolean asBoolean() {
        return (Boolean) expect(Kind.BOOLEAN);
    }

    /**
     * Returns the value as an instant. Text values holding an ISO-8601 instant
     * or a zone-less local date-time (read as UTC) are accepted too.
     */
    public Instant asInstant() {
        if (kind == Kind.TEXT) {
            String text = (String) raw;
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                try {
                    return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
                } catch (DateTimeParseException inner) {
                    throw new IllegalStateException("Value is not a timestamp: " + text, inner);
                }
            }
        }
        return (Instant) expect(Kind.TIMESTAMP);
    }

    public List<Value> asList() {
        expect(Kind.LIST);
        return items;
    }

    private Object expect(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Expected " + expected + " value but was " + kind);
        }
        return raw;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value other)) return false;
        return kind == other.kind && Objects.equals(raw, other.raw);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, raw);
    }

    @Override
    public String toString() {
        return kind == Kind.NONE ? "none" : kind + "(" + raw + ")";
    }
}
