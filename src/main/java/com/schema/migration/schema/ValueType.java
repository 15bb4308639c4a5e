package com.schema.migration.schema;

import java.util.Locale;

/**
 * TypeQL attribute value types.
 */
public enum ValueType {
    STRING("string"),
    BOOLEAN("boolean"),
    INTEGER("integer"),
    DOUBLE("double"),
    DECIMAL("decimal"),
    DATE("date"),
    DATETIME("datetime"),
    DATETIME_TZ("datetime-tz"),
    DURATION("duration");

    private final String keyword;

    ValueType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The keyword used in a {@code value} clause.
     */
    public String keyword() {
        return keyword;
    }

    /**
     * Resolves a value type keyword. {@code long} is accepted as an alias of {@code integer}
     * and {@code datetime_tz} of {@code datetime-tz}.
     *
     * @throws InvalidSchemaException if the keyword is not a known value type
     */
    public static ValueType fromKeyword(String keyword) {
        if (keyword == null) {
            throw new InvalidSchemaException("Value type must not be null");
        }
        String normalized = keyword.strip().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "long":
                return INTEGER;
            case "datetime_tz":
                return DATETIME_TZ;
            default:
                for (ValueType type : values()) {
                    if (type.keyword.equals(normalized)) {
                        return type;
                    }
                }
                throw new InvalidSchemaException("Unknown value type: " + keyword);
        }
    }

    @Override
    public String toString() {
        return keyword;
    }
}
