package com.schema.migration.schema;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * TypeQL label and cardinality validation plus literal formatting.
 */
public final class TypeQlSyntax {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");
    private static final Pattern CARDINALITY = Pattern.compile("(\\d+)\\.\\.(\\d*)");

    private static final DateTimeFormatter DATETIME =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);

    private static final Set<String> RESERVED = Set.of(
            "define", "undefine", "redefine",
            "match", "fetch", "insert", "delete", "update", "put",
            "select", "require", "sort", "limit", "offset", "reduce", "with",
            "or", "not", "try",
            "entity", "relation", "attribute", "struct", "fun",
            "sub", "relates", "plays", "value", "owns", "alias",
            "isa", "links", "has", "is", "let", "contains", "like",
            "label", "iid",
            "card", "cascade", "independent", "abstract", "key", "subkey", "unique", "values",
            "range", "regex", "distinct",
            "check", "first", "count", "max", "min", "mean", "median", "std", "sum", "list",
            "boolean", "integer", "double", "decimal", "datetime-tz", "datetime_tz", "datetime",
            "date", "duration", "string",
            "round", "ceil", "floor", "abs", "length",
            "true", "false",
            "asc", "desc", "return", "of", "from", "in", "as"
    );

    private TypeQlSyntax() {
    }

    public static boolean isReserved(String name) {
        return RESERVED.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Checks that a name is a usable TypeQL label.
     *
     * @param what description used in the error message, e.g. "attribute"
     * @throws InvalidSchemaException if the name is blank, malformed or reserved
     */
    public static String requireLabel(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new InvalidSchemaException(what + " name must not be empty");
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new InvalidSchemaException("Invalid " + what + " name '" + name + "'");
        }
        if (isReserved(name)) {
            throw new InvalidSchemaException(what + " name '" + name + "' is a reserved TypeQL keyword");
        }
        return name;
    }

    /**
     * Validates a cardinality of the form {@code min..max} or {@code min..}.
     *
     * @return the cardinality, or null when none is given
     */
    public static String requireCardinality(String cardinality) {
        if (cardinality == null || cardinality.isBlank()) {
            return null;
        }
        String trimmed = cardinality.strip();
        Matcher matcher = CARDINALITY.matcher(trimmed);
        if (!matcher.matches()) {
            throw new InvalidSchemaException("Invalid cardinality '" + cardinality + "', expected min..max or min..");
        }
        if (!matcher.group(2).isEmpty()
                && Long.parseLong(matcher.group(2)) < Long.parseLong(matcher.group(1))) {
            throw new InvalidSchemaException("Invalid cardinality '" + cardinality + "': max is lower than min");
        }
        return trimmed;
    }

    /**
     * Escapes text for use inside a double-quoted TypeQL string literal.
     */
    public static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Formats an instant as a TypeQL {@code datetime} literal in UTC, e.g. {@code 2024-05-01T12:30:00}.
     */
    public static String datetime(Instant instant) {
        return DATETIME.format(instant);
    }
}
