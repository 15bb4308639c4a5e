package com.schema.migration.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code owns} clause of an entity or relation type.
 *
 * @param attribute   the owned attribute type
 * @param key         whether the attribute is a key of the owner ({@code @key})
 * @param unique      whether values are unique across owners ({@code @unique})
 * @param cardinality optional {@code @card} expression such as {@code 0..1}, null if none
 */
public record OwnsSpec(String attribute, boolean key, boolean unique, String cardinality) {

    public OwnsSpec {
        TypeQlSyntax.requireLabel(attribute, "owned attribute");
        cardinality = TypeQlSyntax.requireCardinality(cardinality);
    }

    public static OwnsSpec of(String attribute) {
        return new OwnsSpec(attribute, false, false, null);
    }

    public static OwnsSpec key(String attribute) {
        return new OwnsSpec(attribute, true, false, null);
    }

    public static OwnsSpec unique(String attribute) {
        return new OwnsSpec(attribute, false, true, null);
    }

    public OwnsSpec withCardinality(String card) {
        return new OwnsSpec(attribute, key, unique, card);
    }

    /**
     * Annotation text in TypeQL order, e.g. {@code @key @card(1..1)}; empty if none.
     */
    public String annotations() {
        List<String> parts = new ArrayList<>(3);
        if (key) {
            parts.add("@key");
        }
        if (unique) {
            parts.add("@unique");
        }
        if (cardinality != null) {
            parts.add("@card(" + cardinality + ")");
        }
        return String.join(" ", parts);
    }
}
