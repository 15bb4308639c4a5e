package com.schema.migration.schema;

import java.util.Objects;

/**
 * An attribute type definition.
 *
 * @param name      attribute label
 * @param valueType type of the attribute's values
 */
public record AttributeSpec(String name, ValueType valueType) {

    public AttributeSpec {
        TypeQlSyntax.requireLabel(name, "attribute");
        Objects.requireNonNull(valueType, "valueType");
    }

    public static AttributeSpec of(String name, ValueType valueType) {
        return new AttributeSpec(name, valueType);
    }
}
