package com.schema.migration.schema;

/**
 * Turns the schema definition text returned by the store into a {@link SchemaModel}.
 */
@FunctionalInterface
public interface SchemaIntrospector {

    /**
     * @param schemaText TypeQL {@code define} text; blank text yields an empty model
     * @throws InvalidSchemaException if the text cannot be parsed
     */
    SchemaModel introspect(String schemaText);
}
