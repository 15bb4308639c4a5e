package com.schema.migration.schema;

/**
 * Thrown when a {@link SchemaModel} fails validation or schema text cannot be parsed.
 */
public class InvalidSchemaException extends IllegalArgumentException {

    public InvalidSchemaException(String message) {
        super(message);
    }

    public InvalidSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
