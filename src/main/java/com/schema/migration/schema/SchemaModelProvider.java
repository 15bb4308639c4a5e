package com.schema.migration.schema;

/**
 * Source of the desired schema that migrations converge the store towards.
 * Implementations are passed explicitly to the migrator.
 */
@FunctionalInterface
public interface SchemaModelProvider {

    SchemaModel desiredSchema();

    /**
     * Provider that always returns the given model.
     */
    static SchemaModelProvider of(SchemaModel model) {
        return () -> model;
    }
}
