package com.schema.migration.migration;

import com.schema.migration.schema.OwnsSpec;
import com.schema.migration.schema.RoleSpec;

/**
 * A clause added to a type that already exists in the store.
 * Exactly one of {@code owns} and {@code role} is set, matching {@code kind}.
 */
public record ClauseAddition(String typeName, Kind kind, OwnsSpec owns, RoleSpec role) {

    public enum Kind { OWNS, RELATES }

    public static ClauseAddition owns(String typeName, OwnsSpec owns) {
        return new ClauseAddition(typeName, Kind.OWNS, owns, null);
    }

    public static ClauseAddition relates(String relationName, RoleSpec role) {
        return new ClauseAddition(relationName, Kind.RELATES, null, role);
    }
}
