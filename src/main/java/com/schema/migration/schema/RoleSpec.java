package com.schema.migration.schema;

/**
 * A {@code relates} clause of a relation type.
 *
 * @param role        role label
 * @param cardinality optional {@code @card} expression, null if none
 */
public record RoleSpec(String role, String cardinality) {

    public RoleSpec {
        TypeQlSyntax.requireLabel(role, "role");
        cardinality = TypeQlSyntax.requireCardinality(cardinality);
    }

    public static RoleSpec of(String role) {
        return new RoleSpec(role, null);
    }

    public static RoleSpec of(String role, String cardinality) {
        return new RoleSpec(role, cardinality);
    }
}
