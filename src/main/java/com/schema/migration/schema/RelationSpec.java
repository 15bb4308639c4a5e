package com.schema.migration.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A relation type definition.
 *
 * @param name     relation label
 * @param parent   supertype label, null for a root type
 * @param isAbstract whether the type is {@code @abstract}
 * @param relates  roles, in declaration order
 * @param owns     owned attributes, in declaration order
 */
public record RelationSpec(String name, String parent, boolean isAbstract,
                           List<RoleSpec> relates, List<OwnsSpec> owns) {

    public RelationSpec {
        TypeQlSyntax.requireLabel(name, "relation");
        if (parent != null) {
            TypeQlSyntax.requireLabel(parent, "relation supertype");
        }
        relates = List.copyOf(relates);
        owns = List.copyOf(owns);
        Set<String> roles = new HashSet<>();
        for (RoleSpec role : relates) {
            if (!roles.add(role.role())) {
                throw new InvalidSchemaException("Relation '" + name + "' relates '" + role.role() + "' more than once");
            }
        }
        EntitySpec.requireDistinctOwns(name, owns);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<RoleSpec> role(String role) {
        return relates.stream().filter(r -> r.role().equals(role)).findFirst();
    }

    public Optional<OwnsSpec> ownsClause(String attribute) {
        return owns.stream().filter(o -> o.attribute().equals(attribute)).findFirst();
    }

    public RelationSpec withOwns(OwnsSpec clause) {
        return new RelationSpec(name, parent, isAbstract, relates, EntitySpec.replaceOwns(owns, clause));
    }

    /**
     * Returns a copy with the role added, replacing a role of the same name.
     */
    public RelationSpec withRole(RoleSpec roleSpec) {
        List<RoleSpec> roles = new ArrayList<>(relates.size() + 1);
        boolean replaced = false;
        for (RoleSpec existing : relates) {
            if (existing.role().equals(roleSpec.role())) {
                roles.add(roleSpec);
                replaced = true;
            } else {
                roles.add(existing);
            }
        }
        if (!replaced) {
            roles.add(roleSpec);
        }
        return new RelationSpec(name, parent, isAbstract, roles, owns);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RelationSpec other)) return false;
        return isAbstract == other.isAbstract
                && name.equals(other.name)
                && Objects.equals(parent, other.parent)
                && new HashSet<>(relates).equals(new HashSet<>(other.relates))
                && new HashSet<>(owns).equals(new HashSet<>(other.owns));
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parent, isAbstract, new HashSet<>(relates), new HashSet<>(owns));
    }

    /**
     * Fluent builder for {@link RelationSpec}.
     */
    public static final class Builder {
        private final String name;
        private String parent;
        private boolean isAbstract;
        private final List<RoleSpec> relates = new ArrayList<>();
        private final List<OwnsSpec> owns = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder sub(String parent) {
            this.parent = parent;
            return this;
        }

        public Builder abstractType() {
            this.isAbstract = true;
            return this;
        }

        public Builder relates(String role) {
            return relates(RoleSpec.of(role));
        }

        public Builder relates(String role, String cardinality) {
            return relates(RoleSpec.of(role, cardinality));
        }

        public Builder relates(RoleSpec role) {
            relates.add(role);
            return this;
        }

        public Builder owns(String attribute) {
            return owns(OwnsSpec.of(attribute));
        }

        public Builder owns(OwnsSpec clause) {
            owns.add(clause);
            return this;
        }

        public RelationSpec build() {
            return new RelationSpec(name, parent, isAbstract, relates, owns);
        }
    }
}
