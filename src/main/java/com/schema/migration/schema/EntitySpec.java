package com.schema.migration.schema;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An entity type definition.
 *
 * @param name     entity label
 * @param parent   supertype label, null for a root type
 * @param isAbstract whether the type is {@code @abstract}
 * @param owns     owned attributes, in declaration order
 */
public record EntitySpec(String name, String parent, boolean isAbstract, List<OwnsSpec> owns) {

    public EntitySpec {
        TypeQlSyntax.requireLabel(name, "entity");
        if (parent != null) {
            TypeQlSyntax.requireLabel(parent, "entity supertype");
        }
        owns = List.copyOf(owns);
        requireDistinctOwns(name, owns);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<OwnsSpec> ownsClause(String attribute) {
        return owns.stream().filter(o -> o.attribute().equals(attribute)).findFirst();
    }

    /**
     * Returns a copy with the owns clause added, replacing a clause for the same attribute.
     */
    public EntitySpec withOwns(OwnsSpec clause) {
        return new EntitySpec(name, parent, isAbstract, replaceOwns(owns, clause));
    }

    // owns clauses compare as a set
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntitySpec other)) return false;
        return isAbstract == other.isAbstract
                && name.equals(other.name)
                && Objects.equals(parent, other.parent)
                && new HashSet<>(owns).equals(new HashSet<>(other.owns));
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parent, isAbstract, new HashSet<>(owns));
    }

    static void requireDistinctOwns(String typeName, List<OwnsSpec> owns) {
        Set<String> seen = new HashSet<>();
        for (OwnsSpec clause : owns) {
            if (!seen.add(clause.attribute())) {
                throw new InvalidSchemaException("Type '" + typeName + "' owns '" + clause.attribute() + "' more than once");
            }
        }
    }

    static List<OwnsSpec> replaceOwns(List<OwnsSpec> owns, OwnsSpec clause) {
        List<OwnsSpec> result = new ArrayList<>(owns.size() + 1);
        boolean replaced = false;
        for (OwnsSpec existing : owns) {
            if (existing.attribute().equals(clause.attribute())) {
                result.add(clause);
                replaced = true;
            } else {
                result.add(existing);
            }
        }
        if (!replaced) {
            result.add(clause);
        }
        return result;
    }

    /**
     * Fluent builder for {@link EntitySpec}.
     */
    public static final class Builder {
        private final String name;
        private String parent;
        private boolean isAbstract;
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

        public Builder owns(String attribute) {
            return owns(OwnsSpec.of(attribute));
        }

        public Builder ownsKey(String attribute) {
            return owns(OwnsSpec.key(attribute));
        }

        public Builder owns(OwnsSpec clause) {
            owns.add(clause);
            return this;
        }

        public EntitySpec build() {
            return new EntitySpec(name, parent, isAbstract, owns);
        }
    }
}
