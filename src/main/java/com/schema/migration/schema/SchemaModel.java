package com.schema.migration.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Immutable structural description of a schema: attribute, entity and relation types.
 *
 * <p>Models are created through {@link #builder()}, which validates labels, rejects
 * duplicate definitions and owns clauses that reference undefined attributes. Subtypes
 * are ordered after their supertypes so definitions can be emitted in model order.
 * Equality is structural and ignores declaration order.</p>
 */
public final class SchemaModel {

    private static final SchemaModel EMPTY = new SchemaModel(Map.of(), Map.of(), Map.of());

    private final Map<String, AttributeSpec> attributes;
    private final Map<String, EntitySpec> entities;
    private final Map<String, RelationSpec> relations;

    private SchemaModel(Map<String, AttributeSpec> attributes,
                        Map<String, EntitySpec> entities,
                        Map<String, RelationSpec> relations) {
        this.attributes = Collections.unmodifiableMap(attributes);
        this.entities = Collections.unmodifiableMap(entities);
        this.relations = Collections.unmodifiableMap(relations);
    }

    public static SchemaModel empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this model's definitions.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.attributes.putAll(attributes);
        builder.entities.putAll(entities);
        builder.relations.putAll(relations);
        return builder;
    }

    public List<AttributeSpec> attributes() {
        return List.copyOf(attributes.values());
    }

    public List<EntitySpec> entities() {
        return List.copyOf(entities.values());
    }

    public List<RelationSpec> relations() {
        return List.copyOf(relations.values());
    }

    public Optional<AttributeSpec> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Optional<EntitySpec> entity(String name) {
        return Optional.ofNullable(entities.get(name));
    }

    public Optional<RelationSpec> relation(String name) {
        return Optional.ofNullable(relations.get(name));
    }

    /**
     * Names of all entity and relation types.
     */
    public Set<String> typeNames() {
        Set<String> names = new LinkedHashSet<>(entities.keySet());
        names.addAll(relations.keySet());
        return names;
    }

    public boolean isEmpty() {
        return attributes.isEmpty() && entities.isEmpty() && relations.isEmpty();
    }

    /**
     * Returns a copy without the given types and attributes. Unknown names are ignored.
     */
    public SchemaModel without(Collection<String> names) {
        Set<String> excluded = new HashSet<>(names);
        Map<String, AttributeSpec> attrs = new LinkedHashMap<>(attributes);
        Map<String, EntitySpec> ents = new LinkedHashMap<>(entities);
        Map<String, RelationSpec> rels = new LinkedHashMap<>(relations);
        attrs.keySet().removeAll(excluded);
        ents.keySet().removeAll(excluded);
        rels.keySet().removeAll(excluded);
        return new SchemaModel(attrs, ents, rels);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaModel other)) return false;
        return attributes.equals(other.attributes)
                && entities.equals(other.entities)
                && relations.equals(other.relations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, entities, relations);
    }

    @Override
    public String toString() {
        return "SchemaModel{attributes=" + attributes.keySet()
                + ", entities=" + entities.keySet()
                + ", relations=" + relations.keySet() + "}";
    }

    /**
     * Collects definitions and validates them in {@link #build()}.
     *
     * <p>Usage:</p>
     * <pre>
     * SchemaModel model = SchemaModel.builder()
     *     .attribute("email", ValueType.STRING)
     *     .entity(EntitySpec.builder("person").ownsKey("email").build())
     *     .build();
     * </pre>
     */
    public static final class Builder {
        private final Map<String, AttributeSpec> attributes = new LinkedHashMap<>();
        private final Map<String, EntitySpec> entities = new LinkedHashMap<>();
        private final Map<String, RelationSpec> relations = new LinkedHashMap<>();
        private final Set<String> duplicates = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder attribute(String name, ValueType valueType) {
            return attribute(AttributeSpec.of(name, valueType));
        }

        public Builder attribute(AttributeSpec spec) {
            if (isDefined(spec.name())) {
                duplicates.add(spec.name());
            } else {
                attributes.put(spec.name(), spec);
            }
            return this;
        }

        public Builder entity(EntitySpec spec) {
            if (isDefined(spec.name())) {
                duplicates.add(spec.name());
            } else {
                entities.put(spec.name(), spec);
            }
            return this;
        }

        public Builder relation(RelationSpec spec) {
            if (isDefined(spec.name())) {
                duplicates.add(spec.name());
            } else {
                relations.put(spec.name(), spec);
            }
            return this;
        }

        public boolean isDefined(String name) {
            return attributes.containsKey(name) || entities.containsKey(name) || relations.containsKey(name);
        }

        /**
         * Adds an attribute with {@code define} semantics: redefining an identical
         * attribute is a no-op.
         */
        Builder defineAttribute(AttributeSpec spec) {
            AttributeSpec existing = attributes.get(spec.name());
            if (existing == null) {
                requireUndefined(spec.name(), "attribute");
                attributes.put(spec.name(), spec);
            } else if (existing.valueType() != spec.valueType()) {
                throw new InvalidSchemaException("Attribute '" + spec.name() + "' is already defined with value "
                        + existing.valueType() + ", cannot redefine as " + spec.valueType());
            }
            return this;
        }

        /**
         * Adds an entity with {@code define} semantics: an existing definition is extended
         * with the new owns clauses and modifiers.
         */
        Builder defineEntity(EntitySpec spec) {
            EntitySpec existing = entities.get(spec.name());
            if (existing == null) {
                requireUndefined(spec.name(), "entity");
                entities.put(spec.name(), spec);
                return this;
            }
            EntitySpec merged = new EntitySpec(spec.name(),
                    mergeParent(spec.name(), existing.parent(), spec.parent()),
                    existing.isAbstract() || spec.isAbstract(),
                    existing.owns());
            for (OwnsSpec clause : spec.owns()) {
                merged = merged.withOwns(clause);
            }
            entities.put(spec.name(), merged);
            return this;
        }

        Builder defineRelation(RelationSpec spec) {
            RelationSpec existing = relations.get(spec.name());
            if (existing == null) {
                requireUndefined(spec.name(), "relation");
                relations.put(spec.name(), spec);
                return this;
            }
            RelationSpec merged = new RelationSpec(spec.name(),
                    mergeParent(spec.name(), existing.parent(), spec.parent()),
                    existing.isAbstract() || spec.isAbstract(),
                    existing.relates(),
                    existing.owns());
            for (RoleSpec role : spec.relates()) {
                merged = merged.withRole(role);
            }
            for (OwnsSpec clause : spec.owns()) {
                merged = merged.withOwns(clause);
            }
            relations.put(spec.name(), merged);
            return this;
        }

        /**
         * Adds an owns clause to an already defined entity or relation type.
         */
        Builder addOwns(String typeName, OwnsSpec clause) {
            EntitySpec entity = entities.get(typeName);
            if (entity != null) {
                entities.put(typeName, entity.withOwns(clause));
                return this;
            }
            RelationSpec relation = relations.get(typeName);
            if (relation != null) {
                relations.put(typeName, relation.withOwns(clause));
                return this;
            }
            throw new InvalidSchemaException("Cannot add owns '" + clause.attribute() + "' to undefined type '" + typeName + "'");
        }

        Builder addRelates(String relationName, RoleSpec role) {
            RelationSpec relation = relations.get(relationName);
            if (relation == null) {
                throw new InvalidSchemaException("Cannot add role '" + role.role() + "' to undefined relation '" + relationName + "'");
            }
            relations.put(relationName, relation.withRole(role));
            return this;
        }

        /**
         * Validates and builds the model.
         *
         * @throws InvalidSchemaException on duplicate definitions, owns clauses referencing
         *                                undefined attributes, or unknown or cyclic supertypes
         */
        public SchemaModel build() {
            if (!duplicates.isEmpty()) {
                throw new InvalidSchemaException("Duplicate type definitions: " + String.join(", ", duplicates));
            }
            for (EntitySpec entity : entities.values()) {
                requireAttributes(entity.name(), entity.owns());
                requireParent(entity.name(), entity.parent(), entities.keySet(), "entity");
            }
            for (RelationSpec relation : relations.values()) {
                requireAttributes(relation.name(), relation.owns());
                requireParent(relation.name(), relation.parent(), relations.keySet(), "relation");
            }
            return new SchemaModel(
                    new LinkedHashMap<>(attributes),
                    parentsFirst(entities, EntitySpec::parent),
                    parentsFirst(relations, RelationSpec::parent));
        }

        private void requireUndefined(String name, String kind) {
            if (isDefined(name)) {
                throw new InvalidSchemaException("Cannot define " + kind + " '" + name + "': label already used by another type");
            }
        }

        private static String mergeParent(String name, String existing, String incoming) {
            if (existing == null) {
                return incoming;
            }
            if (incoming != null && !incoming.equals(existing)) {
                throw new InvalidSchemaException("Type '" + name + "' already subtypes '" + existing
                        + "', cannot change supertype to '" + incoming + "'");
            }
            return existing;
        }

        private void requireAttributes(String typeName, List<OwnsSpec> owns) {
            for (OwnsSpec clause : owns) {
                if (!attributes.containsKey(clause.attribute())) {
                    throw new InvalidSchemaException("Type '" + typeName + "' owns undefined attribute '"
                            + clause.attribute() + "'");
                }
            }
        }

        private static void requireParent(String typeName, String parent, Set<String> sameKind, String kind) {
            if (parent != null && !sameKind.contains(parent)) {
                throw new InvalidSchemaException("Type '" + typeName + "' subtypes undefined " + kind + " '" + parent + "'");
            }
        }

        private static <T> Map<String, T> parentsFirst(Map<String, T> specs, Function<T, String> parentOf) {
            Map<String, T> ordered = new LinkedHashMap<>();
            Set<String> visiting = new HashSet<>();
            for (String name : specs.keySet()) {
                visit(name, specs, parentOf, ordered, visiting);
            }
            return ordered;
        }

        private static <T> void visit(String name, Map<String, T> specs, Function<T, String> parentOf,
                                      Map<String, T> ordered, Set<String> visiting) {
            if (ordered.containsKey(name)) {
                return;
            }
            if (!visiting.add(name)) {
                throw new InvalidSchemaException("Cyclic type hierarchy involving '" + name + "'");
            }
            T spec = specs.get(name);
            String parent = parentOf.apply(spec);
            if (parent != null) {
                visit(parent, specs, parentOf, ordered, visiting);
            }
            visiting.remove(name);
            ordered.put(name, spec);
        }
    }
}
