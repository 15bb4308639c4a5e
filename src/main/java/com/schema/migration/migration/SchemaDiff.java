package com.schema.migration.migration;

import com.schema.migration.schema.AttributeSpec;
import com.schema.migration.schema.EntitySpec;
import com.schema.migration.schema.RelationSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Additive changes needed to bring a current schema to a desired one, plus the types
 * present only in the current schema. Removals are informational: they are never
 * turned into statements.
 *
 * @see SchemaDiffer
 */
public final class SchemaDiff {

    public static final String UP_TO_DATE = "schema is up to date";

    private final List<AttributeSpec> addAttributes;
    private final List<EntitySpec> addEntities;
    private final List<RelationSpec> addRelations;
    private final List<ClauseAddition> addOwns;
    private final List<String> removeTypes;

    SchemaDiff(List<AttributeSpec> addAttributes,
               List<EntitySpec> addEntities,
               List<RelationSpec> addRelations,
               List<ClauseAddition> addOwns,
               List<String> removeTypes) {
        this.addAttributes = List.copyOf(addAttributes);
        this.addEntities = List.copyOf(addEntities);
        this.addRelations = List.copyOf(addRelations);
        this.addOwns = List.copyOf(addOwns);
        this.removeTypes = List.copyOf(removeTypes);
    }

    public List<AttributeSpec> addAttributes() {
        return addAttributes;
    }

    public List<EntitySpec> addEntities() {
        return addEntities;
    }

    public List<RelationSpec> addRelations() {
        return addRelations;
    }

    /**
     * Owns and relates clauses added to types that already exist.
     */
    public List<ClauseAddition> addOwns() {
        return addOwns;
    }

    public List<String> removeTypes() {
        return removeTypes;
    }

    /**
     * True iff there is nothing to add and nothing reported as removed.
     */
    public boolean isEmpty() {
        return addAttributes.isEmpty()
                && addEntities.isEmpty()
                && addRelations.isEmpty()
                && addOwns.isEmpty()
                && removeTypes.isEmpty();
    }

    /**
     * True if the diff contains additions, i.e. {@link #generateMigration()} is non-empty.
     */
    public boolean hasAdditions() {
        return !addAttributes.isEmpty() || !addEntities.isEmpty() || !addRelations.isEmpty() || !addOwns.isEmpty();
    }

    public boolean hasBreakingChanges() {
        return !removeTypes.isEmpty();
    }

    /**
     * Human-readable descriptions of structure present in the store but absent from the
     * desired schema. These changes are never applied automatically.
     */
    public List<String> breakingChanges() {
        List<String> changes = new ArrayList<>(removeTypes.size());
        for (String type : removeTypes) {
            changes.add("type '" + type + "' exists in the database but not in the desired schema");
        }
        return changes;
    }

    /**
     * Summary such as {@code add 2 attribute(s): email, age; add 1 entity type(s)}.
     * Each removed type adds a {@code WARNING:} part.
     */
    public String summary() {
        if (isEmpty()) {
            return UP_TO_DATE;
        }
        List<String> parts = new ArrayList<>();
        if (!addAttributes.isEmpty()) {
            parts.add("add " + addAttributes.size() + " attribute(s): "
                    + addAttributes.stream().map(AttributeSpec::name).collect(Collectors.joining(", ")));
        }
        if (!addEntities.isEmpty()) {
            parts.add("add " + addEntities.size() + " entity type(s)");
        }
        if (!addRelations.isEmpty()) {
            parts.add("add " + addRelations.size() + " relation type(s)");
        }
        long owns = addOwns.stream().filter(a -> a.kind() == ClauseAddition.Kind.OWNS).count();
        long relates = addOwns.size() - owns;
        if (owns > 0) {
            parts.add("add " + owns + " owns clause(s)");
        }
        if (relates > 0) {
            parts.add("add " + relates + " relates clause(s)");
        }
        for (String type : removeTypes) {
            parts.add("WARNING: type " + type + " in DB not in desired schema");
        }
        return String.join("; ", parts);
    }

    /**
     * The statements applying this diff, in dependency order.
     *
     * @see MigrationGenerator#generate(SchemaDiff)
     */
    public List<String> generateMigration() {
        return MigrationGenerator.generate(this);
    }

    @Override
    public String toString() {
        return "SchemaDiff{" + summary() + "}";
    }
}
