package com.schema.migration.migration;

import com.schema.migration.schema.AttributeSpec;
import com.schema.migration.schema.EntitySpec;
import com.schema.migration.schema.OwnsSpec;
import com.schema.migration.schema.RelationSpec;
import com.schema.migration.schema.RoleSpec;
import com.schema.migration.schema.SchemaModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes the one-directional, additive difference between a desired and a current schema.
 * Pure: neither model is modified and the result depends only on the two inputs.
 */
public final class SchemaDiffer {

    private SchemaDiffer() {
    }

    public static SchemaDiff diff(SchemaModel desired, SchemaModel current) {
        List<AttributeSpec> addAttributes = new ArrayList<>();
        List<EntitySpec> addEntities = new ArrayList<>();
        List<RelationSpec> addRelations = new ArrayList<>();
        List<ClauseAddition> addOwns = new ArrayList<>();
        List<String> removeTypes = new ArrayList<>();

        for (AttributeSpec attribute : desired.attributes()) {
            if (current.attribute(attribute.name()).isEmpty()) {
                addAttributes.add(attribute);
            }
        }

        for (EntitySpec entity : desired.entities()) {
            Optional<EntitySpec> existing = current.entity(entity.name());
            if (existing.isEmpty()) {
                addEntities.add(entity);
                continue;
            }
            addMissingOwns(entity.name(), entity.owns(), existing.get().owns(), addOwns);
        }

        for (RelationSpec relation : desired.relations()) {
            Optional<RelationSpec> existing = current.relation(relation.name());
            if (existing.isEmpty()) {
                addRelations.add(relation);
                continue;
            }
            for (RoleSpec role : relation.relates()) {
                if (existing.get().role(role.role()).isEmpty()) {
                    addOwns.add(ClauseAddition.relates(relation.name(), role));
                }
            }
            addMissingOwns(relation.name(), relation.owns(), existing.get().owns(), addOwns);
        }

        for (String type : current.typeNames()) {
            if (desired.entity(type).isEmpty() && desired.relation(type).isEmpty()) {
                removeTypes.add(type);
            }
        }

        return new SchemaDiff(addAttributes, addEntities, addRelations, addOwns, removeTypes);
    }

    private static void addMissingOwns(String typeName, List<OwnsSpec> desired, List<OwnsSpec> current,
                                       List<ClauseAddition> target) {
        for (OwnsSpec clause : desired) {
            boolean present = current.stream().anyMatch(o -> o.attribute().equals(clause.attribute()));
            if (!present) {
                target.add(ClauseAddition.owns(typeName, clause));
            }
        }
    }
}
