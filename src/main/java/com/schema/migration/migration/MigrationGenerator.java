package com.schema.migration.migration;

import com.schema.migration.schema.AttributeSpec;
import com.schema.migration.schema.EntitySpec;
import com.schema.migration.schema.RelationSpec;
import com.schema.migration.schema.SchemaRenderer;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a {@link SchemaDiff} into executable {@code define} statements.
 * Attributes come first so every owns clause references a defined attribute,
 * then new entity types, new relation types, and clauses added to existing types.
 */
public final class MigrationGenerator {

    private MigrationGenerator() {
    }

    public static List<String> generate(SchemaDiff diff) {
        List<String> statements = new ArrayList<>();
        for (AttributeSpec attribute : diff.addAttributes()) {
            statements.add("define " + SchemaRenderer.renderAttribute(attribute));
        }
        for (EntitySpec entity : diff.addEntities()) {
            statements.add("define " + SchemaRenderer.renderEntity(entity));
        }
        for (RelationSpec relation : diff.addRelations()) {
            statements.add("define " + SchemaRenderer.renderRelation(relation));
        }
        for (ClauseAddition addition : diff.addOwns()) {
            String clause = addition.kind() == ClauseAddition.Kind.OWNS
                    ? SchemaRenderer.ownsClause(addition.owns())
                    : SchemaRenderer.relatesClause(addition.role());
            statements.add("define " + addition.typeName() + " " + clause + ";");
        }
        return statements;
    }
}
