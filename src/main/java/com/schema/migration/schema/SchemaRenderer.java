package com.schema.migration.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders {@link SchemaModel} definitions as TypeQL.
 */
public final class SchemaRenderer {

    private static final String CLAUSE_INDENT = "    ";

    private SchemaRenderer() {
    }

    /**
     * Renders the whole model as one {@code define} block, or an empty string for an empty model.
     */
    public static String render(SchemaModel model) {
        if (model.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("define\n");
        for (AttributeSpec attribute : model.attributes()) {
            sb.append(renderAttribute(attribute)).append('\n');
        }
        for (EntitySpec entity : model.entities()) {
            sb.append(renderEntity(entity)).append('\n');
        }
        for (RelationSpec relation : model.relations()) {
            sb.append(renderRelation(relation)).append('\n');
        }
        return sb.toString();
    }

    /**
     * {@code attribute name, value type;}
     */
    public static String renderAttribute(AttributeSpec attribute) {
        return "attribute " + attribute.name() + ", value " + attribute.valueType().keyword() + ";";
    }

    /**
     * Full entity definition, one clause per line:
     * <pre>
     * entity person @abstract sub agent,
     *     owns email @key,
     *     owns age;
     * </pre>
     */
    public static String renderEntity(EntitySpec entity) {
        List<String> lines = new ArrayList<>();
        lines.add(header("entity", entity.name(), entity.isAbstract(), entity.parent()));
        for (OwnsSpec clause : entity.owns()) {
            lines.add(CLAUSE_INDENT + ownsClause(clause));
        }
        return String.join(",\n", lines) + ";";
    }

    public static String renderRelation(RelationSpec relation) {
        List<String> lines = new ArrayList<>();
        lines.add(header("relation", relation.name(), relation.isAbstract(), relation.parent()));
        for (RoleSpec role : relation.relates()) {
            lines.add(CLAUSE_INDENT + relatesClause(role));
        }
        for (OwnsSpec clause : relation.owns()) {
            lines.add(CLAUSE_INDENT + ownsClause(clause));
        }
        return String.join(",\n", lines) + ";";
    }

    /**
     * {@code owns attribute [@key] [@unique] [@card(..)]}
     */
    public static String ownsClause(OwnsSpec clause) {
        String annotations = clause.annotations();
        return "owns " + clause.attribute() + (annotations.isEmpty() ? "" : " " + annotations);
    }

    /**
     * {@code relates role [@card(..)]}
     */
    public static String relatesClause(RoleSpec role) {
        return "relates " + role.role() + (role.cardinality() == null ? "" : " @card(" + role.cardinality() + ")");
    }

    private static String header(String kind, String name, boolean isAbstract, String parent) {
        StringBuilder sb = new StringBuilder(kind).append(' ').append(name);
        if (isAbstract) {
            sb.append(" @abstract");
        }
        if (parent != null) {
            sb.append(" sub ").append(parent);
        }
        return sb.toString();
    }
}
