package com.schema.migration.schema;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchemaModelTest {

    @Test
    @DisplayName("Should order subtypes after their supertypes")
    void parentsFirst() {
        SchemaModel model = SchemaModel.builder()
                .entity(EntitySpec.builder("employee").sub("person").build())
                .entity(EntitySpec.builder("person").sub("agent").build())
                .entity(EntitySpec.builder("agent").abstractType().build())
                .build();

        assertEquals(List.of("agent", "person", "employee"),
                model.entities().stream().map(EntitySpec::name).toList());
    }

    @Test
    @DisplayName("Should reject duplicate labels across kinds")
    void duplicateLabels() {
        SchemaModel.Builder builder = SchemaModel.builder()
                .attribute("name", ValueType.STRING)
                .entity(EntitySpec.builder("name").build());
        InvalidSchemaException e = assertThrows(InvalidSchemaException.class, builder::build);
        assertTrue(e.getMessage().contains("name"));
    }

    @Test
    @DisplayName("Should reject owns of an undefined attribute")
    void undefinedAttribute() {
        SchemaModel.Builder builder = SchemaModel.builder()
                .entity(EntitySpec.builder("person").owns("email").build());
        assertThrows(InvalidSchemaException.class, builder::build);
    }

    @Test
    @DisplayName("Should reject unknown, cross-kind and cyclic supertypes")
    void invalidSupertypes() {
        assertThrows(InvalidSchemaException.class, () -> SchemaModel.builder()
                .entity(EntitySpec.builder("person").sub("agent").build())
                .build());
        assertThrows(InvalidSchemaException.class, () -> SchemaModel.builder()
                .relation(RelationSpec.builder("membership").relates("member").build())
                .entity(EntitySpec.builder("person").sub("membership").build())
                .build());
        assertThrows(InvalidSchemaException.class, () -> SchemaModel.builder()
                .entity(EntitySpec.builder("a-type").sub("b-type").build())
                .entity(EntitySpec.builder("b-type").sub("a-type").build())
                .build());
    }

    @Test
    @DisplayName("Should reject reserved and malformed labels")
    void invalidLabels() {
        assertThrows(InvalidSchemaException.class, () -> AttributeSpec.of("entity", ValueType.STRING));
        assertThrows(InvalidSchemaException.class, () -> AttributeSpec.of("has space", ValueType.STRING));
        assertThrows(InvalidSchemaException.class, () -> EntitySpec.builder("").build());
        assertThrows(InvalidSchemaException.class, () -> OwnsSpec.of("email").withCardinality("3..1"));
    }

    @Test
    @DisplayName("Should compare structurally, ignoring declaration order")
    void structuralEquality() {
        SchemaModel a = SchemaModel.builder()
                .attribute("email", ValueType.STRING)
                .attribute("age", ValueType.INTEGER)
                .entity(EntitySpec.builder("person").owns("age").ownsKey("email").build())
                .build();
        SchemaModel b = SchemaModel.builder()
                .attribute("age", ValueType.INTEGER)
                .attribute("email", ValueType.STRING)
                .entity(EntitySpec.builder("person").ownsKey("email").owns("age").build())
                .build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    @DisplayName("without() should drop the named types and attributes")
    void without() {
        SchemaModel model = SchemaModel.builder()
                .attribute("email", ValueType.STRING)
                .attribute("migration-hash", ValueType.STRING)
                .entity(EntitySpec.builder("person").owns("email").build())
                .entity(EntitySpec.builder("migration-record").ownsKey("migration-hash").build())
                .build();

        SchemaModel filtered = model.without(Set.of("migration-record", "migration-hash", "unknown"));

        assertEquals(Set.of("person"), filtered.typeNames());
        assertTrue(filtered.attribute("migration-hash").isEmpty());
        assertTrue(filtered.attribute("email").isPresent());
    }

    @Test
    @DisplayName("Renderer should emit an empty string for an empty model")
    void renderEmpty() {
        assertEquals("", SchemaRenderer.render(SchemaModel.empty()));
    }

    @Test
    @DisplayName("Renderer should emit one clause per line")
    void renderEntity() {
        EntitySpec person = EntitySpec.builder("person")
                .sub("agent")
                .ownsKey("email")
                .owns(OwnsSpec.unique("phone").withCardinality("0..2"))
                .build();

        assertEquals("""
                entity person sub agent,
                    owns email @key,
                    owns phone @unique @card(0..2);""", SchemaRenderer.renderEntity(person));
        assertEquals("attribute email, value string;",
                SchemaRenderer.renderAttribute(AttributeSpec.of("email", ValueType.STRING)));
    }
}
