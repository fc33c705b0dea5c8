package com.e2eq.cnl.schema;

import com.e2eq.cnl.TestSchemas;
import com.e2eq.cnl.exceptions.DuplicateException;
import com.e2eq.cnl.exceptions.ReferentialErrorKind;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.schema.SchemaRegistry.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TieredSchemaRegistryTest {

    private TieredSchemaRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TieredSchemaRegistry(TestSchemas.global());
    }

    @Test
    void testUserTypeMayExtendGlobalType() {
        registry.createNodeType(new NodeTypeDef("Student", "Learns things", List.of("Person")));
        assertEquals(Optional.of(SchemaTier.USER), registry.tierOf("Student"));
        assertEquals(Optional.of(SchemaTier.GLOBAL), registry.tierOf("Person"));
        assertTrue(registry.isSubtypeOf("Student", "Entity"));
        assertTrue(registry.descendantsOf("Person").contains("Student"));
        assertTrue(registry.nodeTypes().containsKey("Student"));
        assertTrue(registry.defsOf(SchemaTier.USER).nodeTypes().containsKey("Student"));
        assertFalse(registry.defsOf(SchemaTier.GLOBAL).nodeTypes().containsKey("Student"));
    }

    @Test
    void testNameTakenInEitherTierIsDuplicate() {
        DuplicateException global = assertThrows(DuplicateException.class,
                () -> registry.createRelationType(new RelationTypeDef("teaches", null, List.of(), List.of())));
        assertEquals("global", global.getTier());

        registry.createAttributeType(new AttributeTypeDef("nickname", null, DataType.STRING));
        DuplicateException user = assertThrows(DuplicateException.class,
                () -> registry.createAttributeType(new AttributeTypeDef("nickname", null, DataType.STRING)));
        assertEquals("user", user.getTier());
        assertEquals("nickname", user.getName());
    }

    @Test
    void testGlobalTypesAreReadOnly() {
        ReferentialException ex = assertThrows(ReferentialException.class,
                () -> registry.updateNodeType("Person", new NodeTypeDef("Person", "changed", List.of())));
        assertEquals(ReferentialErrorKind.NOT_FOUND, ex.getKind());
        assertThrows(ReferentialException.class, () -> registry.deleteNodeType("Person"));
    }

    @Test
    void testRenameIsRefused() {
        registry.createNodeType(new NodeTypeDef("Student", null, List.of("Person")));
        assertThrows(IllegalArgumentException.class,
                () -> registry.updateNodeType("Student", new NodeTypeDef("Pupil", null, List.of("Person"))));
    }

    @Test
    void testInvalidWriteIsRolledBack() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.createNodeType(new NodeTypeDef("Ghost", null, List.of("Spirit"))));
        assertTrue(registry.nodeType("Ghost").isEmpty());

        registry.createNodeType(new NodeTypeDef("Student", null, List.of("Person")));
        assertThrows(IllegalArgumentException.class,
                () -> registry.updateNodeType("Student", new NodeTypeDef("Student", null, List.of("Nobody"))));
        assertEquals(List.of("Person"), registry.nodeType("Student").orElseThrow().parentTypes());
    }

    @Test
    void testHashFollowsUserTier() {
        String before = registry.getHash();
        registry.createNodeType(new NodeTypeDef("Student", null, List.of("Person")));
        String after = registry.getHash();
        assertNotEquals(before, after);
        registry.deleteNodeType("Student");
        assertEquals(before, registry.getHash());
    }

    @Test
    void testUserTierCannotShadowGlobal() {
        SchemaDefs shadowing = new SchemaDefs(Map.of("Person", new NodeTypeDef("Person", null, List.of())), Map.of(), Map.of());
        assertThrows(DuplicateException.class, () -> new TieredSchemaRegistry(TestSchemas.global(), shadowing));
    }

    @Test
    void testInverseLookup() {
        assertEquals(Optional.of("taught_by"), registry.inverseOf("teaches"));
        assertEquals(Optional.of("teaches"), registry.inverseOf("taught_by"));
        assertEquals(Optional.of("knows"), registry.inverseOf("knows"));
        assertEquals(Optional.empty(), registry.inverseOf("lives_in"));
    }
}
