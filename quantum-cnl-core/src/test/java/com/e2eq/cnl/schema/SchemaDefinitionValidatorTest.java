package com.e2eq.cnl.schema;

import com.e2eq.cnl.schema.SchemaRegistry.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class SchemaDefinitionValidatorTest {

    @Test
    void testValidSchema() {
        Map<String, NodeTypeDef> nodeTypes = Map.of(
                "Person", new NodeTypeDef("Person", null, List.of()));
        Map<String, RelationTypeDef> relations = Map.of(
                "knows", new RelationTypeDef("knows", null, List.of("Person"), List.of("Person"), true, false, Optional.empty()));
        assertDoesNotThrow(() -> SchemaDefinitionValidator.validate(new SchemaDefs(nodeTypes, relations, Map.of())));
    }

    @Test
    void testCycleInNodeTypeHierarchy() {
        Map<String, NodeTypeDef> nodeTypes = Map.of(
                "A", new NodeTypeDef("A", null, List.of("B")),
                "B", new NodeTypeDef("B", null, List.of("C")),
                "C", new NodeTypeDef("C", null, List.of("A")));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> SchemaDefinitionValidator.validate(new SchemaDefs(nodeTypes, Map.of(), Map.of())));
        assertTrue(ex.getMessage().contains("Cycle detected"));
    }

    @Test
    void testUnknownTypeInRange() {
        Map<String, RelationTypeDef> relations = Map.of(
                "lives_in", new RelationTypeDef("lives_in", null, List.of(), List.of("Place")));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> SchemaDefinitionValidator.validate(new SchemaDefs(Map.of(), relations, Map.of())));
        assertTrue(ex.getMessage().contains("Unknown node type 'Place' in range of lives_in"));
    }

    @Test
    void testSymmetricRelationNeedsMatchingDomainAndRange() {
        Map<String, NodeTypeDef> nodeTypes = Map.of(
                "Person", new NodeTypeDef("Person", null, List.of()),
                "Place", new NodeTypeDef("Place", null, List.of()));
        Map<String, RelationTypeDef> relations = Map.of(
                "near", new RelationTypeDef("near", null, List.of("Person"), List.of("Place"), true, false, Optional.empty()));
        assertThrows(IllegalArgumentException.class,
                () -> SchemaDefinitionValidator.validate(new SchemaDefs(nodeTypes, relations, Map.of())));
    }

    @Test
    void testAllowedValuesMustMatchDataType() {
        Map<String, AttributeTypeDef> attributes = Map.of(
                "legs", new AttributeTypeDef("legs", null, DataType.NUMBER, Optional.empty(), List.of("2", "four")));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> SchemaDefinitionValidator.validate(new SchemaDefs(Map.of(), Map.of(), attributes)));
        assertTrue(ex.getMessage().contains("'four'"));
    }

    @Test
    void testBlankNameIsRejected() {
        Map<String, NodeTypeDef> nodeTypes = Map.of(" ", new NodeTypeDef(" ", null, List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> SchemaDefinitionValidator.validate(new SchemaDefs(nodeTypes, Map.of(), Map.of())));
    }
}
