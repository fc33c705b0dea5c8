package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.TestWorkspaces;
import com.e2eq.cnl.exceptions.DuplicateException;
import com.e2eq.cnl.exceptions.ReferentialErrorKind;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.schema.DataType;
import com.e2eq.cnl.schema.SchemaRegistry.AttributeTypeDef;
import com.e2eq.cnl.schema.SchemaRegistry.NodeTypeDef;
import com.e2eq.cnl.schema.SchemaRegistry.RelationTypeDef;
import com.e2eq.cnl.schema.SchemaTier;
import com.e2eq.cnl.workspace.GraphWorkspaces;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SchemaResourceTest {

    private GraphWorkspaces workspaces;
    private SchemaResource resource;

    @BeforeEach
    void setUp() {
        workspaces = TestWorkspaces.fresh();
        resource = new SchemaResource(workspaces);
        workspaces.open("u1", "g1");
    }

    @Test
    void testListByTier() {
        List<NodeTypeDef> all = resource.listNodeTypes("u1", "g1", null);
        assertTrue(all.stream().anyMatch(t -> t.name().equals("Philosopher")));
        assertTrue(resource.listNodeTypes("u1", "g1", SchemaTier.USER).isEmpty());
        assertEquals(all.size(), resource.listNodeTypes("u1", "g1", SchemaTier.GLOBAL).size());
    }

    @Test
    void testNodeTypeLifecycle() {
        String before = resource.version("u1", "g1").version();
        resource.createNodeType("u1", "g1", new NodeTypeDef("Student", null, List.of("Person")));
        assertNotEquals(before, resource.version("u1", "g1").version());
        assertEquals(List.of("Student"),
                resource.listNodeTypes("u1", "g1", SchemaTier.USER).stream().map(NodeTypeDef::name).toList());

        NodeTypeDef updated = resource.updateNodeType("u1", "g1", "Student",
                new NodeTypeDef("Student", "enrolled in the Academy", List.of("Person")));
        assertEquals("enrolled in the Academy", updated.description());

        resource.deleteNodeType("u1", "g1", "Student");
        assertTrue(resource.listNodeTypes("u1", "g1", SchemaTier.USER).isEmpty());
        assertEquals(before, resource.version("u1", "g1").version());
    }

    @Test
    void testUserTypesArePerGraph() {
        resource.createNodeType("u1", "g1", new NodeTypeDef("Student", null, List.of("Person")));
        workspaces.open("u1", "g2");
        assertTrue(resource.listNodeTypes("u1", "g2", SchemaTier.USER).isEmpty());
        assertEquals(1, resource.listNodeTypes("u1", "g1", SchemaTier.USER).size());
    }

    @Test
    void testUnknownGraphIsNotCreatedByReads() {
        ReferentialException e = assertThrows(ReferentialException.class,
                () -> resource.listNodeTypes("u2", "g1", SchemaTier.USER));
        assertEquals(ReferentialErrorKind.NOT_FOUND, e.getKind());
        assertThrows(ReferentialException.class, () -> resource.version("u1", "g2"));
        assertTrue(workspaces.find("u2").isEmpty());
        assertEquals(List.of("g1"), workspaces.forUser("u1").graphIds());

        resource.createNodeType("u2", "g1", new NodeTypeDef("Student", null, List.of("Person")));
        assertEquals(1, resource.listNodeTypes("u2", "g1", SchemaTier.USER).size());
    }

    @Test
    void testGlobalTypesAreReadOnly() {
        assertThrows(DuplicateException.class,
                () -> resource.createNodeType("u1", "g1", new NodeTypeDef("Person", null, List.of())));
        assertThrows(ReferentialException.class, () -> resource.updateRelationType("u1", "g1", "teaches",
                new RelationTypeDef("teaches", "changed", List.of(), List.of())));
        assertThrows(ReferentialException.class, () -> resource.deleteAttributeType("u1", "g1", "era"));
    }

    @Test
    void testRelationTypeInUseIsNotDeleted() {
        resource.createRelationType("u1", "g1",
                new RelationTypeDef("mentors", null, List.of("Person"), List.of("Person")));
        workspaces.forUser("u1").graph("g1").saveDocument("# Socrates\n:::cnl\n<mentors> Plato\n:::");

        ReferentialException e = assertThrows(ReferentialException.class,
                () -> resource.deleteRelationType("u1", "g1", "mentors"));
        assertEquals(ReferentialErrorKind.DANGLING_REFERENCE, e.getKind());
        assertEquals(1, resource.listRelationTypes("u1", "g1", SchemaTier.USER).size());
    }

    @Test
    void testAttributeTypeLifecycle() {
        AttributeTypeDef created = resource.createAttributeType("u1", "g1",
                new AttributeTypeDef("height", null, DataType.FLOAT, Optional.of("meter"), List.of()));
        assertEquals(Optional.of("meter"), created.unit());
        assertTrue(resource.listAttributeTypes("u1", "g1", SchemaTier.USER).contains(created));

        resource.updateAttributeType("u1", "g1", "height", new AttributeTypeDef("height", null, DataType.NUMBER));
        assertEquals(DataType.NUMBER,
                resource.listAttributeTypes("u1", "g1", SchemaTier.USER).get(0).dataType());
        resource.deleteAttributeType("u1", "g1", "height");
        assertTrue(resource.listAttributeTypes("u1", "g1", SchemaTier.USER).isEmpty());
    }
}
