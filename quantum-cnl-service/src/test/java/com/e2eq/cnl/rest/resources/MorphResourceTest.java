package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.TestWorkspaces;
import com.e2eq.cnl.exceptions.ConflictException;
import com.e2eq.cnl.exceptions.ReferentialErrorKind;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.graph.KnowledgeGraph;
import com.e2eq.cnl.rest.models.RefRequest;
import com.e2eq.cnl.rest.models.UnlistResponse;
import com.e2eq.cnl.transition.NodeMorphRef;
import com.e2eq.cnl.transition.TransitionDraft;
import com.e2eq.cnl.workspace.GraphContext;
import com.e2eq.cnl.workspace.GraphWorkspaces;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MorphResourceTest {

    private static final String DOCUMENT = String.join("\n",
            "# Water",
            ":::cnl",
            "has state: liquid",
            "has temperature: 20 *celsius*",
            ":::",
            "## frozen",
            ":::cnl",
            "has state: solid",
            ":::");

    private static final String STATE = "water::state";
    private static final String TEMPERATURE = "water::temperature";

    private GraphContext context;
    private MorphResource resource;

    @BeforeEach
    void setUp() {
        GraphWorkspaces workspaces = TestWorkspaces.fresh();
        workspaces.forUser("u1").graph("g1").saveDocument(DOCUMENT);
        context = workspaces.forUser("u1").graph("g1");
        resource = new MorphResource(workspaces);
    }

    @Test
    void testCopyRef() {
        resource.copy("u1", "g1", null, new RefRequest(TEMPERATURE, "water::basic", "water::frozen"));
        assertEquals(Set.of("water::basic", "water::frozen"), context.graph().referrersOf(TEMPERATURE));
    }

    @Test
    void testCopyRequiresListedRef() {
        ReferentialException e = assertThrows(ReferentialException.class, () -> resource.copy("u1", "g1", null,
                new RefRequest(TEMPERATURE, "water::frozen", "water::basic")));
        assertEquals(ReferentialErrorKind.NOT_FOUND, e.getKind());
    }

    @Test
    void testRefCannotLeaveItsNode() {
        String ice = context.nodes().resolveOrCreate("Ice");
        String iceBasic = context.graph().requireNode(ice).basicMorphId();
        assertThrows(ReferentialException.class, () -> resource.copy("u1", "g1", null,
                new RefRequest(TEMPERATURE, "water::basic", iceBasic)));
        assertThrows(ReferentialException.class, () -> resource.move("u1", "g1", null,
                new RefRequest(TEMPERATURE, "water::basic", iceBasic)));
        assertEquals(Set.of("water::basic"), context.graph().referrersOf(TEMPERATURE));
        assertTrue(context.graph().requireMorph(iceBasic).allRefs().isEmpty());
    }

    @Test
    void testMoveRef() {
        resource.move("u1", "g1", null, new RefRequest(TEMPERATURE, "water::basic", "water::frozen"));
        assertEquals(Set.of("water::frozen"), context.graph().referrersOf(TEMPERATURE));
        assertFalse(context.graph().requireMorph("water::basic").references(TEMPERATURE));
    }

    @Test
    void testMoveWithStaleVersion() {
        long version = context.graph().requireNode("water").version();
        resource.copy("u1", "g1", version, new RefRequest(TEMPERATURE, "water::basic", "water::frozen"));
        assertThrows(ConflictException.class, () -> resource.move("u1", "g1", version,
                new RefRequest(TEMPERATURE, "water::frozen", "water::basic")));
    }

    @Test
    void testUnlistPurgesLastReference() {
        resource.copy("u1", "g1", null, new RefRequest(TEMPERATURE, "water::basic", "water::frozen"));

        UnlistResponse first = resource.unlist("u1", "g1", null, new RefRequest(TEMPERATURE, "water::basic", null));
        assertEquals(new UnlistResponse(TEMPERATURE, false), first);
        assertTrue(context.graph().kindOf(TEMPERATURE).isPresent());

        UnlistResponse second = resource.unlist("u1", "g1", null, new RefRequest(TEMPERATURE, "water::frozen", null));
        assertTrue(second.purged());
        assertTrue(context.graph().kindOf(TEMPERATURE).isEmpty());
    }

    @Test
    void testDeleteMorph() {
        KnowledgeGraph graph = context.graph();
        assertEquals("solid", graph.attribute(STATE).orElseThrow().value());
        resource.delete("u1", "g1", "water::frozen", null);
        assertTrue(graph.morph("water::frozen").isEmpty());
        assertEquals(List.of("water::basic"), graph.requireNode("water").morphIds());
        assertEquals(Set.of("water::basic"), graph.referrersOf(STATE));
    }

    @Test
    void testBasicMorphIsProtected() {
        ReferentialException e = assertThrows(ReferentialException.class,
                () -> resource.delete("u1", "g1", "water::basic", null));
        assertEquals(ReferentialErrorKind.PROTECTED_MORPH, e.getKind());
    }

    @Test
    void testMorphUsedByTransitionIsKept() {
        context.transitions().create(new TransitionDraft("Freezing", null, null,
                List.of(new NodeMorphRef("water", "water::basic")),
                List.of(new NodeMorphRef("water", "water::frozen")), null));
        ReferentialException e = assertThrows(ReferentialException.class,
                () -> resource.delete("u1", "g1", "water::frozen", null));
        assertEquals(ReferentialErrorKind.DANGLING_REFERENCE, e.getKind());
    }
}
