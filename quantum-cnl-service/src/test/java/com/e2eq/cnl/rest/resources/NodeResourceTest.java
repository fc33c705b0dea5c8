package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.TestWorkspaces;
import com.e2eq.cnl.exceptions.ConflictException;
import com.e2eq.cnl.exceptions.DuplicateException;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.exceptions.StatementRejectedException;
import com.e2eq.cnl.graph.Morph;
import com.e2eq.cnl.graph.Node;
import com.e2eq.cnl.graph.NodeDraft;
import com.e2eq.cnl.graph.NodePatch;
import com.e2eq.cnl.graph.NodeRole;
import com.e2eq.cnl.rest.models.ActiveMorphRequest;
import com.e2eq.cnl.rest.models.MorphRequest;
import com.e2eq.cnl.rest.models.ResolveRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class NodeResourceTest {

    private NodeResource resource;

    @BeforeEach
    void setUp() {
        resource = new NodeResource(TestWorkspaces.fresh());
    }

    @Test
    void testCreateAndGet() {
        Node created = resource.create("u1", "g1",
                new NodeDraft("Natural  Selection", null, null, NodeRole.PROCESS, "Process", "how species change"));
        assertEquals("natural_selection", created.id());
        assertEquals("Natural Selection", created.baseName());
        assertEquals(List.of("natural_selection::basic"), created.morphIds());
        assertEquals(created, resource.get("u1", "g1", "natural_selection"));
    }

    @Test
    void testCreateDuplicate() {
        resource.create("u1", "g1", NodeDraft.named("Water"));
        assertThrows(DuplicateException.class, () -> resource.create("u1", "g1", NodeDraft.named("  water ")));
    }

    @Test
    void testCreateUnknownNodeType() {
        assertThrows(ReferentialException.class, () -> resource.create("u1", "g1",
                new NodeDraft("Mars", null, null, null, "Planet", null)));
        assertTrue(resource.search("u1", "g1", null).isEmpty());
    }

    @Test
    void testResolveIsIdempotent() {
        String first = resource.resolve("u1", "g1", new ResolveRequest("Athens", "ancient")).id();
        String second = resource.resolve("u1", "g1", new ResolveRequest(" Athens ", "Ancient")).id();
        assertEquals("ancient_athens", first);
        assertEquals(first, second);
        assertEquals(1, resource.search("u1", "g1", "athens").size());
    }

    @Test
    void testSearch() {
        resource.create("u1", "g1", NodeDraft.named("Plato"));
        resource.create("u1", "g1", NodeDraft.named("Platonic Love"));
        resource.create("u1", "g1", NodeDraft.named("Socrates"));
        List<Node> found = resource.search("u1", "g1", "plat");
        assertEquals(List.of("plato", "platonic_love"), found.stream().map(Node::id).toList());
        assertEquals(3, resource.search("u1", "g1", "").size());
    }

    @Test
    void testUpdateWithVersionCheck() {
        Node node = resource.create("u1", "g1", NodeDraft.named("Plato"));
        Node updated = resource.update("u1", "g1", "plato", node.version(),
                new NodePatch(null, "Philosopher", "student of Socrates", null));
        assertEquals(Optional.of("Philosopher"), updated.nodeType());
        assertEquals(node.version() + 1, updated.version());

        assertThrows(ConflictException.class, () -> resource.update("u1", "g1", "plato", node.version(),
                new NodePatch(null, null, "", null)));
        Node cleared = resource.update("u1", "g1", "plato", null, new NodePatch(null, null, "", null));
        assertTrue(cleared.description().isEmpty());
    }

    @Test
    void testMorphsAndActiveSwitch() {
        resource.create("u1", "g1", NodeDraft.named("Water"));
        String frozen = resource.addMorph("u1", "g1", "water", null, new MorphRequest("frozen", null)).id();
        assertEquals("water::frozen", frozen);

        List<Morph> morphs = resource.morphs("u1", "g1", "water");
        assertEquals(List.of("water::basic", "water::frozen"), morphs.stream().map(Morph::id).toList());

        long version = resource.get("u1", "g1", "water").version();
        Node switched = resource.switchActive("u1", "g1", "water", new ActiveMorphRequest(frozen));
        assertEquals(frozen, switched.activeMorphId());
        assertEquals(version, switched.version());

        assertThrows(ReferentialException.class,
                () -> resource.switchActive("u1", "g1", "water", new ActiveMorphRequest("ice::frozen")));
        assertThrows(ReferentialException.class, () -> resource.morphs("u1", "g1", "ice"));
    }

    @Test
    void testApplyLine() {
        resource.create("u1", "g1", new NodeDraft("Socrates", null, null, null, "Philosopher", null));
        String edgeId = resource.applyLine("u1", "g1", "socrates", null, null, "<lives_in>   Athens").id();
        assertEquals("socrates::lives_in::athens", edgeId);
        assertEquals("athens", resource.get("u1", "g1", "athens").id());

        String morphId = resource.addMorph("u1", "g1", "socrates", null, new MorphRequest("old", null)).id();
        String attrId = resource.applyLine("u1", "g1", "socrates", morphId, null, "has era: -470 *year*").id();
        assertEquals("socrates::era", attrId);
        Morph old = resource.morphs("u1", "g1", "socrates").get(1);
        assertTrue(old.references(attrId));
    }

    @Test
    void testApplyLineRejected() {
        resource.create("u1", "g1", NodeDraft.named("Socrates"));
        assertThrows(IllegalArgumentException.class,
                () -> resource.applyLine("u1", "g1", "socrates", null, null, "lives somewhere"));
        StatementRejectedException rejected = assertThrows(StatementRejectedException.class,
                () -> resource.applyLine("u1", "g1", "socrates", null, null, "<orbits> Sun"));
        assertFalse(rejected.getErrors().isEmpty());
    }

    @Test
    void testDelete() {
        resource.create("u1", "g1", NodeDraft.named("Socrates"));
        resource.applyLine("u1", "g1", "socrates", null, null, "<knows> Plato");
        resource.delete("u1", "g1", "plato", null);
        assertThrows(ReferentialException.class, () -> resource.get("u1", "g1", "plato"));
        assertTrue(resource.morphs("u1", "g1", "socrates").get(0).allRefs().isEmpty());
    }
}
