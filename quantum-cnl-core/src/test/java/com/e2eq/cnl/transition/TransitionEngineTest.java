package com.e2eq.cnl.transition;

import com.e2eq.cnl.TestSchemas;
import com.e2eq.cnl.exceptions.DuplicateException;
import com.e2eq.cnl.exceptions.ReferentialErrorKind;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.graph.KnowledgeGraph;
import com.e2eq.cnl.graph.NodeRegistry;
import com.e2eq.cnl.morph.MorphManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TransitionEngineTest {

    private final KnowledgeGraph graph = new KnowledgeGraph("g1");
    private NodeMorphRef ice;
    private NodeMorphRef liquid;
    private NodeMorphRef steam;

    @BeforeEach
    void setUp() {
        NodeRegistry nodes = new NodeRegistry(graph, TestSchemas.global());
        MorphManager morphs = new MorphManager(graph);
        String water = nodes.resolveOrCreate("Water");
        ice = new NodeMorphRef(water, morphs.addMorph(water, "ice", null));
        liquid = new NodeMorphRef(water, graph.requireNode(water).basicMorphId());
        steam = new NodeMorphRef(water, morphs.addMorph(water, "steam", null));
    }

    @Test
    void testCreateAndGet() {
        TransitionEngine engine = new TransitionEngine(graph);
        String id = engine.create(new TransitionDraft("Melting", "slow", Tense.PAST,
                List.of(ice), List.of(liquid), "Ice turns into water"));
        assertEquals("slow_melting", id);
        Transition t = engine.get(id);
        assertEquals("Melting", t.name());
        assertEquals(Optional.of("slow"), t.adjective());
        assertEquals(Tense.PAST, t.tense());
        assertEquals(List.of(ice), t.inputs());
        assertEquals(1, engine.list().size());
    }

    @Test
    void testDuplicateId() {
        TransitionEngine engine = new TransitionEngine(graph);
        engine.create(new TransitionDraft("Melting", null, null, List.of(ice), List.of(liquid), null));
        assertThrows(DuplicateException.class,
                () -> engine.create(new TransitionDraft(" melting ", null, null, List.of(ice), List.of(liquid), null)));
    }

    @Test
    void testDanglingReferences() {
        TransitionEngine engine = new TransitionEngine(graph);
        ReferentialException missingNode = assertThrows(ReferentialException.class, () -> engine.create(
                new TransitionDraft("Melting", null, null, List.of(new NodeMorphRef("lava", "lava::basic")), List.of(liquid), null)));
        assertEquals(ReferentialErrorKind.DANGLING_REFERENCE, missingNode.getKind());

        assertThrows(ReferentialException.class, () -> engine.create(
                new TransitionDraft("Melting", null, null, List.of(new NodeMorphRef(ice.nodeId(), "water::frozen")),
                        List.of(liquid), null)));
        assertTrue(engine.list().isEmpty());
    }

    @Test
    void testDefaultTense() {
        TransitionEngine engine = new TransitionEngine(graph);
        String id = engine.create(new TransitionDraft("Boiling", null, null, List.of(liquid), List.of(steam), null));
        assertEquals(Tense.PRESENT, engine.get(id).tense());
    }

    @Test
    void testCyclesAllowedByDefault() {
        TransitionEngine engine = new TransitionEngine(graph);
        engine.create(new TransitionDraft("Melting", null, null, List.of(ice), List.of(liquid), null));
        assertDoesNotThrow(() -> engine.create(
                new TransitionDraft("Freezing", null, null, List.of(liquid), List.of(ice), null)));
    }

    @Test
    void testCycleRejectedWhenConfigured() {
        TransitionEngine engine = new TransitionEngine(graph, TransitionCyclePolicy.REJECT);
        engine.create(new TransitionDraft("Melting", null, null, List.of(ice), List.of(liquid), null));
        engine.create(new TransitionDraft("Boiling", null, null, List.of(liquid), List.of(steam), null));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> engine.create(
                new TransitionDraft("Deposition", null, null, List.of(steam), List.of(ice), null)));
        assertTrue(ex.getMessage().contains("cycle"));
        assertEquals(2, engine.list().size());
    }

    @Test
    void testUpdateAndDelete() {
        TransitionEngine engine = new TransitionEngine(graph);
        String id = engine.create(new TransitionDraft("Melting", null, null, List.of(ice), List.of(liquid), null));
        Transition renamed = engine.update(id, new TransitionDraft("Melting", "fast", Tense.FUTURE,
                List.of(ice), List.of(liquid), null));
        assertEquals("fast_melting", renamed.id());
        assertThrows(ReferentialException.class, () -> engine.get(id));

        engine.delete(renamed.id());
        assertTrue(engine.list().isEmpty());
        assertThrows(ReferentialException.class, () -> engine.delete(renamed.id()));
    }
}
