package com.e2eq.cnl.transition;

import com.e2eq.cnl.exceptions.DuplicateException;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.graph.GraphIds;
import com.e2eq.cnl.graph.KnowledgeGraph;
import com.e2eq.cnl.graph.Node;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records transitions between node states of one graph.
 */
public class TransitionEngine {
    private static final Logger LOG = Logger.getLogger(TransitionEngine.class.getName());

    private final KnowledgeGraph graph;
    private final TransitionCyclePolicy cyclePolicy;

    public TransitionEngine(KnowledgeGraph graph) {
        this(graph, TransitionCyclePolicy.ALLOW);
    }

    public TransitionEngine(KnowledgeGraph graph, TransitionCyclePolicy cyclePolicy) {
        this.graph = graph;
        this.cyclePolicy = cyclePolicy == null ? TransitionCyclePolicy.ALLOW : cyclePolicy;
    }

    public String create(TransitionDraft draft) {
        Transition t = toTransition(draft);
        return graph.write(() -> {
            if (graph.transition(t.id()).isPresent()) {
                throw new DuplicateException(t.id(), "transition");
            }
            checkReferences(t);
            checkCycle(t, null);
            graph.putTransition(t);
            LOG.log(Level.FINE, "Created transition {0}", t.id());
            return t.id();
        });
    }

    public Transition get(String transitionId) {
        return graph.transition(transitionId)
                .orElseThrow(() -> ReferentialException.notFound("Transition", transitionId));
    }

    public List<Transition> list() {
        return graph.transitions();
    }

    /**
     * Replaces a transition. A new name or adjective re-derives the id, which must not be taken.
     */
    public Transition update(String transitionId, TransitionDraft draft) {
        Transition t = toTransition(draft);
        return graph.write(() -> {
            get(transitionId);
            if (!t.id().equals(transitionId) && graph.transition(t.id()).isPresent()) {
                throw new DuplicateException(t.id(), "transition");
            }
            checkReferences(t);
            checkCycle(t, transitionId);
            graph.removeTransition(transitionId);
            graph.putTransition(t);
            LOG.log(Level.FINE, "Updated transition {0} -> {1}", new Object[]{transitionId, t.id()});
            return t;
        });
    }

    public void delete(String transitionId) {
        graph.write(() -> {
            if (graph.removeTransition(transitionId) == null) {
                throw ReferentialException.notFound("Transition", transitionId);
            }
            return null;
        });
    }

    private static Transition toTransition(TransitionDraft draft) {
        if (draft == null || draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("A transition must have a name");
        }
        String id = GraphIds.transitionId(draft.name(), draft.adjective());
        return new Transition(id, GraphIds.tidy(draft.name()), Optional.ofNullable(draft.adjective()), draft.tense(),
                draft.inputs(), draft.outputs(), draft.description());
    }

    private void checkReferences(Transition t) {
        List<NodeMorphRef> all = new ArrayList<>(t.inputs());
        all.addAll(t.outputs());
        for (NodeMorphRef ref : all) {
            Optional<Node> node = graph.node(ref.nodeId());
            if (node.isEmpty()) {
                throw ReferentialException.dangling(ref.nodeId(),
                        "Transition '" + t.id() + "' names missing node '" + ref.nodeId() + "'");
            }
            if (!node.get().morphIds().contains(ref.morphId())) {
                throw ReferentialException.dangling(ref.morphId(),
                        "Transition '" + t.id() + "' names morph '" + ref.morphId() + "' which is not a morph of '"
                                + ref.nodeId() + "'");
            }
        }
    }

    // state graph: every input state points at every output state of the same transition
    private void checkCycle(Transition candidate, String replacedId) {
        if (cyclePolicy == TransitionCyclePolicy.ALLOW) {
            return;
        }
        Map<NodeMorphRef, Set<NodeMorphRef>> next = new HashMap<>();
        for (Transition t : graph.transitions()) {
            if (t.id().equals(replacedId)) continue;
            for (NodeMorphRef in : t.inputs()) {
                next.computeIfAbsent(in, k -> new HashSet<>()).addAll(t.outputs());
            }
        }
        Set<NodeMorphRef> inputs = new HashSet<>(candidate.inputs());
        Deque<NodeMorphRef> queue = new ArrayDeque<>(candidate.outputs());
        Set<NodeMorphRef> seen = new HashSet<>();
        while (!queue.isEmpty()) {
            NodeMorphRef current = queue.poll();
            if (inputs.contains(current)) {
                throw new IllegalArgumentException("Transition '" + candidate.id() + "' closes a cycle through state "
                        + current.nodeId() + "/" + current.morphId());
            }
            if (seen.add(current)) {
                queue.addAll(next.getOrDefault(current, Set.of()));
            }
        }
    }
}
