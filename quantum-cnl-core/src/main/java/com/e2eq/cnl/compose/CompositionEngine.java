package com.e2eq.cnl.compose;

import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.graph.*;

import java.util.*;

/**
 * Builds {@link ComposedView}s. Pure: reads the graph under its read lock and changes nothing.
 */
public class CompositionEngine {

    /**
     * @param activeMorphPerNode optional overrides, node id to morph id; nodes not listed use
     *                           their active morph, falling back to the basic morph
     */
    public ComposedView compose(KnowledgeGraph graph, Map<String, String> activeMorphPerNode) {
        Map<String, String> overrides = activeMorphPerNode == null ? Map.of() : activeMorphPerNode;
        return graph.read(() -> {
            for (String nodeId : overrides.keySet()) {
                graph.requireNode(nodeId);
            }
            List<Node> nodes = new ArrayList<>(graph.nodes());
            nodes.sort(Comparator.comparing(Node::id));

            List<ComposedNode> composed = new ArrayList<>();
            Set<String> relationIds = new LinkedHashSet<>();
            Set<String> attributeIds = new LinkedHashSet<>();
            for (Node node : nodes) {
                String nbh = activeMorph(node, overrides.get(node.id()));
                List<ComposedMorph> morphs = new ArrayList<>();
                for (Morph m : graph.morphsOf(node.id())) {
                    morphs.add(new ComposedMorph(m.id(), m.name().orElse(null), m.relationRefs(), m.attributeRefs()));
                    if (m.id().equals(nbh)) {
                        relationIds.addAll(m.relationRefs());
                        attributeIds.addAll(m.attributeRefs());
                    }
                }
                composed.add(new ComposedNode(node.id(), node.displayName(), node.baseName(),
                        node.qualifier().orElse(null), node.quantifier().orElse(null), node.role(),
                        node.nodeType().orElse(null), node.description().orElse(null), morphs, nbh));
            }

            List<RelationEdge> relations = new ArrayList<>();
            relationIds.forEach(id -> graph.relation(id).ifPresent(relations::add));
            List<AttributeEdge> attributes = new ArrayList<>();
            attributeIds.forEach(id -> graph.attribute(id).ifPresent(attributes::add));
            return new ComposedView(composed, relations, attributes, graph.transitions());
        });
    }

    public ComposedView compose(KnowledgeGraph graph) {
        return compose(graph, Map.of());
    }

    private static String activeMorph(Node node, String override) {
        if (override != null) {
            if (!node.morphIds().contains(override)) {
                throw ReferentialException.notFound("Morph of node " + node.id(), override);
            }
            return override;
        }
        if (node.activeMorphId() != null && node.morphIds().contains(node.activeMorphId())) {
            return node.activeMorphId();
        }
        return node.basicMorphId();
    }
}
