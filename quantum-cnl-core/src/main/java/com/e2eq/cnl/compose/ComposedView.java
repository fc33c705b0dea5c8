package com.e2eq.cnl.compose;

import com.e2eq.cnl.graph.AttributeEdge;
import com.e2eq.cnl.graph.RelationEdge;
import com.e2eq.cnl.transition.Transition;

import java.util.List;

/**
 * Flattened read model of a graph for one choice of active morph per node. Graph-level
 * relation and attribute lists hold exactly the edges listed by the active morphs.
 */
public record ComposedView(List<ComposedNode> nodes,
                           List<RelationEdge> relations,
                           List<AttributeEdge> attributes,
                           List<Transition> transitions) {

    public ComposedView {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        relations = relations == null ? List.of() : List.copyOf(relations);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }
}
