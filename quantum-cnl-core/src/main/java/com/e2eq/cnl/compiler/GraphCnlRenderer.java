package com.e2eq.cnl.compiler;

import com.e2eq.cnl.graph.*;
import com.e2eq.cnl.parser.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Renders the stored graph back into CNL, one block per node: heading, description, the basic
 * morph's statements, then a {@code ##} section per additional morph. Applying the output to
 * an empty graph rebuilds the same nodes, morphs and edges.
 */
public class GraphCnlRenderer {

    private final KnowledgeGraph graph;
    private final CnlRenderer renderer = new CnlRenderer();

    public GraphCnlRenderer(KnowledgeGraph graph) {
        this.graph = graph;
    }

    public String renderGraph() {
        return graph.read(() -> {
            List<String> blocks = new ArrayList<>();
            for (Node node : graph.nodes()) {
                blocks.add(renderNode(node.id()));
            }
            return String.join("\n\n", blocks);
        });
    }

    public String renderNode(String nodeId) {
        return graph.read(() -> {
            Node node = graph.requireNode(nodeId);
            List<String> out = new ArrayList<>();
            out.add(new NodeHeading(node.baseName(), node.qualifier(), node.quantifier(), node.nodeType()).render());
            node.description().ifPresent(d -> {
                out.add(DescriptionSegment.OPEN);
                out.add(d);
                out.add(DescriptionSegment.CLOSE);
            });
            List<Morph> morphs = graph.morphsOf(nodeId);
            for (int i = 0; i < morphs.size(); i++) {
                Morph m = morphs.get(i);
                boolean basic = i == 0;
                if (basic && m.allRefs().isEmpty()) continue;
                if (!basic) {
                    out.add("## " + m.name().orElse(m.id()));
                }
                out.add(Fence.COLONS.open());
                for (String edgeId : m.relationRefs()) {
                    graph.relation(edgeId).ifPresent(e -> out.add(renderer.render(toStatement(e))));
                }
                for (String edgeId : m.attributeRefs()) {
                    graph.attribute(edgeId).ifPresent(e -> out.add(renderer.render(toStatement(e))));
                }
                out.add(Fence.COLONS.close());
            }
            return String.join("\n", out);
        });
    }

    RelationStatement toStatement(RelationEdge e) {
        String target = graph.node(e.targetId()).map(Node::baseName).orElse(e.targetId());
        Optional<String> qualifier = graph.node(e.targetId()).flatMap(Node::qualifier).or(e::targetQualifier);
        return new RelationStatement(e.adverb(), e.name(), e.objectQuantifier(), qualifier, target, e.modality());
    }

    static AttributeStatement toStatement(AttributeEdge e) {
        return new AttributeStatement(e.name(), e.adverb(), e.value(), e.unit(), e.modality());
    }
}
