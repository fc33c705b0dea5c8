package com.e2eq.cnl.workspace;

import com.e2eq.cnl.graph.AttributeEdge;
import com.e2eq.cnl.graph.Morph;
import com.e2eq.cnl.graph.Node;
import com.e2eq.cnl.graph.RelationEdge;
import com.e2eq.cnl.schema.SchemaRegistry.SchemaDefs;
import com.e2eq.cnl.transition.Transition;

import java.util.List;

/**
 * Serializable state of one graph, for handing to a persistence collaborator.
 */
public record GraphSnapshot(int formatVersion,
                            String graphId,
                            SchemaDefs userSchema,
                            List<Node> nodes,
                            List<Morph> morphs,
                            List<RelationEdge> relations,
                            List<AttributeEdge> attributes,
                            List<Transition> transitions,
                            String document) {

    public static final int FORMAT_VERSION = 1;
}
