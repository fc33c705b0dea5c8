package com.e2eq.cnl.compose;

import com.e2eq.cnl.graph.NodeRole;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A node as presentation layers see it: every morph with the ids of the edges it lists, and
 * {@code nbh}, the morph currently shown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComposedNode(String id,
                           String name,
                           String baseName,
                           String qualifier,
                           String quantifier,
                           NodeRole role,
                           String nodeType,
                           String description,
                           List<ComposedMorph> morphs,
                           String nbh) {
}
