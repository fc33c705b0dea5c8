package com.e2eq.cnl.graph;

import java.util.Optional;

/**
 * Typed relation between two nodes, keyed by {@code source::name::target}.
 */
public record RelationEdge(String id,
                           String name,
                           String sourceId,
                           String targetId,
                           Optional<String> adverb,
                           Optional<String> modality,
                           Optional<String> subjectQuantifier,
                           Optional<String> objectQuantifier,
                           Optional<String> targetQualifier) {

    public RelationEdge {
        adverb = Node.blankToEmpty(adverb);
        modality = Node.blankToEmpty(modality);
        subjectQuantifier = Node.blankToEmpty(subjectQuantifier);
        objectQuantifier = Node.blankToEmpty(objectQuantifier);
        targetQualifier = Node.blankToEmpty(targetQualifier);
        if (id == null) {
            id = GraphIds.relationId(sourceId, name, targetId);
        }
    }

    public static RelationEdge of(String sourceId, String name, String targetId) {
        return new RelationEdge(null, name, sourceId, targetId, Optional.empty(), Optional.empty(),
                Optional.empty(), Optional.empty(), Optional.empty());
    }

    /** The same relation seen from the target, named by the inverse relation type. */
    public RelationEdge reversed(String inverseName) {
        return new RelationEdge(null, inverseName, targetId, sourceId, adverb, modality,
                objectQuantifier, subjectQuantifier, Optional.empty());
    }
}
