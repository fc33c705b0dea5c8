package com.e2eq.cnl.graph;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Global table of relation and attribute edges of one graph, keyed by deterministic id.
 * Implementations can be backed by in-memory maps or by an external persistence collaborator.
 * Callers serialize access through the owning {@link KnowledgeGraph}'s lock.
 */
public interface EdgeStore {

    // Upserts replace the edge stored under the same id
    void upsert(RelationEdge edge);

    void upsert(AttributeEdge edge);

    // Queries
    Optional<RelationEdge> relation(String edgeId);

    Optional<AttributeEdge> attribute(String edgeId);

    Optional<EdgeKind> kindOf(String edgeId);

    default boolean contains(String edgeId) {
        return kindOf(edgeId).isPresent();
    }

    Collection<RelationEdge> relations();

    Collection<AttributeEdge> attributes();

    List<RelationEdge> listOutgoing(String sourceId);

    List<RelationEdge> listIncoming(String targetId);

    List<AttributeEdge> listAttributesOf(String ownerId);

    List<RelationEdge> findRelationsByName(String relationName);

    List<AttributeEdge> findAttributesByName(String attributeName);

    // Deletions
    boolean remove(String edgeId);

    void clear();
}
