package com.e2eq.cnl.graph;

import java.util.*;

/**
 * Insertion-ordered in-memory edge table. Not synchronized on its own.
 */
public class InMemoryEdgeStore implements EdgeStore {

    private final Map<String, RelationEdge> relations = new LinkedHashMap<>();
    private final Map<String, AttributeEdge> attributes = new LinkedHashMap<>();

    @Override
    public void upsert(RelationEdge edge) {
        Objects.requireNonNull(edge, "edge");
        // replace keeps the original insertion position
        relations.put(edge.id(), edge);
    }

    @Override
    public void upsert(AttributeEdge edge) {
        Objects.requireNonNull(edge, "edge");
        attributes.put(edge.id(), edge);
    }

    @Override
    public Optional<RelationEdge> relation(String edgeId) {
        return Optional.ofNullable(relations.get(edgeId));
    }

    @Override
    public Optional<AttributeEdge> attribute(String edgeId) {
        return Optional.ofNullable(attributes.get(edgeId));
    }

    @Override
    public Optional<EdgeKind> kindOf(String edgeId) {
        if (relations.containsKey(edgeId)) return Optional.of(EdgeKind.RELATION);
        if (attributes.containsKey(edgeId)) return Optional.of(EdgeKind.ATTRIBUTE);
        return Optional.empty();
    }

    @Override
    public Collection<RelationEdge> relations() {
        return List.copyOf(relations.values());
    }

    @Override
    public Collection<AttributeEdge> attributes() {
        return List.copyOf(attributes.values());
    }

    @Override
    public List<RelationEdge> listOutgoing(String sourceId) {
        List<RelationEdge> out = new ArrayList<>();
        for (RelationEdge e : relations.values()) if (Objects.equals(e.sourceId(), sourceId)) out.add(e);
        return out;
    }

    @Override
    public List<RelationEdge> listIncoming(String targetId) {
        List<RelationEdge> out = new ArrayList<>();
        for (RelationEdge e : relations.values()) if (Objects.equals(e.targetId(), targetId)) out.add(e);
        return out;
    }

    @Override
    public List<AttributeEdge> listAttributesOf(String ownerId) {
        List<AttributeEdge> out = new ArrayList<>();
        for (AttributeEdge e : attributes.values()) if (Objects.equals(e.ownerId(), ownerId)) out.add(e);
        return out;
    }

    @Override
    public List<RelationEdge> findRelationsByName(String relationName) {
        List<RelationEdge> out = new ArrayList<>();
        for (RelationEdge e : relations.values()) if (Objects.equals(e.name(), relationName)) out.add(e);
        return out;
    }

    @Override
    public List<AttributeEdge> findAttributesByName(String attributeName) {
        List<AttributeEdge> out = new ArrayList<>();
        for (AttributeEdge e : attributes.values()) if (Objects.equals(e.name(), attributeName)) out.add(e);
        return out;
    }

    @Override
    public boolean remove(String edgeId) {
        return relations.remove(edgeId) != null | attributes.remove(edgeId) != null;
    }

    @Override
    public void clear() {
        relations.clear();
        attributes.clear();
    }
}
