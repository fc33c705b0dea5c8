package com.e2eq.cnl.graph;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * One state of a node: ordered sets of relation and attribute edge ids. A morph never owns
 * the edges it lists.
 */
public record Morph(String id,
                    Optional<String> name,
                    String ownerNodeId,
                    List<String> relationRefs,
                    List<String> attributeRefs) {

    public Morph {
        name = Node.blankToEmpty(name);
        relationRefs = relationRefs == null ? List.of() : List.copyOf(new LinkedHashSet<>(relationRefs));
        attributeRefs = attributeRefs == null ? List.of() : List.copyOf(new LinkedHashSet<>(attributeRefs));
    }

    public static Morph empty(String id, String name, String ownerNodeId) {
        return new Morph(id, Optional.ofNullable(name), ownerNodeId, List.of(), List.of());
    }

    public boolean references(String edgeId) {
        return relationRefs.contains(edgeId) || attributeRefs.contains(edgeId);
    }

    public List<String> allRefs() {
        List<String> all = new ArrayList<>(relationRefs);
        all.addAll(attributeRefs);
        return all;
    }

    public Morph withRef(String edgeId, EdgeKind kind) {
        if (references(edgeId)) return this;
        if (kind == EdgeKind.RELATION) {
            List<String> refs = new ArrayList<>(relationRefs);
            refs.add(edgeId);
            return new Morph(id, name, ownerNodeId, refs, attributeRefs);
        }
        List<String> refs = new ArrayList<>(attributeRefs);
        refs.add(edgeId);
        return new Morph(id, name, ownerNodeId, relationRefs, refs);
    }

    public Morph withoutRef(String edgeId) {
        if (!references(edgeId)) return this;
        List<String> rel = new ArrayList<>(relationRefs);
        List<String> attr = new ArrayList<>(attributeRefs);
        rel.remove(edgeId);
        attr.remove(edgeId);
        return new Morph(id, name, ownerNodeId, rel, attr);
    }

    public Morph withRefsOf(Morph seed) {
        List<String> rel = new ArrayList<>(relationRefs);
        rel.addAll(seed.relationRefs());
        List<String> attr = new ArrayList<>(attributeRefs);
        attr.addAll(seed.attributeRefs());
        return new Morph(id, name, ownerNodeId, rel, attr);
    }
}
