package com.e2eq.cnl.graph;

import com.e2eq.cnl.exceptions.ConflictException;
import com.e2eq.cnl.exceptions.DuplicateException;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.transition.Transition;

import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Arena holding one graph: nodes, morphs, the shared edge table, the reverse index from edge id
 * to the morphs that list it, and transitions.
 * <p>
 * All mutating primitives must run inside {@link #write(Supplier)} or {@link #mutate}; they
 * assume the write lock is held and the caller has already checked every precondition, so a
 * sequence of primitives never fails halfway. Query methods take the read lock and return
 * immutable values.
 * </p>
 */
public class KnowledgeGraph {

    private final String graphId;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Morph> morphs = new LinkedHashMap<>();
    private final Map<String, Set<String>> referrers = new HashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final EdgeStore edges;

    public KnowledgeGraph(String graphId) {
        this(graphId, new InMemoryEdgeStore());
    }

    public KnowledgeGraph(String graphId, EdgeStore edges) {
        this.graphId = graphId;
        this.edges = Objects.requireNonNull(edges, "edges");
    }

    public String getGraphId() {
        return graphId;
    }

    // ---- locking ----

    public <T> T read(Supplier<T> op) {
        lock.readLock().lock();
        try {
            return op.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(Supplier<T> op) {
        lock.writeLock().lock();
        try {
            return op.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Runs {@code op} under the write lock after checking the node's version.
     * A null {@code expectedVersion} skips the check (last write wins).
     */
    public <T> T mutate(String nodeId, Long expectedVersion, Supplier<T> op) {
        return write(() -> {
            if (expectedVersion != null) {
                Node node = requireNode(nodeId);
                if (node.version() != expectedVersion) {
                    throw new ConflictException(nodeId, expectedVersion, node.version());
                }
            }
            return op.get();
        });
    }

    private void requireFreeMorphId(String morphId, String ownerNodeId) {
        Morph existing = morphs.get(morphId);
        if (existing != null) {
            throw new DuplicateException(morphId, "morphs of node " + existing.ownerNodeId()
                    + (existing.ownerNodeId().equals(ownerNodeId) ? "" : " (requested by node " + ownerNodeId + ")"));
        }
    }

    private void requireWriteLock() {
        if (!lock.isWriteLockedByCurrentThread()) {
            throw new IllegalStateException("Graph " + graphId + " mutated without holding the write lock");
        }
    }

    // ---- queries ----

    public Optional<Node> node(String nodeId) {
        return read(() -> Optional.ofNullable(nodes.get(nodeId)));
    }

    public Node requireNode(String nodeId) {
        return node(nodeId).orElseThrow(() -> ReferentialException.notFound("Node", nodeId));
    }

    public List<Node> nodes() {
        return read(() -> List.copyOf(nodes.values()));
    }

    public Optional<Morph> morph(String morphId) {
        return read(() -> Optional.ofNullable(morphs.get(morphId)));
    }

    public Morph requireMorph(String morphId) {
        return morph(morphId).orElseThrow(() -> ReferentialException.notFound("Morph", morphId));
    }

    public List<Morph> morphsOf(String nodeId) {
        return read(() -> {
            List<Morph> out = new ArrayList<>();
            for (String id : requireNode(nodeId).morphIds()) {
                out.add(morphs.get(id));
            }
            return out;
        });
    }

    public List<Morph> morphs() {
        return read(() -> List.copyOf(morphs.values()));
    }

    /** Ids of the morphs listing the edge, in the order they started listing it. */
    public Set<String> referrersOf(String edgeId) {
        return read(() -> {
            Set<String> refs = referrers.get(edgeId);
            return refs == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(refs));
        });
    }

    public Optional<RelationEdge> relation(String edgeId) {
        return read(() -> edges.relation(edgeId));
    }

    public Optional<AttributeEdge> attribute(String edgeId) {
        return read(() -> edges.attribute(edgeId));
    }

    public Optional<EdgeKind> kindOf(String edgeId) {
        return read(() -> edges.kindOf(edgeId));
    }

    public List<RelationEdge> relations() {
        return read(() -> List.copyOf(edges.relations()));
    }

    public List<AttributeEdge> attributes() {
        return read(() -> List.copyOf(edges.attributes()));
    }

    public EdgeStore edgeStore() {
        return edges;
    }

    public Optional<Transition> transition(String transitionId) {
        return read(() -> Optional.ofNullable(transitions.get(transitionId)));
    }

    public List<Transition> transitions() {
        return read(() -> List.copyOf(transitions.values()));
    }

    // ---- mutating primitives (write lock held) ----

    public void putNode(Node node) {
        requireWriteLock();
        nodes.put(node.id(), node);
    }

    /**
     * Creates a node together with its empty basic morph.
     *
     * @throws DuplicateException when the basic morph id is already taken by another node's morph
     */
    public Node createNode(Node node) {
        requireWriteLock();
        String basicId = GraphIds.basicMorphId(node.id());
        requireFreeMorphId(basicId, node.id());
        Node created = new Node(node.id(), node.baseName(), node.qualifier(), node.quantifier(), node.role(),
                node.nodeType(), node.description(), List.of(basicId), basicId, 0L);
        nodes.put(created.id(), created);
        morphs.put(basicId, Morph.empty(basicId, GraphIds.BASIC_MORPH_NAME, created.id()));
        return created;
    }

    public void bump(String nodeId) {
        requireWriteLock();
        Node node = nodes.get(nodeId);
        if (node != null) {
            nodes.put(nodeId, node.withVersion(node.version() + 1));
        }
    }

    public void upsertRelation(RelationEdge edge) {
        requireWriteLock();
        edges.upsert(edge);
    }

    public void upsertAttribute(AttributeEdge edge) {
        requireWriteLock();
        edges.upsert(edge);
    }

    /**
     * Appends a morph to its owner, registering every ref it carries.
     *
     * @throws DuplicateException when a morph with the same id already exists
     */
    public void addMorph(Morph morph) {
        requireWriteLock();
        requireFreeMorphId(morph.id(), morph.ownerNodeId());
        morphs.put(morph.id(), morph);
        for (String edgeId : morph.allRefs()) {
            referrers.computeIfAbsent(edgeId, k -> new LinkedHashSet<>()).add(morph.id());
        }
        Node owner = nodes.get(morph.ownerNodeId());
        nodes.put(owner.id(), owner.withMorphAdded(morph.id()).withVersion(owner.version() + 1));
    }

    public void addRef(String morphId, String edgeId) {
        requireWriteLock();
        Morph morph = morphs.get(morphId);
        EdgeKind kind = edges.kindOf(edgeId).orElseThrow(() -> ReferentialException.notFound("Edge", edgeId));
        if (morph.references(edgeId)) return;
        morphs.put(morphId, morph.withRef(edgeId, kind));
        referrers.computeIfAbsent(edgeId, k -> new LinkedHashSet<>()).add(morphId);
        bump(morph.ownerNodeId());
    }

    /**
     * Removes one ref and reports whether the edge is now listed by no morph.
     */
    public boolean removeRef(String morphId, String edgeId) {
        requireWriteLock();
        Morph morph = morphs.get(morphId);
        if (morph.references(edgeId)) {
            morphs.put(morphId, morph.withoutRef(edgeId));
            bump(morph.ownerNodeId());
        }
        Set<String> refs = referrers.get(edgeId);
        if (refs != null) {
            refs.remove(morphId);
            if (refs.isEmpty()) {
                referrers.remove(edgeId);
            }
        }
        return !referrers.containsKey(edgeId);
    }

    /** Deletes the edge and every ref to it. Returns the ids of the morphs that listed it. */
    public Set<String> purgeEdge(String edgeId) {
        requireWriteLock();
        Set<String> refs = new LinkedHashSet<>(referrers.getOrDefault(edgeId, Set.of()));
        for (String morphId : refs) {
            Morph morph = morphs.get(morphId);
            morphs.put(morphId, morph.withoutRef(edgeId));
            bump(morph.ownerNodeId());
        }
        referrers.remove(edgeId);
        edges.remove(edgeId);
        return refs;
    }

    /** Drops a morph whose refs have already been released. */
    public void removeMorph(String morphId) {
        requireWriteLock();
        Morph morph = morphs.remove(morphId);
        for (String edgeId : morph.allRefs()) {
            Set<String> refs = referrers.get(edgeId);
            if (refs != null) {
                refs.remove(morphId);
                if (refs.isEmpty()) referrers.remove(edgeId);
            }
        }
        Node owner = nodes.get(morph.ownerNodeId());
        if (owner != null && owner.morphIds().contains(morphId)) {
            nodes.put(owner.id(), owner.withMorphRemoved(morphId).withVersion(owner.version() + 1));
        }
    }

    /** Drops a node record and all its morphs. Edges must already have been purged. */
    public void removeNode(String nodeId) {
        requireWriteLock();
        Node node = nodes.get(nodeId);
        for (String morphId : node.morphIds()) {
            Morph morph = morphs.remove(morphId);
            if (morph == null) continue;
            for (String edgeId : morph.allRefs()) {
                Set<String> refs = referrers.get(edgeId);
                if (refs != null) {
                    refs.remove(morphId);
                    if (refs.isEmpty()) referrers.remove(edgeId);
                }
            }
        }
        nodes.remove(nodeId);
    }

    public void putTransition(Transition transition) {
        requireWriteLock();
        transitions.put(transition.id(), transition);
    }

    public Transition removeTransition(String transitionId) {
        requireWriteLock();
        return transitions.remove(transitionId);
    }

    /** Replaces the whole content of this graph, rebuilding the reverse index. */
    public void restore(Collection<Node> newNodes,
                        Collection<Morph> newMorphs,
                        Collection<RelationEdge> newRelations,
                        Collection<AttributeEdge> newAttributes,
                        Collection<Transition> newTransitions) {
        requireWriteLock();
        nodes.clear();
        morphs.clear();
        referrers.clear();
        transitions.clear();
        edges.clear();
        newNodes.forEach(n -> nodes.put(n.id(), n));
        newRelations.forEach(edges::upsert);
        newAttributes.forEach(edges::upsert);
        for (Morph m : newMorphs) {
            morphs.put(m.id(), m);
            for (String edgeId : m.allRefs()) {
                referrers.computeIfAbsent(edgeId, k -> new LinkedHashSet<>()).add(m.id());
            }
        }
        newTransitions.forEach(t -> transitions.put(t.id(), t));
    }
}
