package com.e2eq.cnl.morph;

import com.e2eq.cnl.exceptions.DuplicateException;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.graph.*;
import com.e2eq.cnl.transition.Transition;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polymorphic state operations on the nodes of one graph.
 * <p>
 * Morphs list edges by id; an edge lives in the graph's edge table for as long as at least one
 * morph lists it. Each operation checks all of its preconditions before touching anything and
 * runs under the graph write lock, so it either applies completely or not at all. Passing an
 * expected version makes the call fail with a
 * {@link com.e2eq.cnl.exceptions.ConflictException} when the owning node changed since it was
 * read; {@code null} skips the check.
 * </p>
 */
public class MorphManager {
    private static final Logger LOG = Logger.getLogger(MorphManager.class.getName());

    private final KnowledgeGraph graph;

    public MorphManager(KnowledgeGraph graph) {
        this.graph = graph;
    }

    public String addMorph(String nodeId, String name, String seedFrom) {
        return addMorph(nodeId, name, seedFrom, null);
    }

    /**
     * Creates a morph named {@code name} on the node. When {@code seedFrom} is given the new
     * morph starts out listing the same edges as that morph.
     */
    public String addMorph(String nodeId, String name, String seedFrom, Long expectedVersion) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("A morph must have a name");
        }
        return graph.mutate(nodeId, expectedVersion, () -> {
            Node node = graph.requireNode(nodeId);
            String morphId = GraphIds.morphId(name, nodeId);
            if (graph.morph(morphId).isPresent()) {
                throw new DuplicateException(name.trim(), "node " + nodeId);
            }
            Morph morph = Morph.empty(morphId, GraphIds.tidy(name), node.id());
            if (seedFrom != null && !seedFrom.isBlank()) {
                morph = morph.withRefsOf(graph.requireMorph(seedFrom));
            }
            graph.addMorph(morph);
            LOG.log(Level.FINE, "Added morph {0} ({1} refs)", new Object[]{morphId, morph.allRefs().size()});
            return morphId;
        });
    }

    /**
     * Returns the id of the node's morph with this name, creating an empty one when missing.
     * A blank name means the basic morph.
     *
     * @throws DuplicateException when the id is already held by a morph of another node
     */
    public String ensureMorph(String nodeId, String name) {
        Node node = graph.requireNode(nodeId);
        if (name == null || name.isBlank()) {
            return node.basicMorphId();
        }
        String morphId = GraphIds.morphId(name, nodeId);
        if (node.morphIds().contains(morphId)) {
            return morphId;
        }
        return graph.write(() -> {
            if (graph.requireNode(nodeId).morphIds().contains(morphId)) {
                return morphId;
            }
            graph.addMorph(Morph.empty(morphId, GraphIds.tidy(name), nodeId));
            return morphId;
        });
    }

    /** Selects the morph shown for the node. Does not count as a change. */
    public Node switchActive(String nodeId, String morphId) {
        return graph.write(() -> {
            Node node = graph.requireNode(nodeId);
            requireOwnMorph(node, morphId);
            Node switched = node.withActiveMorph(morphId);
            graph.putNode(switched);
            return switched;
        });
    }

    public void copyRef(String edgeId, String fromMorphId, String toMorphId) {
        copyRef(edgeId, fromMorphId, toMorphId, null);
    }

    /** Adds the edge to {@code toMorphId}; {@code fromMorphId} keeps it. Both must belong to one node. */
    public void copyRef(String edgeId, String fromMorphId, String toMorphId, Long expectedVersion) {
        String ownerId = graph.requireMorph(toMorphId).ownerNodeId();
        graph.mutate(ownerId, expectedVersion, () -> {
            requireListed(edgeId, fromMorphId);
            requireSameOwner(fromMorphId, toMorphId);
            graph.addRef(toMorphId, edgeId);
            LOG.log(Level.FINE, "Copied {0} from {1} to {2}", new Object[]{edgeId, fromMorphId, toMorphId});
            return null;
        });
    }

    public void moveRef(String edgeId, String fromMorphId, String toMorphId) {
        moveRef(edgeId, fromMorphId, toMorphId, null);
    }

    /**
     * Lists the edge on {@code toMorphId} and unlists it from {@code fromMorphId} in one step.
     * Both morphs must belong to one node.
     */
    public void moveRef(String edgeId, String fromMorphId, String toMorphId, Long expectedVersion) {
        String ownerId = graph.requireMorph(fromMorphId).ownerNodeId();
        graph.mutate(ownerId, expectedVersion, () -> {
            requireListed(edgeId, fromMorphId);
            requireSameOwner(fromMorphId, toMorphId);
            if (fromMorphId.equals(toMorphId)) {
                return null;
            }
            // add first so the edge is never unreferenced in between
            graph.addRef(toMorphId, edgeId);
            graph.removeRef(fromMorphId, edgeId);
            LOG.log(Level.FINE, "Moved {0} from {1} to {2}", new Object[]{edgeId, fromMorphId, toMorphId});
            return null;
        });
    }

    public boolean unlistRef(String edgeId, String morphId) {
        return unlistRef(edgeId, morphId, null);
    }

    /**
     * Removes the edge from one morph. When no other morph lists it, the edge is deleted.
     *
     * @return true when the edge was deleted
     */
    public boolean unlistRef(String edgeId, String morphId, Long expectedVersion) {
        String ownerId = graph.requireMorph(morphId).ownerNodeId();
        return graph.mutate(ownerId, expectedVersion, () -> {
            requireListed(edgeId, morphId);
            boolean orphan = graph.removeRef(morphId, edgeId);
            if (orphan) {
                graph.purgeEdge(edgeId);
                LOG.log(Level.FINE, "Unlisted {0} from {1}; edge purged", new Object[]{edgeId, morphId});
            }
            return orphan;
        });
    }

    /**
     * Deletes the edge and removes it from every morph of the graph.
     *
     * @return ids of the morphs that listed it
     */
    public Set<String> deleteEdgeEverywhere(String edgeId) {
        return graph.write(() -> {
            if (graph.kindOf(edgeId).isEmpty()) {
                throw ReferentialException.notFound("Edge", edgeId);
            }
            Set<String> referrers = graph.purgeEdge(edgeId);
            LOG.log(Level.FINE, "Deleted edge {0} from {1} morphs", new Object[]{edgeId, referrers.size()});
            return referrers;
        });
    }

    public void deleteMorph(String morphId) {
        deleteMorph(morphId, null);
    }

    /**
     * Deletes a morph. Edges only it lists are deleted with it; edges other morphs still list
     * survive. The basic morph is protected and a morph named by a transition is kept.
     */
    public void deleteMorph(String morphId, Long expectedVersion) {
        String ownerId = graph.requireMorph(morphId).ownerNodeId();
        graph.mutate(ownerId, expectedVersion, () -> {
            Morph morph = graph.requireMorph(morphId);
            Node owner = graph.requireNode(morph.ownerNodeId());
            if (owner.basicMorphId().equals(morphId)) {
                throw ReferentialException.protectedMorph(morphId);
            }
            for (Transition t : graph.transitions()) {
                if (t.referencesMorph(morphId)) {
                    throw ReferentialException.dangling(morphId,
                            "Morph '" + morphId + "' is referenced by transition '" + t.id() + "'");
                }
            }
            int purged = 0;
            for (String edgeId : morph.allRefs()) {
                Set<String> referrers = graph.referrersOf(edgeId);
                if (referrers.size() == 1 && referrers.contains(morphId)) {
                    graph.purgeEdge(edgeId);
                    purged++;
                }
            }
            graph.removeMorph(morphId);
            LOG.log(Level.FINE, "Deleted morph {0}; {1} edges purged", new Object[]{morphId, purged});
            return null;
        });
    }

    /** Morphs listing the edge. */
    public Set<String> referrersOf(String edgeId) {
        return graph.read(() -> {
            if (graph.kindOf(edgeId).isEmpty()) {
                throw ReferentialException.notFound("Edge", edgeId);
            }
            return graph.referrersOf(edgeId);
        });
    }

    /** Upserts a relation edge and lists it on the morph. Re-submitting the same edge changes nothing else. */
    public RelationEdge attachRelation(String morphId, RelationEdge edge, Long expectedVersion) {
        String ownerId = graph.requireMorph(morphId).ownerNodeId();
        return graph.mutate(ownerId, expectedVersion, () -> {
            graph.requireNode(edge.targetId());
            boolean changed = !graph.relation(edge.id()).equals(Optional.of(edge));
            graph.upsertRelation(edge);
            if (changed) graph.bump(ownerId);
            graph.addRef(morphId, edge.id());
            return edge;
        });
    }

    /** Upserts an attribute edge and lists it on the morph. */
    public AttributeEdge attachAttribute(String morphId, AttributeEdge edge, Long expectedVersion) {
        String ownerId = graph.requireMorph(morphId).ownerNodeId();
        return graph.mutate(ownerId, expectedVersion, () -> {
            boolean changed = !graph.attribute(edge.id()).equals(Optional.of(edge));
            graph.upsertAttribute(edge);
            if (changed) graph.bump(ownerId);
            graph.addRef(morphId, edge.id());
            return edge;
        });
    }

    private void requireListed(String edgeId, String morphId) {
        if (graph.kindOf(edgeId).isEmpty()) {
            throw ReferentialException.notFound("Edge", edgeId);
        }
        if (!graph.requireMorph(morphId).references(edgeId)) {
            throw ReferentialException.notFound("Reference to " + edgeId + " in morph", morphId);
        }
    }

    private void requireSameOwner(String fromMorphId, String toMorphId) {
        String fromOwner = graph.requireMorph(fromMorphId).ownerNodeId();
        String toOwner = graph.requireMorph(toMorphId).ownerNodeId();
        if (!fromOwner.equals(toOwner)) {
            throw ReferentialException.notFound("Morph of node " + fromOwner, toMorphId);
        }
    }

    private static void requireOwnMorph(Node node, String morphId) {
        if (!node.morphIds().contains(morphId)) {
            throw ReferentialException.notFound("Morph of node " + node.id(), morphId);
        }
    }
}
