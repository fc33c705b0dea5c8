package com.e2eq.cnl.graph;

import com.e2eq.cnl.exceptions.DuplicateException;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.schema.SchemaRegistry;
import com.e2eq.cnl.transition.Transition;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves display names to node ids within one graph, creating nodes on first reference.
 */
public class NodeRegistry {
    private static final Logger LOG = Logger.getLogger(NodeRegistry.class.getName());

    private final KnowledgeGraph graph;
    private final SchemaRegistry schema;

    public NodeRegistry(KnowledgeGraph graph, SchemaRegistry schema) {
        this.graph = graph;
        this.schema = schema;
    }

    /**
     * Returns the id of the node named {@code displayName} (optionally qualified), creating an
     * individual node with an empty basic morph when none exists yet. Idempotent.
     */
    public String resolveOrCreate(String displayName, String qualifier) {
        String id = GraphIds.nodeId(displayName, qualifier);
        Optional<Node> existing = graph.node(id);
        if (existing.isPresent()) {
            return id;
        }
        return graph.write(() -> {
            if (graph.node(id).isPresent()) {
                return id;
            }
            graph.createNode(new Node(id, GraphIds.tidy(displayName), Optional.ofNullable(GraphIds.tidy(qualifier)),
                    Optional.empty(), NodeRole.INDIVIDUAL, Optional.empty(), Optional.empty(), List.of(), null, 0L));
            LOG.log(Level.FINE, "Created node {0} in graph {1}", new Object[]{id, graph.getGraphId()});
            return id;
        });
    }

    public String resolveOrCreate(String displayName) {
        return resolveOrCreate(displayName, null);
    }

    public Optional<Node> resolve(String displayName, String qualifier) {
        return graph.node(GraphIds.nodeId(displayName, qualifier));
    }

    public Node get(String nodeId) {
        return graph.requireNode(nodeId);
    }

    /**
     * Case-insensitive substring match over node id and display name, ordered by id.
     * A blank query lists every node.
     */
    public List<Node> search(String text) {
        String needle = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        String idNeedle = needle.isEmpty() ? "" : GraphIds.normalize(needle);
        List<Node> out = new ArrayList<>();
        for (Node n : graph.nodes()) {
            if (needle.isEmpty()
                    || n.id().contains(idNeedle)
                    || n.displayName().toLowerCase(Locale.ROOT).contains(needle)) {
                out.add(n);
            }
        }
        out.sort(Comparator.comparing(Node::id));
        return out;
    }

    public Node create(NodeDraft draft) {
        if (draft == null || draft.name() == null || draft.name().isBlank()) {
            throw new IllegalArgumentException("A node must have a name");
        }
        requireKnownNodeType(draft.nodeType());
        String id = GraphIds.nodeId(draft.name(), draft.qualifier());
        return graph.write(() -> {
            if (graph.node(id).isPresent()) {
                throw new DuplicateException(id, "graph " + graph.getGraphId());
            }
            Node created = graph.createNode(new Node(id, GraphIds.tidy(draft.name()),
                    Optional.ofNullable(GraphIds.tidy(draft.qualifier())),
                    Optional.ofNullable(draft.quantifier()),
                    draft.role(),
                    Optional.ofNullable(draft.nodeType()),
                    Optional.ofNullable(draft.description()),
                    List.of(), null, 0L));
            LOG.log(Level.FINE, "Created node {0} in graph {1}", new Object[]{id, graph.getGraphId()});
            return created;
        });
    }

    public Node update(String nodeId, NodePatch patch, Long expectedVersion) {
        if (patch == null) {
            return get(nodeId);
        }
        if (patch.nodeType() != null && !patch.nodeType().isBlank()) {
            requireKnownNodeType(patch.nodeType());
        }
        return graph.mutate(nodeId, expectedVersion, () -> {
            Node node = graph.requireNode(nodeId);
            Node updated = node.withDetails(
                    patch.role() != null ? patch.role() : node.role(),
                    patch.nodeType() != null ? Optional.of(patch.nodeType()) : node.nodeType(),
                    patch.description() != null ? Optional.of(patch.description()) : node.description(),
                    patch.quantifier() != null ? Optional.of(patch.quantifier()) : node.quantifier());
            graph.putNode(updated.withVersion(node.version() + 1));
            return graph.requireNode(nodeId);
        });
    }

    /**
     * Deletes a node and its morphs. Edges listed by its morphs, and every relation pointing at
     * it, are purged from the whole graph. Refused while a transition names the node.
     */
    public void delete(String nodeId, Long expectedVersion) {
        graph.mutate(nodeId, expectedVersion, () -> {
            Node node = graph.requireNode(nodeId);
            for (Transition t : graph.transitions()) {
                if (t.references(nodeId)) {
                    throw ReferentialException.dangling(nodeId,
                            "Node '" + nodeId + "' is referenced by transition '" + t.id() + "'");
                }
            }
            Set<String> doomed = new LinkedHashSet<>();
            for (String morphId : node.morphIds()) {
                graph.morph(morphId).ifPresent(m -> doomed.addAll(m.allRefs()));
            }
            EdgeStore store = graph.edgeStore();
            store.listOutgoing(nodeId).forEach(e -> doomed.add(e.id()));
            store.listIncoming(nodeId).forEach(e -> doomed.add(e.id()));
            store.listAttributesOf(nodeId).forEach(e -> doomed.add(e.id()));
            for (String edgeId : doomed) {
                graph.purgeEdge(edgeId);
            }
            graph.removeNode(nodeId);
            LOG.log(Level.FINE, "Deleted node {0} and {1} edges", new Object[]{nodeId, doomed.size()});
            return null;
        });
    }

    /** Sets the node type from a heading when the node has none or it differs. */
    public void assignNodeType(String nodeId, String nodeType) {
        if (nodeType == null || nodeType.isBlank()) return;
        requireKnownNodeType(nodeType);
        graph.write(() -> {
            Node node = graph.requireNode(nodeId);
            if (!node.nodeType().equals(Optional.of(nodeType))) {
                graph.putNode(node.withDetails(roleFor(nodeType, node.role()), Optional.of(nodeType),
                        node.description(), node.quantifier()).withVersion(node.version() + 1));
            }
            return null;
        });
    }

    /** Records heading details (quantifier, description) without touching the version when unchanged. */
    public void describe(String nodeId, String quantifier, String description) {
        graph.write(() -> {
            Node node = graph.requireNode(nodeId);
            Optional<String> q = quantifier == null ? node.quantifier() : Optional.of(quantifier);
            Optional<String> d = description == null ? node.description() : Optional.of(description);
            Node updated = node.withDetails(node.role(), node.nodeType(), d, q);
            if (!updated.equals(node)) {
                graph.putNode(updated.withVersion(node.version() + 1));
            }
            return null;
        });
    }

    private NodeRole roleFor(String nodeType, NodeRole current) {
        if (schema.isSubtypeOf(nodeType, "Process")) return NodeRole.PROCESS;
        if (schema.isSubtypeOf(nodeType, "Function")) return NodeRole.FUNCTION;
        return current;
    }

    private void requireKnownNodeType(String nodeType) {
        if (nodeType != null && !nodeType.isBlank() && schema.nodeType(nodeType).isEmpty()) {
            throw ReferentialException.notFound("Node type", nodeType);
        }
    }
}
