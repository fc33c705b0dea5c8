package com.e2eq.cnl.workspace;

import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.graph.Node;
import com.e2eq.cnl.schema.SchemaRegistry;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The graphs of one user. Node ids are scoped per graph; a node id that appears in several
 * graphs of the same user counts as cross-graph reuse.
 */
public class GraphWorkspace {
    private static final Logger LOG = Logger.getLogger(GraphWorkspace.class.getName());

    private final String userId;
    private final SchemaRegistry globalSchema;
    private final CnlGraphSettings settings;
    private final Map<String, GraphContext> graphs = new ConcurrentHashMap<>();

    public GraphWorkspace(String userId, SchemaRegistry globalSchema, CnlGraphSettings settings) {
        this.userId = userId;
        this.globalSchema = globalSchema;
        this.settings = settings;
    }

    public String getUserId() {
        return userId;
    }

    /** Returns the graph, creating an empty one on first use. */
    public GraphContext graph(String graphId) {
        return graphs.computeIfAbsent(graphId, id -> {
            LOG.log(Level.FINE, "Opened graph {0} for user {1}", new Object[]{id, userId});
            return new GraphContext(id, globalSchema, settings);
        });
    }

    public Optional<GraphContext> find(String graphId) {
        return Optional.ofNullable(graphs.get(graphId));
    }

    public GraphContext require(String graphId) {
        return find(graphId).orElseThrow(() -> ReferentialException.notFound("Graph", graphId));
    }

    /** Registers a graph built elsewhere, for example restored from a snapshot. */
    public void put(GraphContext context) {
        graphs.put(context.getGraphId(), context);
    }

    public void delete(String graphId) {
        if (graphs.remove(graphId) == null) {
            throw ReferentialException.notFound("Graph", graphId);
        }
    }

    public List<String> graphIds() {
        List<String> ids = new ArrayList<>(graphs.keySet());
        Collections.sort(ids);
        return ids;
    }

    /** Number of nodes of {@code graphId} whose id also exists in another graph of this user. */
    public int crossGraphReuse(String graphId) {
        GraphContext self = require(graphId);
        Set<String> elsewhere = new HashSet<>();
        for (Map.Entry<String, GraphContext> e : graphs.entrySet()) {
            if (e.getKey().equals(graphId)) continue;
            for (Node n : e.getValue().graph().nodes()) {
                elsewhere.add(n.id());
            }
        }
        int count = 0;
        for (Node n : self.graph().nodes()) {
            if (elsewhere.contains(n.id())) count++;
        }
        return count;
    }
}
