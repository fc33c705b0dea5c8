package com.e2eq.cnl.workspace;

import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.schema.SchemaRegistry;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workspaces by user id, all sharing one global schema tier and one set of settings.
 */
public class GraphWorkspaces {

    private final SchemaRegistry globalSchema;
    private final CnlGraphSettings settings;
    private final Map<String, GraphWorkspace> workspaces = new ConcurrentHashMap<>();

    public GraphWorkspaces(SchemaRegistry globalSchema, CnlGraphSettings settings) {
        this.globalSchema = globalSchema;
        this.settings = settings;
    }

    /** Returns the user's workspace, creating it on first use. */
    public GraphWorkspace forUser(String userId) {
        return workspaces.computeIfAbsent(userId, id -> new GraphWorkspace(id, globalSchema, settings));
    }

    public Optional<GraphWorkspace> find(String userId) {
        return Optional.ofNullable(workspaces.get(userId));
    }

    /** Returns the graph, creating the workspace and the graph when missing. Only for writes. */
    public GraphContext open(String userId, String graphId) {
        return forUser(userId).graph(graphId);
    }

    /**
     * Returns an existing graph without creating anything.
     *
     * @throws ReferentialException NOT_FOUND when the user or the graph is unknown
     */
    public GraphContext require(String userId, String graphId) {
        return requireWorkspace(userId, graphId).require(graphId);
    }

    /** The workspace owning an existing graph. */
    public GraphWorkspace requireWorkspace(String userId, String graphId) {
        return find(userId)
                .filter(ws -> ws.find(graphId).isPresent())
                .orElseThrow(() -> ReferentialException.notFound("Graph", graphId));
    }

    public SchemaRegistry globalSchema() {
        return globalSchema;
    }

    public CnlGraphSettings settings() {
        return settings;
    }
}
