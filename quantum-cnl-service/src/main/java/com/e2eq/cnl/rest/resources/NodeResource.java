package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.graph.Morph;
import com.e2eq.cnl.graph.Node;
import com.e2eq.cnl.graph.NodeDraft;
import com.e2eq.cnl.graph.NodePatch;
import com.e2eq.cnl.rest.models.ActiveMorphRequest;
import com.e2eq.cnl.rest.models.IdResponse;
import com.e2eq.cnl.rest.models.MorphRequest;
import com.e2eq.cnl.rest.models.ResolveRequest;
import com.e2eq.cnl.workspace.GraphContext;
import com.e2eq.cnl.workspace.GraphWorkspaces;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.ResponseStatus;

import java.util.List;

@ApplicationScoped
@Path("users/{userId}/graphs/{graphId}/nodes")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "Nodes", description = "Nodes of a graph and their morphs")
public class NodeResource {
    private static final Logger LOG = Logger.getLogger(NodeResource.class);

    private final GraphWorkspaces workspaces;

    @Inject
    public NodeResource(GraphWorkspaces workspaces) {
        this.workspaces = workspaces;
    }

    @POST
    @ResponseStatus(201)
    @Operation(summary = "Create a node; fails when the normalized id already exists")
    public Node create(@PathParam("userId") String userId,
                       @PathParam("graphId") String graphId,
                       NodeDraft draft) {
        Node node = workspaces.open(userId, graphId).nodes().create(draft);
        LOG.debugf("Created node %s in %s/%s", node.id(), userId, graphId);
        return node;
    }

    @GET
    @Operation(summary = "Search nodes by name or id; all nodes without a search term")
    public List<Node> search(@PathParam("userId") String userId,
                             @PathParam("graphId") String graphId,
                             @QueryParam("search") String search) {
        return context(userId, graphId).nodes().search(search);
    }

    @POST
    @Path("resolve")
    @Operation(summary = "Id of the node for a display name, created when missing")
    public IdResponse resolve(@PathParam("userId") String userId,
                              @PathParam("graphId") String graphId,
                              ResolveRequest request) {
        return new IdResponse(workspaces.open(userId, graphId).nodes().resolveOrCreate(request.name(), request.qualifier()));
    }

    @GET
    @Path("{id}")
    @Operation(summary = "Node by id")
    public Node get(@PathParam("userId") String userId,
                    @PathParam("graphId") String graphId,
                    @PathParam("id") String id) {
        return context(userId, graphId).nodes().get(id);
    }

    @PATCH
    @Path("{id}")
    @Operation(summary = "Update role, type, description or quantifier of a node")
    public Node update(@PathParam("userId") String userId,
                       @PathParam("graphId") String graphId,
                       @PathParam("id") String id,
                       @QueryParam("expectedVersion") Long expectedVersion,
                       NodePatch patch) {
        return context(userId, graphId).nodes().update(id, patch, expectedVersion);
    }

    @DELETE
    @Path("{id}")
    @ResponseStatus(204)
    @Operation(summary = "Delete a node with its morphs and every edge touching it")
    public void delete(@PathParam("userId") String userId,
                       @PathParam("graphId") String graphId,
                       @PathParam("id") String id,
                       @QueryParam("expectedVersion") Long expectedVersion) {
        context(userId, graphId).nodes().delete(id, expectedVersion);
    }

    @GET
    @Path("{id}/morphs")
    @Operation(summary = "Morphs of a node")
    public List<Morph> morphs(@PathParam("userId") String userId,
                              @PathParam("graphId") String graphId,
                              @PathParam("id") String id) {
        GraphContext context = context(userId, graphId);
        context.nodes().get(id);
        return context.graph().morphsOf(id);
    }

    @POST
    @Path("{id}/morphs")
    @ResponseStatus(201)
    @Operation(summary = "Add a morph, optionally seeded with the edges of another morph")
    public IdResponse addMorph(@PathParam("userId") String userId,
                               @PathParam("graphId") String graphId,
                               @PathParam("id") String id,
                               @QueryParam("expectedVersion") Long expectedVersion,
                               MorphRequest request) {
        return new IdResponse(context(userId, graphId).morphs()
                .addMorph(id, request.name(), request.seedFrom(), expectedVersion));
    }

    @PUT
    @Path("{id}/active")
    @Operation(summary = "Switch the active morph of a node")
    public Node switchActive(@PathParam("userId") String userId,
                             @PathParam("graphId") String graphId,
                             @PathParam("id") String id,
                             ActiveMorphRequest request) {
        return context(userId, graphId).morphs().switchActive(id, request.morphId());
    }

    @POST
    @Path("{id}/statements")
    @Consumes(MediaType.TEXT_PLAIN)
    @Operation(summary = "Parse one notation line and write it for the node")
    public IdResponse applyLine(@PathParam("userId") String userId,
                                @PathParam("graphId") String graphId,
                                @PathParam("id") String id,
                                @QueryParam("morphId") String morphId,
                                @QueryParam("expectedVersion") Long expectedVersion,
                                String line) {
        return new IdResponse(context(userId, graphId).compiler().applyLine(id, morphId, line, expectedVersion));
    }

    private GraphContext context(String userId, String graphId) {
        return workspaces.require(userId, graphId);
    }
}
