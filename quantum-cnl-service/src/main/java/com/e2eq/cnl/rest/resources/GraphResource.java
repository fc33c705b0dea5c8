package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.compose.ComposedView;
import com.e2eq.cnl.compose.GraphScore;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.graph.EdgeKind;
import com.e2eq.cnl.rest.models.AttributeWrite;
import com.e2eq.cnl.rest.models.IdResponse;
import com.e2eq.cnl.rest.models.RelationWrite;
import com.e2eq.cnl.workspace.GraphContext;
import com.e2eq.cnl.workspace.GraphWorkspace;
import com.e2eq.cnl.workspace.GraphWorkspaces;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.Set;

@ApplicationScoped
@Path("users/{userId}/graphs/{graphId}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "Graph", description = "Composed view, score and edges of a graph")
public class GraphResource {

    private final GraphWorkspaces workspaces;

    @Inject
    public GraphResource(GraphWorkspaces workspaces) {
        this.workspaces = workspaces;
    }

    @GET
    @Path("composed")
    @Operation(summary = "Composed view; nbh=node:morph,... overrides the active morph of nodes")
    public ComposedView composed(@PathParam("userId") String userId,
                                 @PathParam("graphId") String graphId,
                                 @QueryParam("nbh") String nbh) {
        return context(userId, graphId).compose(NbhParam.parse(nbh));
    }

    @GET
    @Path("score")
    @Operation(summary = "Score of the composed view, including reuse of node ids across the user's graphs")
    public GraphScore score(@PathParam("userId") String userId,
                            @PathParam("graphId") String graphId,
                            @QueryParam("nbh") String nbh) {
        GraphWorkspace workspace = workspaces.requireWorkspace(userId, graphId);
        GraphContext context = workspace.require(graphId);
        return context.score(NbhParam.parse(nbh), workspace.crossGraphReuse(graphId));
    }

    @PUT
    @Path("relations")
    @Operation(summary = "Upsert a relation edge")
    public IdResponse upsertRelation(@PathParam("userId") String userId,
                                     @PathParam("graphId") String graphId,
                                     @QueryParam("expectedVersion") Long expectedVersion,
                                     RelationWrite body) {
        String id = context(userId, graphId).compiler()
                .applyStatement(body.sourceId(), body.morphId(), body.toStatement(), expectedVersion);
        return new IdResponse(id);
    }

    @PUT
    @Path("attributes")
    @Operation(summary = "Upsert an attribute edge")
    public IdResponse upsertAttribute(@PathParam("userId") String userId,
                                      @PathParam("graphId") String graphId,
                                      @QueryParam("expectedVersion") Long expectedVersion,
                                      AttributeWrite body) {
        String id = context(userId, graphId).compiler()
                .applyStatement(body.ownerId(), body.morphId(), body.toStatement(), expectedVersion);
        return new IdResponse(id);
    }

    @GET
    @Path("edges/{edgeId}")
    @Operation(summary = "A relation or attribute edge by id")
    public Object edge(@PathParam("userId") String userId,
                       @PathParam("graphId") String graphId,
                       @PathParam("edgeId") String edgeId) {
        GraphContext context = context(userId, graphId);
        EdgeKind kind = context.graph().kindOf(edgeId)
                .orElseThrow(() -> ReferentialException.notFound("Edge", edgeId));
        if (kind == EdgeKind.RELATION) {
            return context.graph().relation(edgeId).orElseThrow();
        }
        return context.graph().attribute(edgeId).orElseThrow();
    }

    @GET
    @Path("edges/{edgeId}/referrers")
    @Operation(summary = "Morphs listing the edge")
    public Set<String> referrers(@PathParam("userId") String userId,
                                 @PathParam("graphId") String graphId,
                                 @PathParam("edgeId") String edgeId) {
        return context(userId, graphId).morphs().referrersOf(edgeId);
    }

    @DELETE
    @Path("edges/{edgeId}")
    @Operation(summary = "Delete the edge from every morph of the graph")
    public Set<String> deleteEdge(@PathParam("userId") String userId,
                                  @PathParam("graphId") String graphId,
                                  @PathParam("edgeId") String edgeId) {
        return context(userId, graphId).morphs().deleteEdgeEverywhere(edgeId);
    }

    private GraphContext context(String userId, String graphId) {
        return workspaces.require(userId, graphId);
    }
}
