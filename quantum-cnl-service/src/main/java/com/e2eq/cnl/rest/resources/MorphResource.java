package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.morph.MorphManager;
import com.e2eq.cnl.rest.models.RefRequest;
import com.e2eq.cnl.rest.models.UnlistResponse;
import com.e2eq.cnl.workspace.GraphWorkspaces;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.resteasy.reactive.ResponseStatus;

@ApplicationScoped
@Path("users/{userId}/graphs/{graphId}/morphs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "Morphs", description = "Edge references held by morphs")
public class MorphResource {

    private final GraphWorkspaces workspaces;

    @Inject
    public MorphResource(GraphWorkspaces workspaces) {
        this.workspaces = workspaces;
    }

    @DELETE
    @Path("{morphId}")
    @ResponseStatus(204)
    @Operation(summary = "Delete a morph; edges no other morph lists are removed with it")
    public void delete(@PathParam("userId") String userId,
                       @PathParam("graphId") String graphId,
                       @PathParam("morphId") String morphId,
                       @QueryParam("expectedVersion") Long expectedVersion) {
        morphs(userId, graphId).deleteMorph(morphId, expectedVersion);
    }

    @POST
    @Path("refs/copy")
    @ResponseStatus(204)
    @Operation(summary = "List an edge on another morph of the same node")
    public void copy(@PathParam("userId") String userId,
                     @PathParam("graphId") String graphId,
                     @QueryParam("expectedVersion") Long expectedVersion,
                     RefRequest request) {
        morphs(userId, graphId).copyRef(request.edgeId(), request.fromMorphId(), request.toMorphId(), expectedVersion);
    }

    @POST
    @Path("refs/move")
    @ResponseStatus(204)
    @Operation(summary = "Move an edge from one morph to another of the same node")
    public void move(@PathParam("userId") String userId,
                     @PathParam("graphId") String graphId,
                     @QueryParam("expectedVersion") Long expectedVersion,
                     RefRequest request) {
        morphs(userId, graphId).moveRef(request.edgeId(), request.fromMorphId(), request.toMorphId(), expectedVersion);
    }

    @POST
    @Path("refs/unlist")
    @Operation(summary = "Drop an edge from one morph; the edge is purged when no morph lists it anymore")
    public UnlistResponse unlist(@PathParam("userId") String userId,
                                 @PathParam("graphId") String graphId,
                                 @QueryParam("expectedVersion") Long expectedVersion,
                                 RefRequest request) {
        boolean purged = morphs(userId, graphId).unlistRef(request.edgeId(), request.fromMorphId(), expectedVersion);
        return new UnlistResponse(request.edgeId(), purged);
    }

    private MorphManager morphs(String userId, String graphId) {
        return workspaces.require(userId, graphId).morphs();
    }
}
