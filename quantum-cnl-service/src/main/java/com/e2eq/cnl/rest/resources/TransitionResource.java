package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.rest.models.IdResponse;
import com.e2eq.cnl.transition.Transition;
import com.e2eq.cnl.transition.TransitionDraft;
import com.e2eq.cnl.transition.TransitionEngine;
import com.e2eq.cnl.workspace.GraphWorkspaces;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.resteasy.reactive.ResponseStatus;

import java.util.List;

@ApplicationScoped
@Path("users/{userId}/graphs/{graphId}/transitions")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "Transitions", description = "Processes turning input node states into output node states")
public class TransitionResource {

    private final GraphWorkspaces workspaces;

    @Inject
    public TransitionResource(GraphWorkspaces workspaces) {
        this.workspaces = workspaces;
    }

    @GET
    @Operation(summary = "List transitions")
    public List<Transition> list(@PathParam("userId") String userId, @PathParam("graphId") String graphId) {
        return engine(userId, graphId).list();
    }

    @POST
    @ResponseStatus(201)
    @Operation(summary = "Create a transition")
    public IdResponse create(@PathParam("userId") String userId,
                             @PathParam("graphId") String graphId,
                             TransitionDraft draft) {
        return new IdResponse(engine(userId, graphId).create(draft));
    }

    @GET
    @Path("{id}")
    @Operation(summary = "Transition by id")
    public Transition get(@PathParam("userId") String userId,
                          @PathParam("graphId") String graphId,
                          @PathParam("id") String id) {
        return engine(userId, graphId).get(id);
    }

    @PUT
    @Path("{id}")
    @Operation(summary = "Replace a transition")
    public Transition update(@PathParam("userId") String userId,
                             @PathParam("graphId") String graphId,
                             @PathParam("id") String id,
                             TransitionDraft draft) {
        return engine(userId, graphId).update(id, draft);
    }

    @DELETE
    @Path("{id}")
    @ResponseStatus(204)
    @Operation(summary = "Delete a transition")
    public void delete(@PathParam("userId") String userId,
                       @PathParam("graphId") String graphId,
                       @PathParam("id") String id) {
        engine(userId, graphId).delete(id);
    }

    private TransitionEngine engine(String userId, String graphId) {
        return workspaces.require(userId, graphId).transitions();
    }
}
