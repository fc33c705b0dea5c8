package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.rest.models.SchemaVersion;
import com.e2eq.cnl.schema.SchemaRegistry.AttributeTypeDef;
import com.e2eq.cnl.schema.SchemaRegistry.NodeTypeDef;
import com.e2eq.cnl.schema.SchemaRegistry.RelationTypeDef;
import com.e2eq.cnl.schema.SchemaService;
import com.e2eq.cnl.schema.SchemaTier;
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

/**
 * Schema CRUD for one graph. Global types are read only; everything written lands in the
 * graph's user tier.
 */
@ApplicationScoped
@Path("users/{userId}/graphs/{graphId}/schema")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
@Tag(name = "Schema", description = "Node, relation and attribute types of a graph")
public class SchemaResource {
    private static final Logger LOG = Logger.getLogger(SchemaResource.class);

    private final GraphWorkspaces workspaces;

    @Inject
    public SchemaResource(GraphWorkspaces workspaces) {
        this.workspaces = workspaces;
    }

    @GET
    @Path("version")
    @Operation(summary = "Hash of the merged schema")
    public SchemaVersion version(@PathParam("userId") String userId, @PathParam("graphId") String graphId) {
        return new SchemaVersion(service(userId, graphId).version());
    }

    // node types

    @GET
    @Path("nodeTypes")
    @Operation(summary = "List node types, optionally of one tier")
    public List<NodeTypeDef> listNodeTypes(@PathParam("userId") String userId,
                                           @PathParam("graphId") String graphId,
                                           @QueryParam("tier") SchemaTier tier) {
        return service(userId, graphId).listNodeTypes(tier);
    }

    @POST
    @Path("nodeTypes")
    @ResponseStatus(201)
    @Operation(summary = "Create a user node type")
    public NodeTypeDef createNodeType(@PathParam("userId") String userId,
                                      @PathParam("graphId") String graphId,
                                      NodeTypeDef def) {
        LOG.debugf("Creating node type %s in %s/%s", def.name(), userId, graphId);
        return workspaces.open(userId, graphId).schemaService().createNodeType(def);
    }

    @PUT
    @Path("nodeTypes/{name}")
    @Operation(summary = "Replace a user node type")
    public NodeTypeDef updateNodeType(@PathParam("userId") String userId,
                                      @PathParam("graphId") String graphId,
                                      @PathParam("name") String name,
                                      NodeTypeDef def) {
        return service(userId, graphId).updateNodeType(name, def);
    }

    @DELETE
    @Path("nodeTypes/{name}")
    @ResponseStatus(204)
    @Operation(summary = "Delete a user node type")
    public void deleteNodeType(@PathParam("userId") String userId,
                               @PathParam("graphId") String graphId,
                               @PathParam("name") String name) {
        service(userId, graphId).deleteNodeType(name);
    }

    // relation types

    @GET
    @Path("relationTypes")
    @Operation(summary = "List relation types, optionally of one tier")
    public List<RelationTypeDef> listRelationTypes(@PathParam("userId") String userId,
                                                   @PathParam("graphId") String graphId,
                                                   @QueryParam("tier") SchemaTier tier) {
        return service(userId, graphId).listRelationTypes(tier);
    }

    @POST
    @Path("relationTypes")
    @ResponseStatus(201)
    @Operation(summary = "Create a user relation type")
    public RelationTypeDef createRelationType(@PathParam("userId") String userId,
                                              @PathParam("graphId") String graphId,
                                              RelationTypeDef def) {
        LOG.debugf("Creating relation type %s in %s/%s", def.name(), userId, graphId);
        return workspaces.open(userId, graphId).schemaService().createRelationType(def);
    }

    @PUT
    @Path("relationTypes/{name}")
    @Operation(summary = "Replace a user relation type")
    public RelationTypeDef updateRelationType(@PathParam("userId") String userId,
                                              @PathParam("graphId") String graphId,
                                              @PathParam("name") String name,
                                              RelationTypeDef def) {
        return service(userId, graphId).updateRelationType(name, def);
    }

    @DELETE
    @Path("relationTypes/{name}")
    @ResponseStatus(204)
    @Operation(summary = "Delete a user relation type")
    public void deleteRelationType(@PathParam("userId") String userId,
                                   @PathParam("graphId") String graphId,
                                   @PathParam("name") String name) {
        service(userId, graphId).deleteRelationType(name);
    }

    // attribute types

    @GET
    @Path("attributeTypes")
    @Operation(summary = "List attribute types, optionally of one tier")
    public List<AttributeTypeDef> listAttributeTypes(@PathParam("userId") String userId,
                                                     @PathParam("graphId") String graphId,
                                                     @QueryParam("tier") SchemaTier tier) {
        return service(userId, graphId).listAttributeTypes(tier);
    }

    @POST
    @Path("attributeTypes")
    @ResponseStatus(201)
    @Operation(summary = "Create a user attribute type")
    public AttributeTypeDef createAttributeType(@PathParam("userId") String userId,
                                                @PathParam("graphId") String graphId,
                                                AttributeTypeDef def) {
        LOG.debugf("Creating attribute type %s in %s/%s", def.name(), userId, graphId);
        return workspaces.open(userId, graphId).schemaService().createAttributeType(def);
    }

    @PUT
    @Path("attributeTypes/{name}")
    @Operation(summary = "Replace a user attribute type")
    public AttributeTypeDef updateAttributeType(@PathParam("userId") String userId,
                                                @PathParam("graphId") String graphId,
                                                @PathParam("name") String name,
                                                AttributeTypeDef def) {
        return service(userId, graphId).updateAttributeType(name, def);
    }

    @DELETE
    @Path("attributeTypes/{name}")
    @ResponseStatus(204)
    @Operation(summary = "Delete a user attribute type")
    public void deleteAttributeType(@PathParam("userId") String userId,
                                    @PathParam("graphId") String graphId,
                                    @PathParam("name") String name) {
        service(userId, graphId).deleteAttributeType(name);
    }

    private SchemaService service(String userId, String graphId) {
        return workspaces.require(userId, graphId).schemaService();
    }
}
