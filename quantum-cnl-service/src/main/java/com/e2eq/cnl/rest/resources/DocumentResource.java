package com.e2eq.cnl.rest.resources;

import com.e2eq.cnl.compiler.ApplyReport;
import com.e2eq.cnl.parser.CnlDocument;
import com.e2eq.cnl.parser.CnlDocumentParser;
import com.e2eq.cnl.workspace.GraphContext;
import com.e2eq.cnl.workspace.GraphWorkspaces;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

@ApplicationScoped
@Path("users/{userId}/graphs/{graphId}/document")
@Tag(name = "Document", description = "Load, save and parse the CNL text of a graph")
public class DocumentResource {
    private static final Logger LOG = Logger.getLogger(DocumentResource.class);

    private final GraphWorkspaces workspaces;

    @Inject
    public DocumentResource(GraphWorkspaces workspaces) {
        this.workspaces = workspaces;
    }

    @GET
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "Raw document text last saved for the graph")
    public String load(@PathParam("userId") String userId, @PathParam("graphId") String graphId) {
        return context(userId, graphId).loadDocument();
    }

    @PUT
    @Consumes(MediaType.TEXT_PLAIN)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Save the document and apply it to the graph")
    public ApplyReport save(@PathParam("userId") String userId, @PathParam("graphId") String graphId, String text) {
        ApplyReport report = workspaces.open(userId, graphId).saveDocument(text);
        LOG.debugf("Saved document of %s/%s: %d applied", userId, graphId, report.appliedCount());
        return report;
    }

    @POST
    @Path("parse")
    @Consumes(MediaType.TEXT_PLAIN)
    @Produces(MediaType.APPLICATION_JSON)
    @Operation(summary = "Parse a document without applying it")
    public CnlDocument parse(@PathParam("userId") String userId, @PathParam("graphId") String graphId, String text) {
        return new CnlDocumentParser().parse(text);
    }

    @GET
    @Path("rendered")
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "Render the stored graph back into CNL")
    public String rendered(@PathParam("userId") String userId, @PathParam("graphId") String graphId) {
        return context(userId, graphId).graphRenderer().renderGraph();
    }

    @GET
    @Path("canonical")
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(summary = "The saved document with canonical statement lines")
    public String canonical(@PathParam("userId") String userId, @PathParam("graphId") String graphId) {
        return context(userId, graphId).canonicalDocument();
    }

    private GraphContext context(String userId, String graphId) {
        return workspaces.require(userId, graphId);
    }
}
