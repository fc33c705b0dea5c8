package com.e2eq.cnl.workspace;

import com.e2eq.cnl.schema.SchemaRegistry;
import com.e2eq.cnl.schema.SchemaRegistry.SchemaDefs;
import com.e2eq.cnl.schema.TieredSchemaRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON export and import of a {@link GraphContext}: user schema tier, nodes, morphs, edges,
 * transitions and document text. The global tier is not part of a snapshot.
 */
public class GraphSnapshotCodec {
    private static final Logger LOG = Logger.getLogger(GraphSnapshotCodec.class.getName());

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public GraphSnapshot snapshot(GraphContext context) {
        return context.graph().read(() -> new GraphSnapshot(
                GraphSnapshot.FORMAT_VERSION,
                context.getGraphId(),
                context.schema().userDefs(),
                context.graph().nodes(),
                context.graph().morphs(),
                context.graph().relations(),
                context.graph().attributes(),
                context.graph().transitions(),
                context.loadDocument()));
    }

    public String export(GraphContext context) {
        try {
            return mapper.writeValueAsString(snapshot(context));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export graph " + context.getGraphId(), e);
        }
    }

    public GraphContext restore(String json, SchemaRegistry globalSchema, CnlGraphSettings settings) {
        GraphSnapshot snapshot;
        try {
            snapshot = mapper.readValue(json, GraphSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid graph snapshot", e);
        }
        if (snapshot.formatVersion() != GraphSnapshot.FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported snapshot format " + snapshot.formatVersion());
        }
        SchemaDefs user = snapshot.userSchema() == null ? SchemaDefs.empty() : snapshot.userSchema();
        GraphContext context = new GraphContext(snapshot.graphId(), new TieredSchemaRegistry(globalSchema, user), settings);
        context.graph().write(() -> {
            context.graph().restore(orEmpty(snapshot.nodes()), orEmpty(snapshot.morphs()), orEmpty(snapshot.relations()),
                    orEmpty(snapshot.attributes()), orEmpty(snapshot.transitions()));
            return null;
        });
        context.restoreDocument(snapshot.document());
        LOG.log(Level.INFO, "Restored graph {0}: {1} nodes", new Object[]{snapshot.graphId(), orEmpty(snapshot.nodes()).size()});
        return context;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
