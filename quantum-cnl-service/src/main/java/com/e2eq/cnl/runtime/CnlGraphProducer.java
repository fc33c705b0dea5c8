package com.e2eq.cnl.runtime;

import com.e2eq.cnl.compose.ScoreCategory;
import com.e2eq.cnl.compose.ScoreRubric;
import com.e2eq.cnl.config.CnlGraphConfig;
import com.e2eq.cnl.schema.SchemaRegistry;
import com.e2eq.cnl.schema.YamlSchemaLoader;
import com.e2eq.cnl.workspace.CnlGraphSettings;
import com.e2eq.cnl.workspace.GraphWorkspaces;
import io.quarkus.logging.Log;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import java.io.IOException;

/**
 * Loads the global schema tier from the classpath and exposes it, together with the
 * per-user graph workspaces, for injection.
 */
@ApplicationScoped
public class CnlGraphProducer {

    private final CnlGraphConfig config;

    private SchemaRegistry globalSchema;
    private GraphWorkspaces workspaces;

    @Inject
    public CnlGraphProducer(CnlGraphConfig config) {
        this.config = config;
    }

    @PostConstruct
    void init() {
        CnlGraphSettings settings = toSettings(config);
        this.globalSchema = loadGlobalSchema(settings.globalSchemaResource());
        this.workspaces = new GraphWorkspaces(globalSchema, settings);
        Log.infof("CNL graph service ready: %d node types, %d relation types, %d attribute types in the global schema",
                globalSchema.nodeTypes().size(), globalSchema.relationTypes().size(), globalSchema.attributeTypes().size());
    }

    @Produces
    public SchemaRegistry globalSchema() {
        return globalSchema;
    }

    @Produces
    public GraphWorkspaces workspaces() {
        return workspaces;
    }

    static SchemaRegistry loadGlobalSchema(String location) {
        try {
            return SchemaRegistry.inMemory(new YamlSchemaLoader().loadFromClasspath(location));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load global schema from " + location, e);
        }
    }

    static CnlGraphSettings toSettings(CnlGraphConfig config) {
        CnlGraphConfig.Scoring s = config.scoring();
        ScoreRubric rubric = ScoreRubric.defaults()
                .withWeight(ScoreCategory.NODE, s.node())
                .withWeight(ScoreCategory.RELATION, s.relation())
                .withWeight(ScoreCategory.ATTRIBUTE, s.attribute())
                .withWeight(ScoreCategory.ATTRIBUTE_WITH_UNIT, s.attributeWithUnit())
                .withWeight(ScoreCategory.RELATION_WITH_QUALIFIER, s.relationWithQualifier())
                .withWeight(ScoreCategory.ATTRIBUTE_WITH_QUALIFIER, s.attributeWithQualifier())
                .withWeight(ScoreCategory.QUANTIFIED, s.quantified())
                .withWeight(ScoreCategory.MODALITY, s.modality())
                .withWeight(ScoreCategory.TRANSITION_NODE, s.transitionNode())
                .withWeight(ScoreCategory.FUNCTION_NODE, s.functionNode())
                .withWeight(ScoreCategory.POLY_NODE_MORPH, s.polyNodeMorph())
                .withWeight(ScoreCategory.CROSS_GRAPH_REUSE, s.crossGraphReuse());
        return CnlGraphSettings.builder()
                .globalSchemaResource(config.globalSchema())
                .typeDeletionPolicy(config.typeDeletionPolicy())
                .transitionCyclePolicy(config.transitionCyclePolicy())
                .materializeInverses(config.materializeInverses())
                .scoreRubric(rubric)
                .build();
    }
}
