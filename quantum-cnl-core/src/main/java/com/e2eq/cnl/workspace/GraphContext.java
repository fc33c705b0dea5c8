package com.e2eq.cnl.workspace;

import com.e2eq.cnl.compiler.ApplyReport;
import com.e2eq.cnl.compiler.CnlGraphCompiler;
import com.e2eq.cnl.compiler.GraphCnlRenderer;
import com.e2eq.cnl.compose.ComposedView;
import com.e2eq.cnl.compose.CompositionEngine;
import com.e2eq.cnl.compose.GraphScore;
import com.e2eq.cnl.compose.ScoringEngine;
import com.e2eq.cnl.graph.KnowledgeGraph;
import com.e2eq.cnl.graph.NodeRegistry;
import com.e2eq.cnl.morph.MorphManager;
import com.e2eq.cnl.parser.CnlDocument;
import com.e2eq.cnl.parser.CnlDocumentParser;
import com.e2eq.cnl.parser.CnlRenderer;
import com.e2eq.cnl.schema.SchemaRegistry;
import com.e2eq.cnl.schema.SchemaService;
import com.e2eq.cnl.schema.TieredSchemaRegistry;
import com.e2eq.cnl.transition.TransitionEngine;
import com.e2eq.cnl.validation.StatementValidator;

import java.util.Map;

/**
 * Everything one user graph needs, wired together explicitly: its schema tiers, the graph
 * arena and the components operating on it. Also holds the raw document text last saved for
 * this graph.
 */
public class GraphContext {

    private final String graphId;
    private final CnlGraphSettings settings;
    private final TieredSchemaRegistry schema;
    private final KnowledgeGraph graph;
    private final NodeRegistry nodes;
    private final MorphManager morphs;
    private final TransitionEngine transitions;
    private final StatementValidator validator;
    private final CnlGraphCompiler compiler;
    private final SchemaService schemaService;
    private final CompositionEngine composition = new CompositionEngine();
    private final ScoringEngine scoring;
    private final GraphCnlRenderer graphRenderer;
    private volatile String documentText = "";

    public GraphContext(String graphId, SchemaRegistry globalSchema, CnlGraphSettings settings) {
        this(graphId, new TieredSchemaRegistry(globalSchema), settings);
    }

    public GraphContext(String graphId, TieredSchemaRegistry schema, CnlGraphSettings settings) {
        this.graphId = graphId;
        this.settings = settings == null ? CnlGraphSettings.defaults() : settings;
        this.schema = schema;
        this.graph = new KnowledgeGraph(graphId);
        this.nodes = new NodeRegistry(graph, schema);
        this.morphs = new MorphManager(graph);
        this.transitions = new TransitionEngine(graph, this.settings.transitionCyclePolicy());
        this.validator = new StatementValidator(schema, graph);
        this.compiler = new CnlGraphCompiler(graph, schema, nodes, morphs, validator, this.settings.materializeInverses());
        this.schemaService = new SchemaService(schema, graph, this.settings.typeDeletionPolicy());
        this.scoring = new ScoringEngine(this.settings.scoreRubric());
        this.graphRenderer = new GraphCnlRenderer(graph);
    }

    public String getGraphId() {
        return graphId;
    }

    public CnlGraphSettings settings() {
        return settings;
    }

    public TieredSchemaRegistry schema() {
        return schema;
    }

    public KnowledgeGraph graph() {
        return graph;
    }

    public NodeRegistry nodes() {
        return nodes;
    }

    public MorphManager morphs() {
        return morphs;
    }

    public TransitionEngine transitions() {
        return transitions;
    }

    public StatementValidator validator() {
        return validator;
    }

    public CnlGraphCompiler compiler() {
        return compiler;
    }

    public SchemaService schemaService() {
        return schemaService;
    }

    public GraphCnlRenderer graphRenderer() {
        return graphRenderer;
    }

    // ---- document load/save ----

    public String loadDocument() {
        return documentText;
    }

    /** Stores the text and applies it to the graph. */
    public ApplyReport saveDocument(String text) {
        String t = text == null ? "" : text;
        ApplyReport report = compiler.apply(t);
        documentText = t;
        return report;
    }

    public void restoreDocument(String text) {
        documentText = text == null ? "" : text;
    }

    public CnlDocument parseDocument(String text) {
        return new CnlDocumentParser().parse(text);
    }

    /** The stored text with canonical statement lines. */
    public String canonicalDocument() {
        return new CnlRenderer().render(parseDocument(documentText));
    }

    // ---- read model ----

    public ComposedView compose(Map<String, String> activeMorphPerNode) {
        return composition.compose(graph, activeMorphPerNode);
    }

    public GraphScore score(Map<String, String> activeMorphPerNode, int crossGraphReuseCount) {
        return scoring.score(compose(activeMorphPerNode), crossGraphReuseCount);
    }
}
