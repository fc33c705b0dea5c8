package com.e2eq.cnl.compiler;

import com.e2eq.cnl.exceptions.CnlGraphException;
import com.e2eq.cnl.exceptions.ReferentialException;
import com.e2eq.cnl.exceptions.StatementRejectedException;
import com.e2eq.cnl.graph.*;
import com.e2eq.cnl.morph.MorphManager;
import com.e2eq.cnl.parser.*;
import com.e2eq.cnl.schema.SchemaRegistry;
import com.e2eq.cnl.validation.StatementValidator;
import com.e2eq.cnl.validation.ValidationError;
import com.e2eq.cnl.validation.ValidationErrorKind;
import com.e2eq.cnl.validation.ValidationResult;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Applies CNL text to a graph: parse, resolve each block's node, pick the morph of each
 * notation segment, validate every statement and upsert the edges that pass.
 * <p>
 * Each statement is applied on its own. A line that fails to parse, fails validation or is
 * refused by the graph is reported and the rest of the document still applies. Edge ids are
 * deterministic, so applying the same document twice leaves the graph as the first apply did.
 * </p>
 */
public class CnlGraphCompiler {
    private static final Logger LOG = Logger.getLogger(CnlGraphCompiler.class.getName());

    private final KnowledgeGraph graph;
    private final SchemaRegistry schema;
    private final NodeRegistry nodes;
    private final MorphManager morphs;
    private final StatementValidator validator;
    private final CnlDocumentParser parser;
    private final boolean materializeInverses;

    public CnlGraphCompiler(KnowledgeGraph graph,
                            SchemaRegistry schema,
                            NodeRegistry nodes,
                            MorphManager morphs,
                            StatementValidator validator,
                            boolean materializeInverses) {
        this.graph = graph;
        this.schema = schema;
        this.nodes = nodes;
        this.morphs = morphs;
        this.validator = validator;
        this.parser = new CnlDocumentParser();
        this.materializeInverses = materializeInverses;
    }

    public CnlDocument parse(String text) {
        return parser.parse(text);
    }

    public ApplyReport apply(String text) {
        return apply(parser.parse(text));
    }

    public ApplyReport apply(CnlDocument document) {
        int applied = 0;
        List<ApplyReport.LineErrors> invalid = new ArrayList<>();
        List<ApplyReport.LineFailure> failures = new ArrayList<>();
        Set<String> touched = new LinkedHashSet<>();

        for (NodeBlock block : document.blocks()) {
            NodeHeading heading = block.heading();
            String nodeId;
            try {
                nodeId = nodes.resolveOrCreate(heading.baseName(), heading.qualifier().orElse(null));
            } catch (CnlGraphException e) {
                LOG.log(Level.WARNING, "Block at line {0} refused: {1}", new Object[]{block.headerLine(), e.getMessage()});
                failures.add(new ApplyReport.LineFailure(block.headerLine(), heading.render(), e.getMessage()));
                continue;
            }
            touched.add(nodeId);

            if (heading.nodeType().isPresent()) {
                String type = heading.nodeType().get();
                if (schema.nodeType(type).isPresent()) {
                    nodes.assignNodeType(nodeId, type);
                } else {
                    invalid.add(new ApplyReport.LineErrors(block.headerLine(), heading.render(), List.of(
                            new ValidationError(ValidationErrorKind.UNKNOWN_TYPE, "nodeType", type,
                                    "Unknown node type '" + type + "'"))));
                }
            }
            nodes.describe(nodeId, heading.quantifier().orElse(null), block.description().orElse(null));

            for (NotationSegment segment : block.notationSegments()) {
                String morphId;
                try {
                    morphId = morphs.ensureMorph(nodeId, segment.morphName().orElse(null));
                } catch (CnlGraphException e) {
                    LOG.log(Level.WARNING, "Notation at line {0} refused: {1}", new Object[]{segment.openLine(), e.getMessage()});
                    failures.add(new ApplyReport.LineFailure(segment.openLine(),
                            "## " + segment.morphName().orElse(GraphIds.BASIC_MORPH_NAME), e.getMessage()));
                    continue;
                }
                for (ParsedLine line : segment.lines()) {
                    if (line.statement().isEmpty()) continue;
                    try {
                        ValidationResult result = write(nodeId, morphId, line.statement().get(), null);
                        if (result.isValid()) {
                            applied++;
                        } else {
                            invalid.add(new ApplyReport.LineErrors(line.lineNumber(), line.raw(), result.errors()));
                        }
                    } catch (CnlGraphException e) {
                        LOG.log(Level.WARNING, "Line {0} refused: {1}", new Object[]{line.lineNumber(), e.getMessage()});
                        failures.add(new ApplyReport.LineFailure(line.lineNumber(), line.raw(), e.getMessage()));
                    }
                }
            }
        }

        ApplyReport report = new ApplyReport(applied, document.parseErrors(), invalid, failures, new ArrayList<>(touched));
        LOG.log(Level.INFO, "Applied document to graph {0}: {1} statements, {2} parse errors, {3} invalid, {4} refused",
                new Object[]{graph.getGraphId(), applied, report.parseErrors().size(), invalid.size(), failures.size()});
        return report;
    }

    /**
     * Writes one statement for a node outside of any document.
     *
     * @param morphId morph to list the edge on, null for the node's basic morph
     * @throws StatementRejectedException when the statement fails validation
     */
    public String applyStatement(String nodeId, String morphId, Statement statement, Long expectedVersion) {
        Node node = graph.requireNode(nodeId);
        String target = morphId == null || morphId.isBlank() ? node.basicMorphId() : morphId;
        if (!node.morphIds().contains(target)) {
            throw ReferentialException.notFound("Morph of node " + nodeId, target);
        }
        ValidationResult result = write(nodeId, target, statement, expectedVersion);
        if (!result.isValid()) {
            throw new StatementRejectedException(result.errors());
        }
        return result.edgeId().orElseThrow();
    }

    /**
     * Parses one notation line and writes it for a node.
     *
     * @throws IllegalArgumentException when the line is not a statement
     */
    public String applyLine(String nodeId, String morphId, String line, Long expectedVersion) {
        return applyStatement(nodeId, morphId, new CnlStatementParser().parse(line), expectedVersion);
    }

    private ValidationResult write(String nodeId, String morphId, Statement statement, Long expectedVersion) {
        Node source = graph.requireNode(nodeId);
        ValidationResult result = validator.validate(source, statement);
        if (!result.isValid()) {
            LOG.log(Level.FINE, "Statement for {0} rejected: {1}", new Object[]{nodeId, result.errors()});
            return result;
        }
        if (result.relationEdge().isPresent()) {
            RelationStatement rs = (RelationStatement) statement;
            nodes.resolveOrCreate(rs.target(), rs.qualifier().orElse(null));
            RelationEdge edge = morphs.attachRelation(morphId, result.relationEdge().get(), expectedVersion);
            if (materializeInverses) {
                materializeInverse(edge);
            }
        } else {
            result.attributeEdge().ifPresent(edge -> morphs.attachAttribute(morphId, edge, expectedVersion));
        }
        return result;
    }

    // the reverse edge goes to the target's basic morph
    private void materializeInverse(RelationEdge edge) {
        Optional<String> inverse = schema.inverseOf(edge.name());
        if (inverse.isEmpty() || schema.relationType(inverse.get()).isEmpty()) {
            return;
        }
        RelationEdge reverse = edge.reversed(inverse.get());
        if (reverse.id().equals(edge.id())) {
            return;
        }
        Node target = graph.requireNode(edge.targetId());
        morphs.attachRelation(target.basicMorphId(), reverse, null);
        LOG.log(Level.FINE, "Materialized {0} for {1}", new Object[]{reverse.id(), edge.id()});
    }
}
