package com.e2eq.cnl.compose;

import com.e2eq.cnl.graph.AttributeEdge;
import com.e2eq.cnl.graph.NodeRole;
import com.e2eq.cnl.graph.RelationEdge;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic weighted count over a composed view.
 */
public class ScoringEngine {

    private final ScoreRubric rubric;

    public ScoringEngine() {
        this(ScoreRubric.defaults());
    }

    public ScoringEngine(ScoreRubric rubric) {
        this.rubric = rubric;
    }

    public GraphScore score(ComposedView view, int crossGraphReuseCount) {
        Map<ScoreCategory, Integer> counts = new EnumMap<>(ScoreCategory.class);
        for (ScoreCategory c : ScoreCategory.values()) counts.put(c, 0);

        for (ComposedNode node : view.nodes()) {
            inc(counts, ScoreCategory.NODE, 1);
            if (node.role() == NodeRole.PROCESS) inc(counts, ScoreCategory.TRANSITION_NODE, 1);
            if (node.role() == NodeRole.FUNCTION) inc(counts, ScoreCategory.FUNCTION_NODE, 1);
            if (node.morphs().size() > 1) inc(counts, ScoreCategory.POLY_NODE_MORPH, node.morphs().size() - 1);
        }

        for (RelationEdge r : view.relations()) {
            inc(counts, ScoreCategory.RELATION, 1);
            if (r.targetQualifier().isPresent() || r.adverb().isPresent()) {
                inc(counts, ScoreCategory.RELATION_WITH_QUALIFIER, 1);
            }
            if (r.objectQuantifier().isPresent() || r.subjectQuantifier().isPresent()) {
                inc(counts, ScoreCategory.QUANTIFIED, 1);
            }
            if (r.modality().isPresent()) inc(counts, ScoreCategory.MODALITY, 1);
        }

        for (AttributeEdge a : view.attributes()) {
            inc(counts, ScoreCategory.ATTRIBUTE, 1);
            if (a.unit().isPresent()) inc(counts, ScoreCategory.ATTRIBUTE_WITH_UNIT, 1);
            if (a.adverb().isPresent()) inc(counts, ScoreCategory.ATTRIBUTE_WITH_QUALIFIER, 1);
            if (a.quantifier().isPresent()) inc(counts, ScoreCategory.QUANTIFIED, 1);
            if (a.modality().isPresent()) inc(counts, ScoreCategory.MODALITY, 1);
        }

        inc(counts, ScoreCategory.CROSS_GRAPH_REUSE, Math.max(0, crossGraphReuseCount));

        Map<ScoreCategory, GraphScore.CategoryScore> categories = new LinkedHashMap<>();
        int total = 0;
        for (ScoreCategory c : ScoreCategory.values()) {
            int count = counts.get(c);
            int weight = rubric.weight(c);
            categories.put(c, new GraphScore.CategoryScore(count, weight, count * weight));
            total += count * weight;
        }
        return new GraphScore(categories, total);
    }

    public GraphScore score(ComposedView view) {
        return score(view, 0);
    }

    private static void inc(Map<ScoreCategory, Integer> counts, ScoreCategory c, int by) {
        counts.merge(c, by, Integer::sum);
    }
}
