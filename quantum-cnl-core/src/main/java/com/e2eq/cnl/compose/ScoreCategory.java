package com.e2eq.cnl.compose;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Scoring categories with their default weights.
 */
public enum ScoreCategory {
    NODE("node", 1),
    RELATION("relation", 2),
    ATTRIBUTE("attribute", 3),
    ATTRIBUTE_WITH_UNIT("attributeWithUnit", 4),
    RELATION_WITH_QUALIFIER("relationWithQualifier", 2),
    ATTRIBUTE_WITH_QUALIFIER("attributeWithQualifier", 2),
    QUANTIFIED("quantified", 5),
    MODALITY("modality", 5),
    TRANSITION_NODE("transitionNode", 10),
    FUNCTION_NODE("functionNode", 10),
    POLY_NODE_MORPH("polyNodeMorph", 5),
    CROSS_GRAPH_REUSE("crossGraphReuse", 10);

    private final String key;
    private final int defaultWeight;

    ScoreCategory(String key, int defaultWeight) {
        this.key = key;
        this.defaultWeight = defaultWeight;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public int defaultWeight() {
        return defaultWeight;
    }
}
