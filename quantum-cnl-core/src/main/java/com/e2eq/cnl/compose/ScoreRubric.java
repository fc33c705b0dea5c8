package com.e2eq.cnl.compose;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Points per counted item of each category.
 */
public final class ScoreRubric {

    private final Map<ScoreCategory, Integer> weights;

    private ScoreRubric(Map<ScoreCategory, Integer> weights) {
        this.weights = Collections.unmodifiableMap(new EnumMap<>(weights));
    }

    public static ScoreRubric defaults() {
        Map<ScoreCategory, Integer> w = new EnumMap<>(ScoreCategory.class);
        for (ScoreCategory c : ScoreCategory.values()) {
            w.put(c, c.defaultWeight());
        }
        return new ScoreRubric(w);
    }

    /** Copy of this rubric with one weight replaced. */
    public ScoreRubric withWeight(ScoreCategory category, int weight) {
        if (weight < 0) {
            throw new IllegalArgumentException("Weight of " + category.key() + " must not be negative");
        }
        Map<ScoreCategory, Integer> w = new EnumMap<>(weights);
        w.put(category, weight);
        return new ScoreRubric(w);
    }

    public int weight(ScoreCategory category) {
        return weights.get(category);
    }

    public Map<ScoreCategory, Integer> weights() {
        return weights;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScoreRubric)) return false;
        return weights.equals(((ScoreRubric) o).weights);
    }

    @Override
    public int hashCode() {
        return Objects.hash(weights);
    }

    @Override
    public String toString() {
        return "ScoreRubric" + weights;
    }
}
