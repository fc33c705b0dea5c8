package com.e2eq.cnl.compose;

import java.util.Map;

/**
 * Result of scoring a composed view: per-category counts and points, and their sum.
 */
public record GraphScore(Map<ScoreCategory, CategoryScore> categories, int total) {

    public record CategoryScore(int count, int weight, int points) {
    }

    public int count(ScoreCategory category) {
        CategoryScore s = categories.get(category);
        return s == null ? 0 : s.count();
    }
}
