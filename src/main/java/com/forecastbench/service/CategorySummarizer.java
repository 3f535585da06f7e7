package com.forecastbench.service;

import com.forecastbench.dataset.M4Category;
import com.forecastbench.exception.EmptyCategoryException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Re-groups per-category scores the way the M4 competition reports them:
 * major categories as-is, minor categories pooled into {@code Others}, and a
 * series-weighted {@code Average} over the whole corpus. No rounding happens here.
 */
public final class CategorySummarizer {

    private CategorySummarizer() {
    }

    public static LinkedHashMap<String, Double> summarize(Map<M4Category, Double> scores,
                                                         Map<M4Category, Integer> populations) {
        LinkedHashMap<String, Double> summary = new LinkedHashMap<>();
        double weightedTotal = 0.0;
        long total = 0;

        double othersWeighted = 0.0;
        long othersCount = 0;

        for (M4Category category : M4Category.values()) {
            int count = populations.getOrDefault(category, 0);
            if (count == 0) {
                throw new EmptyCategoryException(category.label());
            }
            Double score = scores.get(category);
            if (score == null) {
                throw new IllegalArgumentException("No score for populated category " + category);
            }
            double weighted = score * count;
            if (category.isMajor()) {
                summary.put(category.label(), score);
            } else {
                othersWeighted += weighted;
                othersCount += count;
            }
            weightedTotal += weighted;
            total += count;
        }

        summary.put(M4Category.OTHERS, othersWeighted / othersCount);
        summary.put(M4Category.AVERAGE, weightedTotal / total);
        return summary;
    }
}
