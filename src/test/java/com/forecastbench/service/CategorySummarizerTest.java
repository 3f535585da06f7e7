package com.forecastbench.service;

import com.forecastbench.dataset.M4Category;
import com.forecastbench.exception.EmptyCategoryException;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static com.forecastbench.dataset.M4Category.*;
import static org.assertj.core.api.Assertions.*;

class CategorySummarizerTest {

    private static Map<M4Category, Double> scores(double y, double q, double m, double w, double d, double h) {
        Map<M4Category, Double> map = new EnumMap<>(M4Category.class);
        map.put(YEARLY, y);
        map.put(QUARTERLY, q);
        map.put(MONTHLY, m);
        map.put(WEEKLY, w);
        map.put(DAILY, d);
        map.put(HOURLY, h);
        return map;
    }

    private static Map<M4Category, Integer> counts(int y, int q, int m, int w, int d, int h) {
        Map<M4Category, Integer> map = new EnumMap<>(M4Category.class);
        map.put(YEARLY, y);
        map.put(QUARTERLY, q);
        map.put(MONTHLY, m);
        map.put(WEEKLY, w);
        map.put(DAILY, d);
        map.put(HOURLY, h);
        return map;
    }

    @Test
    void summarize_weightsBySeriesCount() {
        var summary = CategorySummarizer.summarize(scores(1, 2, 3, 4, 5, 6), counts(2, 3, 5, 1, 1, 1));

        assertThat(summary).containsOnlyKeys("Yearly", "Quarterly", "Monthly", "Others", "Average");
        assertThat(summary.keySet()).containsExactly("Yearly", "Quarterly", "Monthly", "Others", "Average");
        assertThat(summary.get("Yearly")).isEqualTo(1.0);
        assertThat(summary.get("Quarterly")).isEqualTo(2.0);
        assertThat(summary.get("Monthly")).isEqualTo(3.0);
        assertThat(summary.get("Others")).isEqualTo(5.0);
        assertThat(summary.get("Average")).isCloseTo(38.0 / 13.0, within(1e-12));
        assertThat(ScoreRounding.round3(summary.get("Average"))).isEqualTo(2.923);
    }

    @Test
    void summarize_othersIsCountWeighted() {
        var summary = CategorySummarizer.summarize(scores(0, 0, 0, 10, 20, 40), counts(1, 1, 1, 3, 1, 1));
        // (10*3 + 20 + 40) / 5
        assertThat(summary.get("Others")).isEqualTo(18.0);
        assertThat(summary.get("Average")).isEqualTo(90.0 / 8.0);
    }

    @Test
    void summarize_emptyMinorCategory_throwsInsteadOfNaN() {
        assertThatThrownBy(() -> CategorySummarizer.summarize(
                scores(1, 2, 3, 4, 5, 6), counts(2, 3, 5, 1, 0, 1)))
            .isInstanceOf(EmptyCategoryException.class)
            .hasMessageContaining("Daily");
    }

    @Test
    void summarize_emptyMajorCategory_throws() {
        assertThatThrownBy(() -> CategorySummarizer.summarize(
                scores(1, 2, 3, 4, 5, 6), counts(0, 3, 5, 1, 1, 1)))
            .isInstanceOf(EmptyCategoryException.class)
            .hasMessageContaining("Yearly");
    }

    @Test
    void summarize_doesNotRound() {
        var summary = CategorySummarizer.summarize(
            scores(1.23456789, 2, 3, 4, 5, 6), counts(1, 1, 1, 1, 1, 1));
        assertThat(summary.get("Yearly")).isEqualTo(1.23456789);
    }

    @Test
    void round3_tiesGoToEven() {
        assertThat(ScoreRounding.round3(0.0625)).isEqualTo(0.062);
        assertThat(ScoreRounding.round3(0.8166666)).isEqualTo(0.817);
        assertThat(ScoreRounding.round3(Double.NaN)).isNaN();
    }
}
