package com.forecastbench.entity;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ScoreMapConverterTest {

    private final ScoreMapConverter converter = new ScoreMapConverter();

    @Test
    void keepsBucketOrder() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("Yearly", 13.176);
        scores.put("Quarterly", 9.679);
        scores.put("Monthly", 12.126);
        scores.put("Others", 4.014);
        scores.put("Average", 11.374);

        String json = converter.convertToDatabaseColumn(scores);
        Map<String, Double> restored = converter.convertToEntityAttribute(json);

        assertThat(json).startsWith("{\"Yearly\":13.176");
        assertThat(restored.keySet()).containsExactly("Yearly", "Quarterly", "Monthly", "Others", "Average");
        assertThat(restored).isEqualTo(scores);
    }

    @Test
    void nullStaysNull() {
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
        assertThat(converter.convertToEntityAttribute(null)).isNull();
    }
}
