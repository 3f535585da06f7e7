package com.forecastbench.service;

import java.util.LinkedHashMap;
import java.util.Map;

public final class ScoreRounding {

    private ScoreRounding() {
    }

    public static double round3(double value) {
        return Math.rint(value * 1000.0) / 1000.0;
    }

    public static LinkedHashMap<String, Double> round3(Map<String, Double> scores) {
        LinkedHashMap<String, Double> rounded = new LinkedHashMap<>();
        scores.forEach((k, v) -> rounded.put(k, round3(v)));
        return rounded;
    }
}
