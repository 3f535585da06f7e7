package com.forecastbench.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record M4EvaluationResult(Map<String, Double> smape, Map<String, Double> owa) {

    public M4EvaluationResult {
        smape = Collections.unmodifiableMap(new LinkedHashMap<>(smape));
        owa = Collections.unmodifiableMap(new LinkedHashMap<>(owa));
    }
}
