package com.forecastbench.exception;

import java.util.UUID;

public class EvaluationNotFoundException extends BenchmarkException {
    public EvaluationNotFoundException(UUID id) {
        super("EVALUATION_NOT_FOUND", "Evaluation with id '" + id + "' not found.");
    }
}
