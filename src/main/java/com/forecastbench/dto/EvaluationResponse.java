package com.forecastbench.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Value
@Builder
public class EvaluationResponse {
    UUID   evaluationId;
    String label;
    int    seriesCount;
    Map<String, Double> smape;
    Map<String, Double> owa;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    String requestId;
}
