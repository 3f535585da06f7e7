package com.forecastbench.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder
@Jacksonized
public class EvaluationRequest {
    @Size(max = 100, message = "label must be at most 100 characters")
    String label;

    @NotEmpty(message = "forecasts must contain one row per series")
    List<@NotNull(message = "forecast rows must not be null") List<Double>> forecasts;
}
