package com.forecastbench.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CategoryInfoResponse {
    String category;
    String role;
    int    seriesCount;
    int    horizon;
    int    frequency;
}
