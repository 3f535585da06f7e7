package com.forecastbench.dataset;

public record M4SeriesInfo(String id, M4Category category, int frequency, int horizon) {
}
