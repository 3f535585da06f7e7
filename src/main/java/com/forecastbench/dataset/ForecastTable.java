package com.forecastbench.dataset;

import java.util.List;

public record ForecastTable(List<String> ids, List<double[]> values) {

    public ForecastTable {
        ids = List.copyOf(ids);
        values = List.copyOf(values);
    }

    public int size() {
        return values.size();
    }
}
