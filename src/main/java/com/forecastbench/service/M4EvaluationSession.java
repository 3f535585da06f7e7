package com.forecastbench.service;

import com.forecastbench.dataset.M4Category;
import com.forecastbench.dataset.M4Dataset;
import com.forecastbench.dataset.M4SeriesInfo;
import com.forecastbench.dataset.SeriesGrouping;
import com.forecastbench.exception.SchemaMismatchException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public record M4EvaluationSession(M4Dataset training, M4Dataset test, List<double[]> naive2) {

    public M4EvaluationSession {
        if (training.size() != test.size()) {
            throw SchemaMismatchException.rowCount("training partition", training.size(), test.size());
        }
        if (naive2.size() != test.size()) {
            throw SchemaMismatchException.rowCount("Naive2 forecasts", naive2.size(), test.size());
        }
        naive2 = List.copyOf(naive2);
    }

    public List<M4SeriesInfo> reference() {
        return test.info();
    }

    public List<M4Category> categories() {
        return test.categories();
    }

    public Map<M4Category, Integer> populations() {
        return Collections.unmodifiableMap(SeriesGrouping.populations(categories()));
    }

    public int size() {
        return test.size();
    }
}
