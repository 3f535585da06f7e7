package com.forecastbench.dataset;

import com.forecastbench.exception.SchemaMismatchException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public final class SeriesValues {

    private SeriesValues() {
    }

    public static double[] stripInvalid(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }

    public static double[] stripInvalid(List<Double> values) {
        return values.stream()
            .filter(Objects::nonNull)
            .mapToDouble(Double::doubleValue)
            .filter(v -> !Double.isNaN(v))
            .toArray();
    }

    public static double parseCell(String cell) {
        if (cell == null) {
            return Double.NaN;
        }
        String trimmed = cell.trim();
        if (trimmed.isEmpty() || trimmed.equalsIgnoreCase("nan") || trimmed.equalsIgnoreCase("na")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException ex) {
            throw new SchemaMismatchException("Cell '" + trimmed + "' is not a number.");
        }
    }
}
