package com.forecastbench.exception;

public class SchemaMismatchException extends BenchmarkException {
    public SchemaMismatchException(String message) {
        super("SCHEMA_MISMATCH", message);
    }

    public static SchemaMismatchException rowCount(String input, int actual, int expected) {
        return new SchemaMismatchException(
            input + " has " + actual + " series but the reference table has " + expected + ".");
    }

    public static SchemaMismatchException length(String seriesId, Object category, int forecast, int target) {
        return new SchemaMismatchException("Series '" + seriesId + "' (" + category + ") has a forecast of length "
            + forecast + " but a target of length " + target + ".");
    }
}
