package com.forecastbench.exception;

public class EmptyCategoryException extends BenchmarkException {
    public EmptyCategoryException(String bucket) {
        super("EMPTY_CATEGORY",
              "Category '" + bucket + "' has no series; its weighted score cannot be computed.");
    }
}
