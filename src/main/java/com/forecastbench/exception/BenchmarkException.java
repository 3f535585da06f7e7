package com.forecastbench.exception;

import lombok.Getter;

@Getter
public abstract class BenchmarkException extends RuntimeException {
    private final String errorCode;
    protected BenchmarkException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected BenchmarkException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
