package com.forecastbench.exception;

import lombok.Getter;

@Getter
public class InsufficientHistoryException extends BenchmarkException {
    private final int historyLength;
    private final int frequency;

    public InsufficientHistoryException(int historyLength, int frequency) {
        super("INSUFFICIENT_HISTORY", message(null, null, historyLength, frequency));
        this.historyLength = historyLength;
        this.frequency = frequency;
    }

    private InsufficientHistoryException(String seriesId, Object category, InsufficientHistoryException cause) {
        super("INSUFFICIENT_HISTORY",
              message(seriesId, category, cause.historyLength, cause.frequency), cause);
        this.historyLength = cause.historyLength;
        this.frequency = cause.frequency;
    }

    public InsufficientHistoryException forSeries(String seriesId, Object category) {
        return new InsufficientHistoryException(seriesId, category, this);
    }

    private static String message(String seriesId, Object category, int historyLength, int frequency) {
        String subject = seriesId != null ? "Series '" + seriesId + "' (" + category + ")" : "In-sample history";
        return subject + " has " + historyLength + " observations; at least " + (frequency + 1)
            + " are needed for a lag-" + frequency + " seasonal difference.";
    }
}
