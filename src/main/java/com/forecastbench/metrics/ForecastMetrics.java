package com.forecastbench.metrics;

import com.forecastbench.exception.InsufficientHistoryException;
import com.forecastbench.exception.SchemaMismatchException;

public final class ForecastMetrics {

    private ForecastMetrics() {
    }

    /**
     * Symmetric MAPE in percent, averaged over the horizon.
     * A point where forecast and target are both zero contributes zero.
     */
    public static double smape(double[] forecast, double[] target) {
        requireSameLength(forecast, target);
        if (target.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int t = 0; t < target.length; t++) {
            double denom = Math.abs(target[t]) + Math.abs(forecast[t]);
            if (denom == 0.0) {
                denom = 1.0;
            }
            sum += 200.0 * Math.abs(forecast[t] - target[t]) / denom;
        }
        return sum / target.length;
    }

    public static double mase(double[] insample, double[] outsample, double[] forecast, int frequency) {
        requireSameLength(forecast, outsample);
        return meanAbsoluteError(forecast, outsample) / seasonalScale(insample, frequency);
    }

    public static double meanAbsoluteError(double[] forecast, double[] target) {
        requireSameLength(forecast, target);
        double sum = 0.0;
        for (int t = 0; t < target.length; t++) {
            sum += Math.abs(forecast[t] - target[t]);
        }
        return sum / target.length;
    }

    public static double seasonalScale(double[] insample, int frequency) {
        if (frequency < 1) {
            throw new IllegalArgumentException("frequency must be positive, got " + frequency);
        }
        if (insample.length < frequency + 1) {
            throw new InsufficientHistoryException(insample.length, frequency);
        }
        int n = insample.length - frequency;
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += Math.abs(insample[i + frequency] - insample[i]);
        }
        return sum / n;
    }

    private static void requireSameLength(double[] forecast, double[] target) {
        if (forecast.length != target.length) {
            throw new SchemaMismatchException("Forecast has " + forecast.length
                + " points but the target has " + target.length + ".");
        }
    }
}
