package com.forecastbench.metrics;

import com.forecastbench.exception.InsufficientHistoryException;
import com.forecastbench.exception.SchemaMismatchException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ForecastMetricsTest {

    @Test
    void smape_perfectForecast_isZero() {
        double[] target = {3.0, 4.0, 5.0};
        assertThat(ForecastMetrics.smape(target.clone(), target)).isZero();
    }

    @Test
    void smape_knownValue() {
        // 200*|110-100|/210 and 200*|90-100|/190, averaged
        double expected = (2000.0 / 210.0 + 2000.0 / 190.0) / 2.0;
        assertThat(ForecastMetrics.smape(new double[]{110, 90}, new double[]{100, 100}))
            .isCloseTo(expected, within(1e-12));
    }

    @Test
    void smape_bothZero_staysFinite() {
        double value = ForecastMetrics.smape(new double[]{0.0, 2.0}, new double[]{0.0, 0.0});
        assertThat(value).isFinite().isEqualTo(100.0);
    }

    @Test
    void smape_isScaleInvariant() {
        double[] forecast = {1.5, 2.0, 7.25};
        double[] target = {1.0, 3.0, 6.0};
        double[] scaledForecast = {15.0, 20.0, 72.5};
        double[] scaledTarget = {10.0, 30.0, 60.0};
        assertThat(ForecastMetrics.smape(scaledForecast, scaledTarget))
            .isCloseTo(ForecastMetrics.smape(forecast, target), within(1e-12));
    }

    @Test
    void smape_neverNegativeAndBoundedBy200() {
        double value = ForecastMetrics.smape(new double[]{-5, 0, 12}, new double[]{5, 4, -3});
        assertThat(value).isBetween(0.0, 200.0);
    }

    @Test
    void smape_lengthMismatch_throws() {
        assertThatThrownBy(() -> ForecastMetrics.smape(new double[]{1}, new double[]{1, 2}))
            .isInstanceOf(SchemaMismatchException.class);
    }

    @Test
    void mase_isMaeOverSeasonalScale() {
        double[] insample = {1, 2, 3, 4, 6, 8};   // lag-2 diffs: 2,2,3,4 -> 2.75
        double[] outsample = {10, 12};
        double[] forecast = {11, 9};              // mae 2.0
        assertThat(ForecastMetrics.seasonalScale(insample, 2)).isEqualTo(2.75);
        assertThat(ForecastMetrics.mase(insample, outsample, forecast, 2))
            .isCloseTo(2.0 / 2.75, within(1e-12));
    }

    @Test
    void mase_decreasesAsForecastApproachesTarget() {
        double[] insample = {5, 7, 6, 9, 8};
        double[] outsample = {10, 11, 12};
        double far = ForecastMetrics.mase(insample, outsample, new double[]{14, 15, 16}, 1);
        double near = ForecastMetrics.mase(insample, outsample, new double[]{11, 12, 13}, 1);
        double exact = ForecastMetrics.mase(insample, outsample, outsample.clone(), 1);
        assertThat(near).isLessThan(far);
        assertThat(exact).isLessThan(near).isZero();
    }

    @Test
    void mase_historyShorterThanSeason_throwsInsufficientHistory() {
        assertThatThrownBy(() -> ForecastMetrics.mase(new double[]{1, 2, 3, 4}, new double[]{5},
                new double[]{5}, 4))
            .isInstanceOf(InsufficientHistoryException.class)
            .hasMessageContaining("at least 5");
    }

    @Test
    void mase_exactlyOneSeasonPlusOne_isAccepted() {
        double[] insample = {1, 2, 3, 4, 9};
        assertThat(ForecastMetrics.mase(insample, new double[]{1}, new double[]{2}, 4))
            .isEqualTo(1.0 / 8.0);
    }
}
