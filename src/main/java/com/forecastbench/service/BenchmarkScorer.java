package com.forecastbench.service;

import com.forecastbench.dataset.M4Category;
import com.forecastbench.dataset.M4SeriesInfo;
import com.forecastbench.dataset.SeriesGrouping;
import com.forecastbench.dataset.SeriesValues;
import com.forecastbench.exception.InsufficientHistoryException;
import com.forecastbench.exception.SchemaMismatchException;
import com.forecastbench.metrics.ForecastMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores a forecast for every series of the test partition and reduces the
 * errors to the M4 sMAPE and OWA summaries.
 * <p>
 * OWA is computed from the summarized MASE and sMAPE of the model and of
 * Naive2, bucket by bucket. Combining per series first gives different numbers.
 */
@Slf4j
@Component
public class BenchmarkScorer {

    public M4EvaluationResult evaluate(M4EvaluationSession session, List<double[]> forecasts) {
        if (forecasts.size() != session.size()) {
            throw SchemaMismatchException.rowCount("Forecast", forecasts.size(), session.size());
        }
        List<double[]> cleaned = forecasts.stream().map(SeriesValues::stripInvalid).toList();
        Map<M4Category, Integer> populations = session.populations();

        Map<M4Category, Double> modelSmapes = new EnumMap<>(M4Category.class);
        Map<M4Category, Double> modelMases = new EnumMap<>(M4Category.class);
        Map<M4Category, Double> naive2Smapes = new EnumMap<>(M4Category.class);
        Map<M4Category, Double> naive2Mases = new EnumMap<>(M4Category.class);

        List<M4Category> categories = session.categories();
        for (M4Category category : M4Category.values()) {
            if (populations.get(category) == 0) {
                continue;
            }
            List<M4SeriesInfo> info = SeriesGrouping.group(session.reference(), categories, category);
            List<double[]> model = SeriesGrouping.group(cleaned, categories, category);
            List<double[]> naive2 = SeriesGrouping.group(session.naive2(), categories, category);
            List<double[]> target = SeriesGrouping.group(session.test().values(), categories, category);
            List<double[]> insample = SeriesGrouping.group(session.training().values(), categories, category);

            modelSmapes.put(category, meanSmape(info, model, target));
            naive2Smapes.put(category, meanSmape(info, naive2, target));
            modelMases.put(category, meanMase(info, model, target, insample));
            naive2Mases.put(category, meanMase(info, naive2, target, insample));
            log.debug("Category scored | category={} | series={} | smape={} | mase={}",
                category, info.size(), modelSmapes.get(category), modelMases.get(category));
        }

        LinkedHashMap<String, Double> smapeSummary = CategorySummarizer.summarize(modelSmapes, populations);
        LinkedHashMap<String, Double> maseSummary = CategorySummarizer.summarize(modelMases, populations);
        LinkedHashMap<String, Double> naive2SmapeSummary = CategorySummarizer.summarize(naive2Smapes, populations);
        LinkedHashMap<String, Double> naive2MaseSummary = CategorySummarizer.summarize(naive2Mases, populations);

        LinkedHashMap<String, Double> owa = new LinkedHashMap<>();
        for (String bucket : M4Category.summaryKeys()) {
            owa.put(bucket, owa(maseSummary.get(bucket), naive2MaseSummary.get(bucket),
                smapeSummary.get(bucket), naive2SmapeSummary.get(bucket)));
        }
        return new M4EvaluationResult(ScoreRounding.round3(smapeSummary), ScoreRounding.round3(owa));
    }

    public static double owa(double modelMase, double baselineMase, double modelSmape, double baselineSmape) {
        return (modelMase / baselineMase + modelSmape / baselineSmape) / 2.0;
    }

    private double meanSmape(List<M4SeriesInfo> info, List<double[]> forecasts, List<double[]> targets) {
        double sum = 0.0;
        for (int i = 0; i < info.size(); i++) {
            requireSameLength(info.get(i), forecasts.get(i), targets.get(i));
            sum += ForecastMetrics.smape(forecasts.get(i), targets.get(i));
        }
        return sum / info.size();
    }

    private double meanMase(List<M4SeriesInfo> info, List<double[]> forecasts, List<double[]> targets,
                            List<double[]> insample) {
        double sum = 0.0;
        for (int i = 0; i < info.size(); i++) {
            M4SeriesInfo series = info.get(i);
            requireSameLength(series, forecasts.get(i), targets.get(i));
            try {
                sum += ForecastMetrics.mase(insample.get(i), targets.get(i), forecasts.get(i), series.frequency());
            } catch (InsufficientHistoryException ex) {
                throw ex.forSeries(series.id(), series.category());
            }
        }
        return sum / info.size();
    }

    private void requireSameLength(M4SeriesInfo series, double[] forecast, double[] target) {
        if (forecast.length != target.length) {
            throw SchemaMismatchException.length(series.id(), series.category(), forecast.length, target.length);
        }
    }
}
