package com.forecastbench.service;

import com.forecastbench.dataset.M4DatasetLoader;
import com.forecastbench.dataset.M4Dataset;
import com.forecastbench.dataset.M4Partition;
import com.forecastbench.dataset.Naive2ForecastLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class M4SessionProvider {

    private final M4DatasetLoader datasetLoader;
    private final Naive2ForecastLoader naive2Loader;

    private volatile M4EvaluationSession session;

    public M4EvaluationSession getSession() {
        M4EvaluationSession current = session;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (session == null) {
                session = load();
            }
            return session;
        }
    }

    private M4EvaluationSession load() {
        long started = System.currentTimeMillis();
        M4Dataset training = datasetLoader.load(M4Partition.TRAINING);
        M4Dataset test = datasetLoader.load(M4Partition.TEST);
        List<double[]> naive2 = naive2Loader.load(test.info());
        M4EvaluationSession loaded = new M4EvaluationSession(training, test, naive2);
        log.info("Evaluation session ready | series={} | populations={} | tookMs={}",
            loaded.size(), loaded.populations(), System.currentTimeMillis() - started);
        return loaded;
    }
}
