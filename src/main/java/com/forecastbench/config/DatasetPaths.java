package com.forecastbench.config;

import com.forecastbench.dataset.M4Partition;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
public class DatasetPaths {

    private final Path root;
    private final String infoFile;
    private final String trainingCache;
    private final String testCache;
    private final String naive2File;

    public DatasetPaths(
            @Value("${benchmark.dataset.path:./datasets/m4}") String root,
            @Value("${benchmark.dataset.info-file:M4-info.csv}") String infoFile,
            @Value("${benchmark.dataset.training-cache:training.json}") String trainingCache,
            @Value("${benchmark.dataset.test-cache:test.json}") String testCache,
            @Value("${benchmark.dataset.naive2-file:submission-Naive2.csv}") String naive2File) {
        this.root = Path.of(root);
        this.infoFile = infoFile;
        this.trainingCache = trainingCache;
        this.testCache = testCache;
        this.naive2File = naive2File;
    }

    public static DatasetPaths defaults(Path root) {
        return new DatasetPaths(root.toString(), "M4-info.csv", "training.json", "test.json",
            "submission-Naive2.csv");
    }

    public Path root() {
        return root;
    }

    public Path infoFile() {
        return root.resolve(infoFile);
    }

    public Path cacheFile(M4Partition partition) {
        return root.resolve(partition == M4Partition.TRAINING ? trainingCache : testCache);
    }

    public Path naive2File() {
        return root.resolve(naive2File);
    }
}
