package com.forecastbench.dataset;

import com.forecastbench.config.DatasetPaths;
import com.forecastbench.exception.CorpusUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class M4CacheBuilder {

    private final DatasetPaths paths;
    private final M4DatasetLoader datasetLoader;
    private final JsonValueStore valueStore;
    private final ForecastCsvReader reader = new ForecastCsvReader();

    public void buildAll() throws IOException {
        List<M4SeriesInfo> reference = datasetLoader.loadInfo();
        for (M4Partition partition : M4Partition.values()) {
            build(partition, reference);
        }
    }

    public boolean isCached() {
        for (M4Partition partition : M4Partition.values()) {
            if (!Files.isRegularFile(paths.cacheFile(partition))) {
                return false;
            }
        }
        return true;
    }

    public List<double[]> build(M4Partition partition, List<M4SeriesInfo> reference) throws IOException {
        Map<String, double[]> byId = new HashMap<>();
        String glob = "*-" + partition.fileSuffix() + ".csv";
        int files = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(paths.root(), glob)) {
            for (Path file : stream) {
                ForecastTable table = readFile(file);
                for (int i = 0; i < table.size(); i++) {
                    byId.put(table.ids().get(i), table.values().get(i));
                }
                files++;
            }
        }
        if (files == 0) {
            throw new CorpusUnavailableException(paths.root().resolve(glob));
        }

        List<double[]> ordered = new ArrayList<>(reference.size());
        int missing = 0;
        for (M4SeriesInfo info : reference) {
            double[] values = byId.get(info.id());
            if (values == null) {
                missing++;
                values = new double[0];
            }
            ordered.add(values);
        }
        if (missing > 0) {
            log.warn("Series without values | partition={} | missing={}", partition, missing);
        }
        valueStore.write(partition, ordered);
        log.info("Cache built | partition={} | files={} | series={}", partition, files, ordered.size());
        return ordered;
    }

    private ForecastTable readFile(Path file) throws IOException {
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return reader.read(in);
        }
    }
}
