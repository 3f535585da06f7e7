package com.forecastbench.dataset;

import com.forecastbench.config.DatasetPaths;
import com.forecastbench.exception.CorpusUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class Naive2ForecastLoader {

    private final DatasetPaths paths;
    private final ForecastCsvReader reader = new ForecastCsvReader();

    public List<double[]> load(List<M4SeriesInfo> reference) {
        Path file = paths.naive2File();
        if (!Files.isRegularFile(file)) {
            throw new CorpusUnavailableException(file);
        }
        ForecastTable table;
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            table = reader.read(in);
        } catch (IOException ex) {
            throw new CorpusUnavailableException(file, ex);
        }
        SeriesAlignment.check("Naive2 forecasts", table, reference);
        log.info("Naive2 forecasts loaded | series={} | file={}", table.size(), file);
        return table.values();
    }
}
