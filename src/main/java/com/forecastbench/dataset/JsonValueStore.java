package com.forecastbench.dataset;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastbench.config.DatasetPaths;
import com.forecastbench.exception.CorpusUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsonValueStore {

    private final DatasetPaths paths;
    private final ObjectMapper mapper = new ObjectMapper();

    public List<double[]> read(M4Partition partition) {
        Path file = paths.cacheFile(partition);
        if (!Files.isRegularFile(file)) {
            throw new CorpusUnavailableException(file);
        }
        try {
            double[][] rows = mapper.readValue(file.toFile(), double[][].class);
            return Arrays.asList(rows);
        } catch (IOException ex) {
            throw new CorpusUnavailableException(file, ex);
        }
    }

    public void write(M4Partition partition, List<double[]> values) throws IOException {
        Path file = paths.cacheFile(partition);
        Files.createDirectories(file.toAbsolutePath().getParent());
        mapper.writeValue(file.toFile(), values.toArray(new double[0][]));
        log.info("Value store written | partition={} | series={} | file={}", partition, values.size(), file);
    }
}
