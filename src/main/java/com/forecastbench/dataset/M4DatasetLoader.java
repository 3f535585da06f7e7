package com.forecastbench.dataset;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.forecastbench.config.DatasetPaths;
import com.forecastbench.exception.CorpusUnavailableException;
import com.forecastbench.exception.SchemaMismatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class M4DatasetLoader {

    static final String ID_COLUMN = "M4id";
    static final String CATEGORY_COLUMN = "SP";
    static final String FREQUENCY_COLUMN = "Frequency";
    static final String HORIZON_COLUMN = "Horizon";

    private final DatasetPaths paths;
    private final JsonValueStore valueStore;
    private final CsvMapper csvMapper = new CsvMapper();

    public M4Dataset load(M4Partition partition) {
        List<M4SeriesInfo> info = loadInfo();
        List<double[]> values = valueStore.read(partition);
        if (values.size() != info.size()) {
            throw SchemaMismatchException.rowCount(partition + " cache", values.size(), info.size());
        }
        log.info("M4 partition loaded | partition={} | series={}", partition, info.size());
        return new M4Dataset(partition, info, values);
    }

    public List<M4SeriesInfo> loadInfo() {
        Path file = paths.infoFile();
        if (!Files.isRegularFile(file)) {
            throw new CorpusUnavailableException(file);
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<M4SeriesInfo> rows = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        try (MappingIterator<Map<String, String>> it = csvMapper
                .readerFor(new TypeReference<Map<String, String>>() { })
                .with(schema)
                .readValues(file.toFile())) {
            while (it.hasNextValue()) {
                M4SeriesInfo row = toInfo(it.nextValue());
                if (!seen.add(row.id())) {
                    throw new SchemaMismatchException("Series '" + row.id() + "' appears twice in " + file + ".");
                }
                rows.add(row);
            }
        } catch (IOException ex) {
            throw new CorpusUnavailableException(file, ex);
        }
        return rows;
    }

    private M4SeriesInfo toInfo(Map<String, String> row) {
        String id = required(row, ID_COLUMN);
        return new M4SeriesInfo(
            id,
            M4Category.fromLabel(required(row, CATEGORY_COLUMN)),
            positive(id, FREQUENCY_COLUMN, required(row, FREQUENCY_COLUMN)),
            positive(id, HORIZON_COLUMN, required(row, HORIZON_COLUMN)));
    }

    private String required(Map<String, String> row, String column) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new SchemaMismatchException("Reference table row " + row + " has no '" + column + "' value.");
        }
        return value.trim();
    }

    private int positive(String id, String column, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new SchemaMismatchException("Series '" + id + "' has a non-integer " + column + " '" + value + "'.");
        }
        if (parsed < 1) {
            throw new SchemaMismatchException("Series '" + id + "' has a non-positive " + column + " " + parsed + ".");
        }
        return parsed;
    }
}
