package com.forecastbench.dataset;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class ForecastCsvReader {

    private final CsvMapper mapper;

    public ForecastCsvReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    public ForecastTable read(Reader reader) throws IOException {
        List<String> ids = new ArrayList<>();
        List<double[]> values = new ArrayList<>();
        try (MappingIterator<String[]> rows = mapper.readerFor(String[].class).readValues(reader)) {
            boolean header = true;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                if (header) {
                    header = false;
                    continue;
                }
                if (row.length == 0) {
                    continue;
                }
                ids.add(row[0].trim());
                double[] parsed = Arrays.stream(row, 1, row.length)
                    .mapToDouble(SeriesValues::parseCell)
                    .toArray();
                values.add(SeriesValues.stripInvalid(parsed));
            }
        }
        return new ForecastTable(ids, values);
    }
}
