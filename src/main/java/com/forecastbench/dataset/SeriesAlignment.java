package com.forecastbench.dataset;

import com.forecastbench.exception.SchemaMismatchException;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a forecast table against the reference table before scoring.
 * Rows are matched by position; identifiers only serve as a cross-check.
 */
@Slf4j
public final class SeriesAlignment {

    private SeriesAlignment() {
    }

    public static void check(String input, ForecastTable table, List<M4SeriesInfo> reference) {
        if (table.size() != reference.size()) {
            throw SchemaMismatchException.rowCount(input, table.size(), reference.size());
        }
        Set<String> known = new HashSet<>();
        reference.forEach(r -> known.add(r.id()));
        boolean warned = false;
        for (int i = 0; i < table.size(); i++) {
            String id = table.ids().get(i);
            if (!known.contains(id)) {
                throw new SchemaMismatchException(
                    input + " row " + (i + 1) + " references series '" + id + "' missing from the reference table.");
            }
            if (!warned && !id.equals(reference.get(i).id())) {
                log.warn("Row order differs from reference table | input={} | row={} | id={} | expected={}",
                    input, i + 1, id, reference.get(i).id());
                warned = true;
            }
        }
    }
}
