package com.forecastbench.dataset;

import java.util.List;

public record M4Dataset(M4Partition partition, List<M4SeriesInfo> info, List<double[]> values) {

    public M4Dataset {
        info = List.copyOf(info);
        values = List.copyOf(values);
        if (info.size() != values.size()) {
            throw new IllegalArgumentException(
                "info has " + info.size() + " rows but values has " + values.size());
        }
    }

    public int size() {
        return info.size();
    }

    public List<String> ids() {
        return info.stream().map(M4SeriesInfo::id).toList();
    }

    public List<M4Category> categories() {
        return info.stream().map(M4SeriesInfo::category).toList();
    }
}
