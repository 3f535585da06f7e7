package com.forecastbench.dataset;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public final class SeriesGrouping {

    private SeriesGrouping() {
    }

    public static <T> List<T> group(List<T> values, List<M4Category> categories, M4Category target) {
        if (values.size() != categories.size()) {
            throw new IllegalArgumentException(
                "values has " + values.size() + " rows but categories has " + categories.size());
        }
        List<T> result = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            if (categories.get(i) == target) {
                result.add(values.get(i));
            }
        }
        return result;
    }

    public static List<Integer> indices(List<M4Category> categories, M4Category target) {
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < categories.size(); i++) {
            if (categories.get(i) == target) {
                result.add(i);
            }
        }
        return result;
    }

    public static int population(List<M4Category> categories, M4Category target) {
        return (int) categories.stream().filter(c -> c == target).count();
    }

    public static Map<M4Category, Integer> populations(List<M4Category> categories) {
        Map<M4Category, Integer> counts = new EnumMap<>(M4Category.class);
        for (M4Category category : M4Category.values()) {
            counts.put(category, 0);
        }
        categories.forEach(c -> counts.merge(c, 1, Integer::sum));
        return counts;
    }
}
