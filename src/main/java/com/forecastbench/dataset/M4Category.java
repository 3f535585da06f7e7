package com.forecastbench.dataset;

import com.forecastbench.exception.SchemaMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public enum M4Category {
    YEARLY("Yearly", Role.MAJOR, 6, 1),
    QUARTERLY("Quarterly", Role.MAJOR, 8, 4),
    MONTHLY("Monthly", Role.MAJOR, 18, 12),
    WEEKLY("Weekly", Role.MINOR, 13, 1),
    DAILY("Daily", Role.MINOR, 14, 1),
    HOURLY("Hourly", Role.MINOR, 48, 24);

    public static final String OTHERS = "Others";
    public static final String AVERAGE = "Average";

    public enum Role { MAJOR, MINOR }

    private final String label;
    private final Role role;
    private final int horizon;
    private final int frequency;

    M4Category(String label, Role role, int horizon, int frequency) {
        this.label = label;
        this.role = role;
        this.horizon = horizon;
        this.frequency = frequency;
    }

    public String label() {
        return label;
    }

    public Role role() {
        return role;
    }

    public boolean isMajor() {
        return role == Role.MAJOR;
    }

    public int horizon() {
        return horizon;
    }

    public int frequency() {
        return frequency;
    }

    public static List<M4Category> ofRole(Role role) {
        return Arrays.stream(values()).filter(c -> c.role == role).toList();
    }

    public static M4Category fromLabel(String label) {
        for (M4Category category : values()) {
            if (category.label.equals(label)) {
                return category;
            }
        }
        throw new SchemaMismatchException("Unknown M4 category '" + label + "'.");
    }

    public static List<String> summaryKeys() {
        List<String> keys = new ArrayList<>();
        ofRole(Role.MAJOR).forEach(c -> keys.add(c.label));
        keys.add(OTHERS);
        keys.add(AVERAGE);
        return List.copyOf(keys);
    }

    @Override
    public String toString() {
        return label;
    }
}
