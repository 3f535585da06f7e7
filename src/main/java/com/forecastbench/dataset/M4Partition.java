package com.forecastbench.dataset;

public enum M4Partition {
    TRAINING("train"),
    TEST("test");

    private final String fileSuffix;

    M4Partition(String fileSuffix) {
        this.fileSuffix = fileSuffix;
    }

    public String fileSuffix() {
        return fileSuffix;
    }
}
