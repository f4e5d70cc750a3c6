package dev.flows.model;

import java.util.Arrays;

public enum OutputFormat {
    MARKDOWN("markdown"),
    JSON("json"),
    CONCAT("concat");

    private final String value;

    OutputFormat(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static OutputFormat fromValue(String value) {
        return Arrays.stream(values())
            .filter(f -> f.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown output format: " + value));
    }
}
