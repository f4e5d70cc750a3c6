package dev.flows.model;

import java.util.Arrays;

public enum InputSource {
    REQUEST("request"),
    STEP("step"),
    AGGREGATE("aggregate"),
    FEEDBACK("feedback");

    private final String value;

    InputSource(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static InputSource fromValue(String value) {
        return Arrays.stream(values())
            .filter(s -> s.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Invalid input source: " + value));
    }
}
