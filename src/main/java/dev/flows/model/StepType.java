package dev.flows.model;

import java.util.Arrays;

public enum StepType {
    AGENT("agent"),
    GATE("gate"),
    BRANCH("branch"),
    CONSENSUS("consensus");

    private final String value;

    StepType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static StepType fromValue(String value) {
        return Arrays.stream(values())
            .filter(t -> t.value.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown step type: " + value));
    }
}
