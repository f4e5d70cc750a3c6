package dev.flows.model;

import java.util.Arrays;
import java.util.List;

/**
 * Quality gate configuration: the judge agent, the criteria it scores against, the passing
 * threshold and what to do when the gate fails.
 */
public record GateConfig(
    String agent,
    List<String> criteria,
    double threshold,
    OnFail onFail,
    int maxRetries
) {
    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final OnFail DEFAULT_ON_FAIL = OnFail.HALT;
    public static final int DEFAULT_MAX_RETRIES = 3;

    public GateConfig {
        criteria = criteria == null ? List.of() : List.copyOf(criteria);
        onFail = onFail == null ? DEFAULT_ON_FAIL : onFail;
    }

    public static GateConfig of(String agent, List<String> criteria) {
        return new GateConfig(agent, criteria, DEFAULT_THRESHOLD, DEFAULT_ON_FAIL, DEFAULT_MAX_RETRIES);
    }

    public enum OnFail {
        RETRY("retry"),
        HALT("halt"),
        CONTINUE_WITH_WARNING("continue-with-warning");

        private final String value;

        OnFail(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public static OnFail fromValue(String value) {
            return Arrays.stream(values())
                .filter(o -> o.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown onFail policy: " + value));
        }
    }
}
