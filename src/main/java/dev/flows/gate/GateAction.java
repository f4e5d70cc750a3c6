package dev.flows.gate;

/**
 * What a gate decided to do with the content it judged.
 */
public enum GateAction {
    PASSED("passed"),
    RETRY("retry"),
    HALTED("halted"),
    CONTINUED_WITH_WARNING("continued-with-warning");

    private final String value;

    GateAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
