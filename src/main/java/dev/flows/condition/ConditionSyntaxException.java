package dev.flows.condition;

/**
 * The condition text does not parse.
 */
public class ConditionSyntaxException extends ConditionException {

    private final int position;

    public ConditionSyntaxException(String message, int position) {
        super("%s at position %d".formatted(message, position));
        this.position = position;
    }

    public int position() {
        return position;
    }
}
