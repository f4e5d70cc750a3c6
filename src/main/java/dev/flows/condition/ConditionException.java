package dev.flows.condition;

/**
 * Base class for errors raised while compiling or evaluating a step condition.
 */
public class ConditionException extends RuntimeException {

    public ConditionException(String message) {
        super(message);
    }
}
