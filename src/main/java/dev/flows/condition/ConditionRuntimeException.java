package dev.flows.condition;

/**
 * The condition parsed but failed while being evaluated, e.g. a read through an undefined value.
 */
public class ConditionRuntimeException extends ConditionException {

    public ConditionRuntimeException(String message) {
        super(message);
    }
}
