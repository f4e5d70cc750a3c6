package dev.flows.engine;

/**
 * A step's input could not be resolved or transformed. Fails that step only.
 */
public class StepInputException extends RuntimeException {

    public StepInputException(String message) {
        super(message);
    }

    public StepInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
