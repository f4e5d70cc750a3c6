package dev.flows.engine;

/**
 * Base class of errors that stop a flow run as a whole. Failures of individual steps are not
 * exceptions; they are recorded in the step's result.
 */
public class FlowException extends RuntimeException {

    public FlowException(String message) {
        super(message);
    }

    public FlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
