package dev.flows.engine;

/**
 * A gate step's content did not pass and the gate's policy stopped it. Fails that step only.
 */
public class GateHaltedException extends RuntimeException {

    public GateHaltedException(String message) {
        super(message);
    }
}
