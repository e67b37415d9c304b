package io.github.eutro.procnet.core.interp;

/**
 * Thrown when an {@link Interpreter} cannot carry on with the IR it was given.
 */
public class InterpretationException extends RuntimeException {
    public InterpretationException(String message) {
        super(message);
    }
}
