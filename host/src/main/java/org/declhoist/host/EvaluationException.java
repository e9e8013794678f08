package org.declhoist.host;

/**
 * Failure raised by {@link Interpreter} itself, as opposed to one thrown by a host function.
 */
public abstract class EvaluationException extends Exception {
    protected EvaluationException(String message) {
        super(message);
    }

    private static final long serialVersionUID = 1L;
}
