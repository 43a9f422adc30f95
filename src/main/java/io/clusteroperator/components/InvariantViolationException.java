package io.clusteroperator.components;

/**
 * A reconciliation invariant was broken, e.g. a read-only evaluation attempted a write.
 * This is a programming error; it aborts the tick.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
