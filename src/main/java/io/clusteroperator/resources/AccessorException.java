package io.clusteroperator.resources;

/**
 * Failure talking to the infrastructure API. Retryable on the next tick.
 */
public class AccessorException extends Exception {

    public AccessorException(String message) {
        super(message);
    }

    public AccessorException(String message, Throwable cause) {
        super(message, cause);
    }
}
