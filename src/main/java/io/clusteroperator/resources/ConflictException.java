package io.clusteroperator.resources;

/**
 * A compare-and-swap write lost against a concurrent modification.
 */
public class ConflictException extends AccessorException {

    public ConflictException(String message) {
        super(message);
    }
}
