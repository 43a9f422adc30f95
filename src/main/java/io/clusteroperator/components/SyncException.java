package io.clusteroperator.components;

import io.clusteroperator.resources.ObjectRef;
import lombok.Getter;

/**
 * Writing one of a server's objects failed. Objects written before it stay written.
 */
@Getter
public class SyncException extends Exception {

    private final ObjectRef<?> object;

    public SyncException(ObjectRef<?> object, Throwable cause) {
        super("Failed to sync " + object + ": " + cause.getMessage(), cause);
        this.object = object;
    }
}
