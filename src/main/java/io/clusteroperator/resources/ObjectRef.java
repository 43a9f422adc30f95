package io.clusteroperator.resources;

import io.fabric8.kubernetes.api.model.HasMetadata;
import lombok.Value;

/**
 * Typed reference to one infrastructure object.
 */
@Value
public class ObjectRef<T extends HasMetadata> {

    Class<T> type;
    String namespace;
    String name;

    public static <T extends HasMetadata> ObjectRef<T> of(Class<T> type, String namespace, String name) {
        return new ObjectRef<>(type, namespace, name);
    }

    @Override
    public String toString() {
        return type.getSimpleName() + " " + namespace + "/" + name;
    }
}
