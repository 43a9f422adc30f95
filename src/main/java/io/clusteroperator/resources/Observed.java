package io.clusteroperator.resources;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Result of a fetch: the observed object, or nothing when it does not exist.
 */
public final class Observed<T extends HasMetadata> {

    private static final Observed<?> MISSING = new Observed<>(null);

    private final T object;

    private Observed(T object) {
        this.object = object;
    }

    public static <T extends HasMetadata> Observed<T> of(T object) {
        return object == null ? missing() : new Observed<>(object);
    }

    @SuppressWarnings("unchecked")
    public static <T extends HasMetadata> Observed<T> missing() {
        return (Observed<T>) MISSING;
    }

    public boolean exists() {
        return object != null;
    }

    public T get() {
        return object;
    }

    public String resourceVersion() {
        return object == null || object.getMetadata() == null ? null : object.getMetadata().getResourceVersion();
    }
}
