package io.clusteroperator.resources;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.clusteroperator.labeller.Labeller;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;

/**
 * One infrastructure object owned by a managed server: what was observed at fetch time,
 * and how to write a desired version of it.
 * Loading and applying are separate steps so that a server can fetch all of its objects
 * before changing any local state.
 */
public abstract class ManagedResource<T extends HasMetadata> {

    private static final ObjectMapper COPIER = new ObjectMapper();

    protected final ResourceAccessor accessor;
    protected final Labeller labeller;
    private final ObjectRef<T> ref;
    private Observed<T> observed = Observed.missing();

    protected ManagedResource(ResourceAccessor accessor, Labeller labeller, Class<T> type, String name) {
        this.accessor = accessor;
        this.labeller = labeller;
        this.ref = ObjectRef.of(type, labeller.getNamespace(), name);
    }

    public ObjectRef<T> getRef() {
        return ref;
    }

    public String getName() {
        return ref.getName();
    }

    public Observed<T> load() throws AccessorException {
        return accessor.fetch(ref);
    }

    public void apply(Observed<T> loaded) {
        this.observed = loaded;
    }

    public boolean exists() {
        return observed.exists();
    }

    public T getOldObject() {
        return observed.get();
    }

    /**
     * Writes a copy of {@code desired} carrying the observed resourceVersion, so the write only
     * succeeds against the version this tick saw. {@code desired} itself is left untouched.
     */
    public T write(T desired) throws AccessorException {
        T copy = copyOf(desired);
        copy.getMetadata().setResourceVersion(observed.resourceVersion());
        T stored = accessor.createOrUpdate(copy);
        this.observed = Observed.of(stored);
        return stored;
    }

    protected ObjectMeta buildMetadata() {
        return new ObjectMetaBuilder()
                .withName(ref.getName())
                .withNamespace(ref.getNamespace())
                .withLabels(labeller.getMetaLabels())
                .build();
    }

    @SuppressWarnings("unchecked")
    public static <T extends HasMetadata> T copyOf(T object) {
        return (T) COPIER.convertValue(object, object.getClass());
    }
}
