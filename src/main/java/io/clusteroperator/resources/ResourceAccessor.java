package io.clusteroperator.resources;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Read/write access to the infrastructure objects backing the managed servers.
 * Every write is a single atomic operation; an object carrying a resourceVersion is
 * only written if the stored object still has that version.
 */
public interface ResourceAccessor {

    <T extends HasMetadata> Observed<T> fetch(ObjectRef<T> ref) throws AccessorException;

    /**
     * Create the object when it carries no resourceVersion, otherwise replace it.
     *
     * @return the object as stored
     * @throws ConflictException if the resourceVersion is stale
     */
    <T extends HasMetadata> T createOrUpdate(T object) throws AccessorException;

    <T extends HasMetadata> boolean exists(ObjectRef<T> ref) throws AccessorException;
}
