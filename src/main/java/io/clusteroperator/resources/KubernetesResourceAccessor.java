package io.clusteroperator.resources;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;

/**
 * ResourceAccessor backed by the fabric8 Kubernetes client.
 */
@Slf4j
public class KubernetesResourceAccessor implements ResourceAccessor {

    private final KubernetesClient client;

    public KubernetesResourceAccessor(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public <T extends HasMetadata> Observed<T> fetch(ObjectRef<T> ref) throws AccessorException {
        try {
            T object = client.resources(ref.getType())
                    .inNamespace(ref.getNamespace())
                    .withName(ref.getName())
                    .get();
            return Observed.of(object);
        } catch (KubernetesClientException e) {
            throw new AccessorException("Failed to fetch " + ref + ": " + e.getMessage(), e);
        }
    }

    @Override
    public <T extends HasMetadata> T createOrUpdate(T object) throws AccessorException {
        String description = object.getKind() + " " + object.getMetadata().getNamespace()
                + "/" + object.getMetadata().getName();
        try {
            T stored;
            if (object.getMetadata().getResourceVersion() == null) {
                stored = client.resource(object).create();
                log.info("Created {}", description);
            } else {
                stored = client.resource(object).update();
                log.info("Updated {}", description);
            }
            return stored;
        } catch (KubernetesClientException e) {
            if (e.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                throw new ConflictException(description + " was modified concurrently: " + e.getMessage());
            }
            throw new AccessorException("Failed to write " + description + ": " + e.getMessage(), e);
        }
    }

    @Override
    public <T extends HasMetadata> boolean exists(ObjectRef<T> ref) throws AccessorException {
        return fetch(ref).exists();
    }
}
