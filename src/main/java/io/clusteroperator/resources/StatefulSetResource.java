package io.clusteroperator.resources;

import io.clusteroperator.labeller.Labeller;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.apps.StatefulSetBuilder;
import io.fabric8.kubernetes.api.model.apps.StatefulSetStatus;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.clusteroperator.config.Constants.ANNOTATION_DRAINED;
import static io.clusteroperator.config.Constants.ANNOTATION_DRAIN_REQUESTED;

/**
 * The workload set of a server. Holds the replica/readiness predicates and the drain handshake.
 */
public class StatefulSetResource extends ManagedResource<StatefulSet> {

    public StatefulSetResource(ResourceAccessor accessor, Labeller labeller) {
        super(accessor, labeller, StatefulSet.class, labeller.getStatefulSetName());
    }

    /**
     * Skeleton with metadata, selector and pod labels; the server fills in the rest.
     */
    public StatefulSet newBase() {
        return new StatefulSetBuilder()
                .withMetadata(buildMetadata())
                .withNewSpec()
                    .withNewSelector()
                        .withMatchLabels(labeller.getSelectorLabels())
                    .endSelector()
                    .withNewTemplate()
                        .withNewMetadata()
                            .withLabels(labeller.getMetaLabels())
                        .endMetadata()
                    .endTemplate()
                .endSpec()
                .build();
    }

    public boolean needSync(int replicas) {
        if (!exists()) {
            return true;
        }
        return !Objects.equals(getOldObject().getSpec().getReplicas(), replicas);
    }

    public boolean arePodsReady() {
        if (!exists()) {
            return false;
        }
        StatefulSet old = getOldObject();
        StatefulSetStatus status = old.getStatus();
        if (status == null) {
            return false;
        }
        int desired = valueOrZero(old.getSpec().getReplicas());
        long generation = old.getMetadata().getGeneration() == null ? 0 : old.getMetadata().getGeneration();
        long observedGeneration = status.getObservedGeneration() == null ? 0 : status.getObservedGeneration();
        return valueOrZero(status.getReadyReplicas()) >= desired && observedGeneration >= generation;
    }

    /**
     * True when the workload set exists, is scaled to zero and no pods remain.
     */
    public boolean arePodsRemoved() {
        if (!exists() || needSync(0)) {
            return false;
        }
        StatefulSetStatus status = getOldObject().getStatus();
        return status == null || valueOrZero(status.getReplicas()) == 0;
    }

    public String getDeployedImage() {
        if (!exists() || getOldObject().getSpec().getTemplate() == null
                || getOldObject().getSpec().getTemplate().getSpec() == null) {
            return null;
        }
        List<Container> containers = getOldObject().getSpec().getTemplate().getSpec().getContainers();
        return containers == null || containers.isEmpty() ? null : containers.get(0).getImage();
    }

    public boolean isDrainRequested() {
        return annotation(ANNOTATION_DRAIN_REQUESTED) != null;
    }

    /**
     * Drained when the server acknowledged the request, or the request is older than the timeout.
     */
    public boolean isDrained(Instant now, Duration timeout) {
        if ("true".equals(annotation(ANNOTATION_DRAINED))) {
            return true;
        }
        String requestedAt = annotation(ANNOTATION_DRAIN_REQUESTED);
        if (requestedAt == null) {
            return false;
        }
        try {
            return !Instant.parse(requestedAt).plus(timeout).isAfter(now);
        } catch (DateTimeParseException e) {
            return true;
        }
    }

    /**
     * Marks the observed workload set as asked to drain. The rest of the object is written back as observed.
     */
    public void requestDrain(Instant now) throws AccessorException {
        StatefulSet updated = copyOf(getOldObject());
        Map<String, String> annotations = updated.getMetadata().getAnnotations() == null
                ? new HashMap<>() : new HashMap<>(updated.getMetadata().getAnnotations());
        annotations.put(ANNOTATION_DRAIN_REQUESTED, now.toString());
        updated.getMetadata().setAnnotations(annotations);
        write(updated);
    }

    private String annotation(String key) {
        if (!exists() || getOldObject().getMetadata().getAnnotations() == null) {
            return null;
        }
        return getOldObject().getMetadata().getAnnotations().get(key);
    }

    private static int valueOrZero(Integer value) {
        return value == null ? 0 : value;
    }
}
