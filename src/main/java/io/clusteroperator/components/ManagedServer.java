package io.clusteroperator.components;

import io.clusteroperator.configgen.ConfigException;
import io.clusteroperator.resources.AccessorException;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;

/**
 * The bundle of infrastructure objects realizing one role: workload set, headless service,
 * monitoring service, config artifact and optional auxiliary services.
 */
public interface ManagedServer {

    void fetch(ReconcileContext ctx) throws AccessorException;

    /**
     * Config artifact stale, an owned object missing, or replica count off the spec.
     */
    boolean needSync();

    /**
     * All owned objects exist and the deployed image or config differs from the desired one.
     * A server that was never created needs creation, not update.
     */
    boolean needUpdate();

    boolean arePodsReady(ReconcileContext ctx);

    /**
     * Workload set exists, targets zero replicas and has converged there.
     */
    boolean arePodsRemoved();

    /**
     * Writes every owned object. A failure leaves the objects written so far in place.
     */
    void sync(ReconcileContext ctx) throws SyncException;

    /**
     * Writes only the workload set, rebuilt from the current spec with zero replicas.
     */
    void removePods(ReconcileContext ctx) throws SyncException;

    void requestDrain(ReconcileContext ctx) throws SyncException;

    boolean isDrainRequested();

    boolean isDrained(ReconcileContext ctx);

    /**
     * The desired workload set; computed on first call and cached.
     */
    StatefulSet buildStatefulSet();

    /**
     * Recomputes the desired workload set and replaces the cached one.
     */
    StatefulSet rebuildStatefulSet();

    ConfigException getConfigError();
}
