package io.clusteroperator;

import io.clusteroperator.components.ComponentFactory;
import io.clusteroperator.components.ComponentGraph;
import io.clusteroperator.components.InvariantViolationException;
import io.clusteroperator.components.ReconcileContext;
import io.clusteroperator.config.OperatorConfig;
import io.clusteroperator.enums.ClusterState;
import io.clusteroperator.metrics.MetricsProvider;
import io.clusteroperator.models.ClusterRecord;
import io.clusteroperator.models.ClusterStatus;
import io.clusteroperator.models.ComponentStatus;
import io.clusteroperator.reconciler.ClusterReconciler;
import io.clusteroperator.reconciler.ReconcileResult;
import io.clusteroperator.resources.ConflictException;
import io.clusteroperator.resources.ResourceAccessor;
import io.clusteroperator.store.ClusterStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.clusteroperator.metrics.MetricsConstants.*;

/**
 * Drives reconciliation of one cluster: a tick runs on a fixed delay and immediately after
 * every change to the cluster record. Ticks never overlap; a burst of watch events
 * collapses into a single extra tick.
 */
@Slf4j
public class ReconcileLoop {

    private final String clusterId;
    private final ClusterStore clusterStore;
    private final ResourceAccessor accessor;
    private final ClusterReconciler reconciler;
    private final OperatorConfig config;
    private final MetricsProvider metricsProvider;
    private final Clock clock;

    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean tickRequested = new AtomicBoolean(false);
    private volatile boolean isRunning = false;
    private AutoCloseable watch;

    public ReconcileLoop(String clusterId, ClusterStore clusterStore, ResourceAccessor accessor,
                         ClusterReconciler reconciler, OperatorConfig config, MetricsProvider metricsProvider,
                         Clock clock) {
        this.clusterId = clusterId;
        this.clusterStore = clusterStore;
        this.accessor = accessor;
        this.reconciler = reconciler;
        this.config = config;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("reconcile-" + clusterId);
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        log.info("[Cluster: {}] Starting reconcile loop (interval: {}s)", clusterId, config.getReconcileIntervalSeconds());
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::runTickSafely,
                0,
                config.getReconcileIntervalSeconds(),
                TimeUnit.SECONDS
        );
        watch = clusterStore.watchCluster(clusterId, this::requestTick);
    }

    public void stop() {
        log.info("[Cluster: {}] Stopping reconcile loop", clusterId);
        isRunning = false;
        if (watch != null) {
            try {
                watch.close();
            } catch (Exception e) {
                log.warn("[Cluster: {}] Error closing watch: {}", clusterId, e.getMessage());
            }
        }
        scheduler.shutdown();
    }

    public boolean isRunning() {
        return isRunning;
    }

    /**
     * Schedule a tick as soon as the current one finishes. Requests made while one is already queued are merged.
     */
    void requestTick() {
        if (!isRunning || !tickRequested.compareAndSet(false, true)) {
            return;
        }
        log.debug("[Cluster: {}] Cluster record changed, scheduling tick", clusterId);
        scheduler.execute(() -> {
            tickRequested.set(false);
            runTickSafely();
        });
    }

    private void runTickSafely() {
        long startNanos = System.nanoTime();
        try {
            runTick();
        } catch (InvariantViolationException e) {
            log.error("[Cluster: {}] Invariant violated, tick aborted: {}", clusterId, e.getMessage(), e);
            recordFailure("invariant_violation");
        } catch (Exception e) {
            log.error("[Cluster: {}] Error in reconcile loop: {}", clusterId, e.getMessage(), e);
            recordFailure(e.getClass().getSimpleName());
        } finally {
            metricsProvider.timer(RECONCILE_TICK_DURATION_METRIC_NAME, Map.of(CLUSTER_ID_TAG, clusterId))
                    .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * One tick: read the record, rebuild the component graph from its spec, reconcile and write
     * the status back if it changed.
     *
     * @return the reconcile result, or empty when there was nothing to reconcile
     */
    Optional<ReconcileResult> runTick() throws Exception {
        Optional<ClusterRecord> found = clusterStore.getCluster(clusterId);
        if (found.isEmpty()) {
            log.warn("[Cluster: {}] Cluster record not found, skipping tick", clusterId);
            return Optional.empty();
        }
        ClusterRecord record = found.get();
        if (record.getSpec() == null) {
            log.warn("[Cluster: {}] Cluster record has no spec, skipping tick", clusterId);
            return Optional.empty();
        }

        String namespace = record.getNamespace() != null && !record.getNamespace().isBlank()
                ? record.getNamespace()
                : config.getDefaultNamespace();
        ClusterStatus current = record.getStatus();
        ClusterState state = current != null && current.getState() != null ? current.getState() : ClusterState.CREATING;

        ReconcileContext ctx = ReconcileContext.forTick(clusterId, namespace, state,
                current != null ? current.getUpdateStatus() : null,
                clock, config.getTickTimeout(), config.getDrainTimeout());
        ComponentGraph graph = new ComponentFactory(accessor, clusterId, namespace, record.getSpec()).createAll();

        log.debug("[Cluster: {}] Reconciling {} components in state {}", clusterId, graph.size(), state);
        ReconcileResult result = reconciler.reconcile(record.getSpec(), current, graph, ctx, config.isDryRun());
        if (result.isAborted()) {
            recordFailure(result.getError().getClass().getSimpleName());
            return Optional.of(result);
        }

        publishStatusMetrics(state, result.getStatus());
        if (!result.isChanged()) {
            log.debug("[Cluster: {}] Status unchanged: {}", clusterId, result.getStatus().getSyncStatus());
            return Optional.of(result);
        }
        if (config.isDryRun()) {
            log.info("[Cluster: {}] Dry run, not writing status {} / {}", clusterId,
                    result.getStatus().getState(), result.getStatus().getSyncStatus());
            return Optional.of(result);
        }

        try {
            clusterStore.updateStatus(record, result.getStatus());
            log.info("[Cluster: {}] Wrote status {} / {} ({})", clusterId, result.getStatus().getState(),
                    result.getStatus().getSyncStatus(), result.getStatus().getMessage());
        } catch (ConflictException e) {
            log.info("[Cluster: {}] Cluster record changed since it was read, retrying next tick", clusterId);
        }
        return Optional.of(result);
    }

    private void publishStatusMetrics(ClusterState previousState, ClusterStatus status) {
        metricsProvider.gauge(CLUSTER_STATE_METRIC_NAME, Map.of(CLUSTER_ID_TAG, clusterId))
                .set(status.getState().ordinal());
        for (Map.Entry<String, ComponentStatus> entry : status.getComponents().entrySet()) {
            metricsProvider.gauge(COMPONENT_SYNC_STATUS_METRIC_NAME,
                            Map.of(CLUSTER_ID_TAG, clusterId, COMPONENT_TAG, entry.getKey()))
                    .set(entry.getValue().getSyncStatus().ordinal());
        }
        if (previousState != ClusterState.RECONFIGURATION && status.getState() == ClusterState.RECONFIGURATION) {
            metricsProvider.counter(UPDATE_WAVES_STARTED_METRIC_NAME, Map.of(CLUSTER_ID_TAG, clusterId)).increment();
        }
    }

    private void recordFailure(String reason) {
        metricsProvider.counter(RECONCILE_TICK_FAILURES_METRIC_NAME,
                Map.of(CLUSTER_ID_TAG, clusterId, REASON_TAG, reason)).increment();
    }
}
