package io.clusteroperator;

import io.clusteroperator.config.OperatorConfig;
import io.clusteroperator.election.LeaderElection;
import io.clusteroperator.metrics.MetricsProvider;
import io.clusteroperator.models.ClusterRecord;
import io.clusteroperator.reconciler.ClusterReconciler;
import io.clusteroperator.resources.ResourceAccessor;
import io.clusteroperator.store.ClusterStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Owns the reconcile loops of this operator replica. While it holds leadership it periodically
 * lists cluster records, starts a loop for every new cluster and stops loops whose record is gone.
 * Losing leadership stops every loop.
 */
@Slf4j
public class OperatorManager implements LeaderElection.Listener {

    private final ClusterStore clusterStore;
    private final ResourceAccessor accessor;
    private final ClusterReconciler reconciler;
    private final OperatorConfig config;
    private final MetricsProvider metricsProvider;
    private final LeaderElection leaderElection;
    private final Clock clock;

    private final ConcurrentMap<String, ReconcileLoop> loops = new ConcurrentHashMap<>();
    private final ScheduledExecutorService discoveryScheduler;
    private volatile ScheduledFuture<?> discoveryTask;

    public OperatorManager(ClusterStore clusterStore, ResourceAccessor accessor, ClusterReconciler reconciler,
                           OperatorConfig config, MetricsProvider metricsProvider, LeaderElection leaderElection,
                           Clock clock) {
        this.clusterStore = clusterStore;
        this.accessor = accessor;
        this.reconciler = reconciler;
        this.config = config;
        this.metricsProvider = metricsProvider;
        this.leaderElection = leaderElection;
        this.clock = clock;
        this.discoveryScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("cluster-discovery");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Campaign for leadership; loops start once this replica is elected.
     */
    public void start() {
        log.info("Starting operator manager, campaigning for leadership");
        leaderElection.startElection(this);
    }

    @Override
    public void onElected() {
        log.info("Elected leader, starting cluster discovery every {}s", config.getReconcileIntervalSeconds());
        discoveryTask = discoveryScheduler.scheduleWithFixedDelay(
                this::discoverClusters,
                0,
                config.getReconcileIntervalSeconds(),
                TimeUnit.SECONDS
        );
    }

    @Override
    public void onStepDown() {
        log.warn("Lost leadership, stopping all reconcile loops");
        if (discoveryTask != null) {
            discoveryTask.cancel(false);
            discoveryTask = null;
        }
        stopAll();
    }

    /**
     * Bring the set of running loops in line with the cluster records in the store.
     */
    void discoverClusters() {
        try {
            List<ClusterRecord> records = clusterStore.listClusters();
            Set<String> present = records.stream()
                    .map(ClusterRecord::getClusterId)
                    .collect(Collectors.toSet());
            for (String clusterId : present) {
                if (!loops.containsKey(clusterId)) {
                    startCluster(clusterId);
                }
            }
            for (String clusterId : new ArrayList<>(loops.keySet())) {
                if (!present.contains(clusterId)) {
                    log.info("Cluster {} no longer in store", clusterId);
                    stopCluster(clusterId);
                }
            }
        } catch (Exception e) {
            log.error("Failed to discover clusters: {}", e.getMessage(), e);
        }
    }

    public void startCluster(String clusterId) {
        if (loops.containsKey(clusterId)) {
            log.warn("Cluster {} already managed", clusterId);
            return;
        }
        ReconcileLoop loop = newLoop(clusterId);
        if (loops.putIfAbsent(clusterId, loop) != null) {
            // lost a race with a concurrent start; the loop was never started
            loop.stop();
            log.warn("Cluster {} already managed", clusterId);
            return;
        }
        loop.start();
        log.info("Started managing cluster: {} (total: {})", clusterId, loops.size());
    }

    public void stopCluster(String clusterId) {
        ReconcileLoop loop = loops.remove(clusterId);
        if (loop == null) {
            log.debug("Cluster {} not managed", clusterId);
            return;
        }
        loop.stop();
        log.info("Stopped managing cluster: {} (remaining: {})", clusterId, loops.size());
    }

    public void stopAll() {
        log.info("Stopping all managed clusters");
        new ArrayList<>(loops.keySet()).forEach(this::stopCluster);
    }

    public Set<String> getManagedClusters() {
        return new HashSet<>(loops.keySet());
    }

    public void shutdown() {
        log.info("Shutting down operator manager");
        leaderElection.shutdown();
        discoveryScheduler.shutdownNow();
        stopAll();
    }

    ReconcileLoop newLoop(String clusterId) {
        return new ReconcileLoop(clusterId, clusterStore, accessor, reconciler, config, metricsProvider, clock);
    }
}
