package io.clusteroperator.reconciler;

import io.clusteroperator.components.Component;
import io.clusteroperator.components.ComponentGraph;
import io.clusteroperator.components.ReconcileContext;
import io.clusteroperator.components.SyncException;
import io.clusteroperator.enums.ClusterState;
import io.clusteroperator.enums.SyncStatus;
import io.clusteroperator.enums.UpdateState;
import io.clusteroperator.models.ClusterSpec;
import io.clusteroperator.models.ClusterStatus;
import io.clusteroperator.models.ComponentStatus;
import io.clusteroperator.models.Condition;
import io.clusteroperator.models.UpdateStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs one reconciliation tick over a cluster's components and advances the cluster state machine.
 * <p>
 * A tick fetches every component concurrently, evaluates statuses in dependency order, decides
 * cluster state transitions, syncs the components that are not ready (unless dry run), and
 * finally advances the update wave. The cluster status is passed in and returned; nothing is
 * kept between ticks.
 */
@Slf4j
public class ClusterReconciler {

    private final ExecutorService fetchExecutor;
    private final Duration creationTimeout;

    public ClusterReconciler(ExecutorService fetchExecutor, Duration creationTimeout) {
        this.fetchExecutor = fetchExecutor;
        this.creationTimeout = creationTimeout;
    }

    /**
     * @param current status read from the cluster record; null for a new cluster
     * @return the next status, or the input status with the cause when the tick was aborted
     * @throws io.clusteroperator.components.InvariantViolationException if a status evaluation broke an invariant
     */
    public ReconcileResult reconcile(ClusterSpec spec, ClusterStatus current, ComponentGraph graph,
                                     ReconcileContext ctx, boolean dryRun) {
        ClusterStatus previous = current != null ? current : ClusterStatus.initial();
        List<Component> ordered = graph.getOrdered();

        try {
            fetchAll(ordered, ctx);
        } catch (Exception e) {
            log.warn("[Cluster: {}] Fetch failed, keeping status: {}", ctx.getClusterId(), e.getMessage());
            return ReconcileResult.aborted(previous, e);
        }

        Map<String, ComponentStatus> statuses = new LinkedHashMap<>();
        for (Component component : ordered) {
            ComponentStatus status = component.status(ctx);
            ctx.recordStatus(component.getName(), status);
            statuses.put(component.getName(), status);
        }

        ClusterState state = ctx.getClusterState();
        UpdateStatus updateStatus = ctx.getUpdateStatus();
        Instant now = ctx.now();
        List<String> heldBack = new ArrayList<>();

        if (state == ClusterState.UPDATED) {
            state = ClusterState.RUNNING;
            updateStatus = UpdateStatus.none();
        }

        if (state == ClusterState.RUNNING) {
            List<String> wave = new ArrayList<>();
            for (Component component : ordered) {
                if (statuses.get(component.getName()).getSyncStatus() != SyncStatus.NEED_LOCAL_UPDATE) {
                    continue;
                }
                if (component.isUpdatable() && spec.isEnableFullUpdate()) {
                    wave.add(component.getName());
                } else {
                    heldBack.add(component.getName());
                }
            }
            if (!wave.isEmpty()) {
                log.info("[Cluster: {}] Starting update of {}", ctx.getClusterId(), wave);
                UpdateStatus started = UpdateStatus.builder()
                        .state(UpdateState.WAITING_FOR_DRAIN)
                        .components(wave)
                        .conditions(List.of(condition("UpdateStarted", "Updating " + String.join(", ", wave), now)))
                        .build();
                return finish(ctx, previous, ClusterState.RECONFIGURATION, started, ordered, statuses, List.of(), now);
            }
        }

        if (!dryRun) {
            try {
                for (Component component : ordered) {
                    if (statuses.get(component.getName()).getSyncStatus() != SyncStatus.READY) {
                        component.sync(ctx);
                    }
                }
            } catch (SyncException | CancellationException e) {
                log.warn("[Cluster: {}] Sync failed, keeping status: {}", ctx.getClusterId(), e.getMessage());
                return ReconcileResult.aborted(previous, e);
            }
        }

        switch (state) {
            case RECONFIGURATION:
                UpdateStatus advanced = advanceUpdate(graph, updateStatus, ctx, now);
                if (advanced == null) {
                    log.info("[Cluster: {}] All updated components are ready", ctx.getClusterId());
                    state = ClusterState.UPDATED;
                    updateStatus = updateStatus.toBuilder().state(UpdateState.NONE).build();
                } else {
                    updateStatus = advanced;
                }
                break;
            case CREATING:
                if (allReady(statuses)) {
                    state = ClusterState.RUNNING;
                } else if (creationDeadlinePassed(previous, now)) {
                    log.error("[Cluster: {}] Cluster was not created within {}", ctx.getClusterId(), creationTimeout);
                    state = ClusterState.CREATION_FAILED;
                }
                break;
            case CREATION_FAILED:
                if (allReady(statuses)) {
                    state = ClusterState.RUNNING;
                }
                break;
            default:
                break;
        }

        return finish(ctx, previous, state, updateStatus, ordered, statuses, heldBack, now);
    }

    private void fetchAll(List<Component> ordered, ReconcileContext ctx) throws Exception {
        List<Future<?>> futures = new ArrayList<>();
        for (Component component : ordered) {
            futures.add(fetchExecutor.submit(() -> {
                component.fetch(ctx);
                return null;
            }));
        }
        Exception failure = null;
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException e) {
                if (failure == null) {
                    failure = e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
                    ctx.cancel();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ctx.cancel();
                futures.forEach(f -> f.cancel(true));
                throw e;
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Moves the wave to its next phase once every flagged component completed the current one.
     *
     * @return the update status to keep, or null when the wave is complete
     */
    private UpdateStatus advanceUpdate(ComponentGraph graph, UpdateStatus updateStatus, ReconcileContext ctx,
                                       Instant now) {
        UpdateState phase = updateStatus.getState();
        for (String name : updateStatus.getComponents()) {
            Component component = graph.get(name).orElse(null);
            if (component != null && !component.isPhaseComplete(phase, ctx)) {
                return updateStatus;
            }
        }
        if (phase == UpdateState.WAITING_FOR_PODS_CREATION || phase == UpdateState.NONE) {
            return null;
        }
        UpdateState next = phase.next();
        log.info("[Cluster: {}] Update phase {} complete, moving to {}", ctx.getClusterId(), phase, next);
        List<Condition> conditions = new ArrayList<>(updateStatus.getConditions());
        conditions.add(condition(phase.name() + "Completed", "Moving to " + next, now));
        return updateStatus.toBuilder().state(next).conditions(conditions).build();
    }

    private ReconcileResult finish(ReconcileContext ctx, ClusterStatus previous, ClusterState state,
                                   UpdateStatus updateStatus, List<Component> ordered,
                                   Map<String, ComponentStatus> statuses, List<String> heldBack, Instant now) {
        StatusAggregator.Aggregate aggregate = StatusAggregator.aggregate(ordered, statuses, heldBack);
        ClusterStatus next = previous.toBuilder()
                .state(state)
                .syncStatus(aggregate.getSyncStatus())
                .message(aggregate.getMessage())
                .updateStatus(updateStatus)
                .components(statuses)
                .creationStartedAt(previous.getCreationStartedAt() != null ? previous.getCreationStartedAt() : now)
                .lastTransitionTime(state != previous.getState() ? now : previous.getLastTransitionTime())
                .build();
        if (state != previous.getState()) {
            log.info("[Cluster: {}] State {} -> {}", ctx.getClusterId(), previous.getState(), state);
        }
        return ReconcileResult.completed(previous, next);
    }

    private boolean creationDeadlinePassed(ClusterStatus previous, Instant now) {
        return previous.getCreationStartedAt() != null
                && creationTimeout != null
                && now.isAfter(previous.getCreationStartedAt().plus(creationTimeout));
    }

    private static boolean allReady(Map<String, ComponentStatus> statuses) {
        return statuses.values().stream().allMatch(s -> s.getSyncStatus() == SyncStatus.READY);
    }

    private static Condition condition(String type, String message, Instant now) {
        return Condition.builder()
                .type(type)
                .status(true)
                .message(message)
                .lastTransitionTime(now)
                .build();
    }
}
