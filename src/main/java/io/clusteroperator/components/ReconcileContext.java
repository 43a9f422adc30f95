package io.clusteroperator.components;

import io.clusteroperator.enums.ClusterState;
import io.clusteroperator.models.ComponentStatus;
import io.clusteroperator.models.UpdateStatus;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Call scope of one reconciliation tick: the cluster state read at the start of the tick,
 * deadline and cancellation, and the component statuses computed so far.
 * {@link #readOnly()} views share statuses and cancellation with the context they came from.
 */
@Getter
public class ReconcileContext {

    private final String clusterId;
    private final String namespace;
    private final ClusterState clusterState;
    private final UpdateStatus updateStatus;
    private final Clock clock;
    private final Instant deadline;
    private final Duration drainTimeout;
    private final boolean readOnly;
    private final AtomicBoolean cancelled;
    private final Map<String, ComponentStatus> statuses;

    private ReconcileContext(String clusterId, String namespace, ClusterState clusterState,
                             UpdateStatus updateStatus, Clock clock, Instant deadline, Duration drainTimeout,
                             boolean readOnly, AtomicBoolean cancelled, Map<String, ComponentStatus> statuses) {
        this.clusterId = clusterId;
        this.namespace = namespace;
        this.clusterState = clusterState;
        this.updateStatus = updateStatus == null ? UpdateStatus.none() : updateStatus;
        this.clock = clock;
        this.deadline = deadline;
        this.drainTimeout = drainTimeout;
        this.readOnly = readOnly;
        this.cancelled = cancelled;
        this.statuses = statuses;
    }

    /**
     * Context for one live tick. A null timeout means no deadline.
     */
    public static ReconcileContext forTick(String clusterId, String namespace, ClusterState clusterState,
                                           UpdateStatus updateStatus, Clock clock, Duration timeout,
                                           Duration drainTimeout) {
        Instant deadline = timeout == null ? null : clock.instant().plus(timeout);
        return new ReconcileContext(clusterId, namespace, clusterState, updateStatus, clock, deadline,
                drainTimeout, false, new AtomicBoolean(false), new ConcurrentHashMap<>());
    }

    public ReconcileContext readOnly() {
        if (readOnly) {
            return this;
        }
        return new ReconcileContext(clusterId, namespace, clusterState, updateStatus, clock, deadline,
                drainTimeout, true, cancelled, statuses);
    }

    public Instant now() {
        return clock.instant();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || (deadline != null && clock.instant().isAfter(deadline));
    }

    /**
     * Called before every fetch and every object write.
     */
    public void ensureActive() {
        if (cancelled.get()) {
            throw new CancellationException("Tick of cluster " + clusterId + " was cancelled");
        }
        if (deadline != null && clock.instant().isAfter(deadline)) {
            throw new CancellationException("Tick of cluster " + clusterId + " exceeded its deadline " + deadline);
        }
    }

    public void assertMutable() {
        if (readOnly) {
            throw new InvariantViolationException("Write attempted during read-only evaluation of cluster " + clusterId);
        }
    }

    public void recordStatus(String componentName, ComponentStatus status) {
        statuses.put(componentName, status);
    }

    /**
     * Status of a component computed earlier in this tick; evaluated on demand (read-only) if it was not.
     */
    public ComponentStatus statusOf(Component component) {
        ComponentStatus known = statuses.get(component.getName());
        if (known != null) {
            return known;
        }
        ComponentStatus computed = component.status(this);
        statuses.put(component.getName(), computed);
        return computed;
    }

    public ComponentStatus getRecordedStatus(String componentName) {
        return statuses.get(componentName);
    }
}
