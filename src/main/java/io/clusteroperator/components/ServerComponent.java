package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.enums.SyncStatus;
import io.clusteroperator.enums.UpdateState;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.ComponentStatus;
import io.clusteroperator.resources.AccessorException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static io.clusteroperator.config.Constants.*;
import static io.clusteroperator.enums.ClusterState.RECONFIGURATION;

/**
 * Component wrapping one managed server. Evaluation is a single decision function shared by
 * {@link #status} (read-only) and {@link #sync} (executes the decided action). The rules are
 * tried in order and the first match wins:
 * <ol>
 *   <li>update initiation permitted and the server needs update: NEED_LOCAL_UPDATE</li>
 *   <li>cluster in reconfiguration: the update protocol decides, if it has an opinion</li>
 *   <li>a dependency outside the ready family: BLOCKED(dependency name)</li>
 *   <li>config generation failing: BLOCKED("config: ...")</li>
 *   <li>server needs sync: PENDING("components"), action SYNC</li>
 *   <li>pods not ready: BLOCKED("pods")</li>
 *   <li>READY</li>
 * </ol>
 */
@Slf4j
public abstract class ServerComponent implements Component {

    protected final Labeller labeller;
    protected final ManagedServer server;
    private final List<Component> dependencies;

    protected ServerComponent(Labeller labeller, ManagedServer server, List<Component> dependencies) {
        this.labeller = labeller;
        this.server = server;
        this.dependencies = dependencies == null ? Collections.emptyList() : List.copyOf(dependencies);
    }

    @Override
    public String getName() {
        return labeller.getComponentName();
    }

    @Override
    public ComponentType getType() {
        return labeller.getType();
    }

    @Override
    public List<Component> getDependencies() {
        return dependencies;
    }

    @Override
    public boolean isUpdatable() {
        return true;
    }

    public ManagedServer getServer() {
        return server;
    }

    @Override
    public void fetch(ReconcileContext ctx) throws AccessorException {
        server.fetch(ctx);
    }

    @Override
    public ComponentStatus status(ReconcileContext ctx) {
        try {
            return decide(ctx.readOnly()).getStatus();
        } catch (InvariantViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InvariantViolationException("Status evaluation of " + getName() + " failed", e);
        }
    }

    @Override
    public ComponentStatus sync(ReconcileContext ctx) throws SyncException {
        ComponentDecision decision = decide(ctx);
        switch (decision.getAction()) {
            case SYNC:
                log.info("Syncing {} ({})", getName(), decision.getStatus());
                server.sync(ctx);
                break;
            case REMOVE_PODS:
                server.removePods(ctx);
                break;
            case DRAIN:
                server.requestDrain(ctx);
                break;
            default:
                break;
        }
        return decision.getStatus();
    }

    ComponentDecision decide(ReconcileContext ctx) {
        if (ctx.getClusterState().isReadyToUpdate() && server.needUpdate()) {
            return ComponentDecision.of(ComponentStatus.needLocalUpdate());
        }

        if (ctx.getClusterState() == RECONFIGURATION) {
            Optional<ComponentDecision> update = decideUpdate(ctx);
            if (update.isPresent()) {
                return update.get();
            }
        }

        for (Component dependency : dependencies) {
            if (!ctx.statusOf(dependency).isRunning()) {
                return ComponentDecision.of(ComponentStatus.blocked(dependency.getName()));
            }
        }

        if (server.getConfigError() != null) {
            return ComponentDecision.of(ComponentStatus.blocked(REASON_CONFIG_PREFIX + server.getConfigError().getMessage()));
        }

        if (server.needSync()) {
            return ComponentDecision.of(ComponentStatus.pending(REASON_COMPONENTS), ComponentAction.SYNC);
        }

        if (!server.arePodsReady(ctx)) {
            return ComponentDecision.of(ComponentStatus.blocked(REASON_PODS));
        }

        return ComponentDecision.of(ComponentStatus.ready());
    }

    /**
     * Update protocol for one component. Components not flagged for the running wave, and
     * flagged ones waiting for pod creation, get no opinion here and use the normal rules.
     */
    Optional<ComponentDecision> decideUpdate(ReconcileContext ctx) {
        if (!ctx.getUpdateStatus().isFlagged(getName())) {
            return Optional.empty();
        }
        switch (ctx.getUpdateStatus().getState()) {
            case WAITING_FOR_DRAIN:
                if (getType().isDrainable() && !server.isDrainRequested() && !server.isDrained(ctx)) {
                    return Optional.of(ComponentDecision.of(ComponentStatus.waiting(REASON_DRAIN), ComponentAction.DRAIN));
                }
                return Optional.of(ComponentDecision.of(ComponentStatus.waiting(REASON_DRAIN)));
            case WAITING_FOR_PODS_REMOVAL:
                if (!server.arePodsRemoved()) {
                    return Optional.of(ComponentDecision.of(ComponentStatus.waiting(REASON_PODS_REMOVAL), ComponentAction.REMOVE_PODS));
                }
                return Optional.of(ComponentDecision.of(ComponentStatus.waiting(REASON_PODS_REMOVAL)));
            default:
                return Optional.empty();
        }
    }

    @Override
    public boolean isPhaseComplete(UpdateState phase, ReconcileContext ctx) {
        switch (phase) {
            case WAITING_FOR_DRAIN:
                return !getType().isDrainable() || server.isDrained(ctx);
            case WAITING_FOR_PODS_REMOVAL:
                return server.arePodsRemoved();
            case WAITING_FOR_PODS_CREATION:
                ComponentStatus status = ctx.getRecordedStatus(getName());
                return status != null && status.getSyncStatus() == SyncStatus.READY;
            default:
                return true;
        }
    }
}
