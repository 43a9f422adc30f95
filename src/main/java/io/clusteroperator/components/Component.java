package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.enums.UpdateState;
import io.clusteroperator.models.ComponentStatus;
import io.clusteroperator.resources.AccessorException;

import java.util.List;

/**
 * One reconciled role of the managed cluster.
 * A component is built fresh every tick from the cluster spec and keeps no state across ticks
 * beyond the objects it manages.
 */
public interface Component {

    String getName();

    ComponentType getType();

    /**
     * Components that must be in the ready family before this one may progress.
     */
    List<Component> getDependencies();

    /**
     * Whether this component may take part in an update wave.
     */
    boolean isUpdatable();

    /**
     * Read the observed state of every owned object. On failure no local state changes.
     */
    void fetch(ReconcileContext ctx) throws AccessorException;

    /**
     * Read-only evaluation; total for every reachable state. A failure here is an
     * {@link InvariantViolationException}.
     */
    ComponentStatus status(ReconcileContext ctx);

    /**
     * Live evaluation: decides like {@link #status} and then performs the decided action.
     *
     * @return the decided status
     */
    ComponentStatus sync(ReconcileContext ctx) throws SyncException;

    /**
     * Whether this component has finished the given update phase, judged from the fetched state.
     */
    boolean isPhaseComplete(UpdateState phase, ReconcileContext ctx);
}
