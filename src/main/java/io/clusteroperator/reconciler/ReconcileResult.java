package io.clusteroperator.reconciler;

import io.clusteroperator.models.ClusterStatus;
import lombok.Value;

/**
 * Outcome of one tick. An aborted tick carries the input status unchanged and the cause.
 */
@Value
public class ReconcileResult {

    ClusterStatus status;
    boolean changed;
    Exception error;

    public static ReconcileResult completed(ClusterStatus previous, ClusterStatus next) {
        return new ReconcileResult(next, !next.equals(previous), null);
    }

    public static ReconcileResult aborted(ClusterStatus previous, Exception error) {
        return new ReconcileResult(previous, false, error);
    }

    public boolean isAborted() {
        return error != null;
    }
}
