package io.clusteroperator.enums;

/**
 * Phase of the update sub-protocol while the cluster is in {@link ClusterState#RECONFIGURATION}.
 * Phases only move forward.
 */
public enum UpdateState {
    NONE,
    WAITING_FOR_DRAIN,
    WAITING_FOR_PODS_REMOVAL,
    WAITING_FOR_PODS_CREATION;

    public UpdateState next() {
        switch (this) {
            case WAITING_FOR_DRAIN:
                return WAITING_FOR_PODS_REMOVAL;
            case WAITING_FOR_PODS_REMOVAL:
                return WAITING_FOR_PODS_CREATION;
            default:
                return NONE;
        }
    }
}
