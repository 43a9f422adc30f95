package io.clusteroperator.enums;

/**
 * Per-component reconciliation status, recomputed on every tick.
 */
public enum SyncStatus {
    READY,
    PENDING,
    BLOCKED,
    NEED_LOCAL_UPDATE,
    NEED_FULL_UPDATE,
    NEED_RESTART;

    /**
     * Ready family: dependents may proceed when their dependency is in one of these.
     */
    public boolean isRunning() {
        return this == READY || this == NEED_LOCAL_UPDATE;
    }
}
