package io.clusteroperator.enums;

/**
 * Macro lifecycle state of a managed cluster, persisted in the cluster record.
 *
 * <ul>
 *   <li><strong>CREATING</strong> - components are being created for the first time</li>
 *   <li><strong>RUNNING</strong> - every component reached Ready at least once; updates may start</li>
 *   <li><strong>RECONFIGURATION</strong> - a coordinated update wave is in progress</li>
 *   <li><strong>UPDATED</strong> - the last update wave finished; cleared on the next tick</li>
 *   <li><strong>CREATION_FAILED</strong> - creation did not converge before the deadline</li>
 * </ul>
 */
public enum ClusterState {
    CREATING,
    RUNNING,
    RECONFIGURATION,
    UPDATED,
    CREATION_FAILED;

    /**
     * Whether components may flag themselves for a new update wave in this state.
     */
    public boolean isReadyToUpdate() {
        return this == RUNNING;
    }
}
