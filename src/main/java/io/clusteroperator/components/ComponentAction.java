package io.clusteroperator.components;

/**
 * Side effect attached to a component decision. Only executed by a live sync.
 */
public enum ComponentAction {
    NONE,
    SYNC,
    REMOVE_PODS,
    DRAIN
}
