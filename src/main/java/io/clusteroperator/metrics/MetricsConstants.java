package io.clusteroperator.metrics;

/**
 * Constants for metrics names and tags used by the operator.
 */
public class MetricsConstants {
    public final static String RECONCILE_TICK_DURATION_METRIC_NAME = "reconcile_tick_duration";
    public final static String RECONCILE_TICK_FAILURES_METRIC_NAME = "reconcile_tick_failures";
    public final static String COMPONENT_SYNC_STATUS_METRIC_NAME = "component_sync_status";
    public final static String CLUSTER_STATE_METRIC_NAME = "cluster_state";
    public final static String UPDATE_WAVES_STARTED_METRIC_NAME = "update_waves_started";
    public final static String CLUSTER_ID_TAG = "clusterId";
    public final static String COMPONENT_TAG = "component";
    public final static String REASON_TAG = "reason";

    private MetricsConstants() {}
}
