package io.clusteroperator.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_ROOT_PREFIX = "cluster-operator";
    public static final long DEFAULT_RECONCILE_INTERVAL_SECONDS = 10L;
    public static final long DEFAULT_TICK_TIMEOUT_SECONDS = 60L;
    public static final int DEFAULT_FETCH_PARALLELISM = 4;
    public static final String DEFAULT_NAMESPACE = "default";
    public static final long DEFAULT_CREATION_TIMEOUT_SECONDS = 1800L;
    public static final long DEFAULT_DRAIN_TIMEOUT_SECONDS = 300L;

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_CLUSTERS = "clusters";
    public static final String PATH_LEADER_ELECTION = "leader-election";
    public static final long LEADER_ELECTION_TTL_SECONDS = 15L;

    // Object labels
    public static final String LABEL_APP_NAME = "app.kubernetes.io/name";
    public static final String LABEL_INSTANCE = "app.kubernetes.io/instance";
    public static final String LABEL_COMPONENT = "app.kubernetes.io/component";
    public static final String LABEL_PART_OF = "app.kubernetes.io/part-of";
    public static final String LABEL_MANAGED_BY = "app.kubernetes.io/managed-by";
    public static final String MANAGED_BY_VALUE = "cluster-operator";

    // Object annotations
    public static final String ANNOTATION_CONFIG_CHECKSUM = "cluster-operator/config-checksum";
    public static final String ANNOTATION_DRAIN_REQUESTED = "cluster-operator/drain-requested";
    public static final String ANNOTATION_DRAINED = "cluster-operator/drained";

    // Server container layout
    public static final String MAIN_CONTAINER_NAME = "server";
    public static final String PREPARE_CONTAINER_NAME = "prepare-locations";
    public static final String CONFIG_VOLUME_NAME = "config";
    public static final String CONFIG_MOUNT_PATH = "/config";
    public static final int DEFAULT_MONITORING_PORT = 10010;

    // Reasons reported in component statuses
    public static final String REASON_COMPONENTS = "components";
    public static final String REASON_PODS = "pods";
    public static final String REASON_DRAIN = "drain";
    public static final String REASON_PODS_REMOVAL = "pods removal";
    public static final String REASON_CONFIG_PREFIX = "config: ";
}
