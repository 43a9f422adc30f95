package io.clusteroperator.labeller;

import io.clusteroperator.enums.ComponentType;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static io.clusteroperator.config.Constants.*;

/**
 * Names and labels of everything one component owns.
 * A component is a role plus an optional group (proxy role, node group name); the
 * group "default" is left out of names.
 */
@Getter
public class Labeller {

    public static final String DEFAULT_GROUP = "default";

    private final String clusterId;
    private final String namespace;
    private final ComponentType type;
    private final String group;

    public Labeller(String clusterId, String namespace, ComponentType type, String group) {
        this.clusterId = clusterId;
        this.namespace = namespace;
        this.type = type;
        this.group = group == null || group.isBlank() ? DEFAULT_GROUP : group;
    }

    public Labeller(String clusterId, String namespace, ComponentType type) {
        this(clusterId, namespace, type, DEFAULT_GROUP);
    }

    private boolean hasGroup() {
        return !DEFAULT_GROUP.equals(group);
    }

    /**
     * Stable component name used in statuses and dependency reasons, e.g. "HttpProxy-public".
     */
    public String getComponentName() {
        return hasGroup() ? type.getComponentName() + "-" + group : type.getComponentName();
    }

    public String getResourceName() {
        String base = clusterId + "-" + type.getLabel();
        return hasGroup() ? base + "-" + group : base;
    }

    public String getStatefulSetName() {
        return getResourceName();
    }

    public String getHeadlessServiceName() {
        return getResourceName();
    }

    public String getMonitoringServiceName() {
        return getResourceName() + "-monitoring";
    }

    public String getBalancerServiceName() {
        return getResourceName() + "-lb";
    }

    public String getConfigMapName() {
        return getResourceName() + "-config";
    }

    /**
     * Labels identifying the pods of this component; used as the workload selector.
     */
    public Map<String, String> getSelectorLabels() {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(LABEL_INSTANCE, clusterId);
        labels.put(LABEL_COMPONENT, hasGroup() ? type.getLabel() + "-" + group : type.getLabel());
        return labels;
    }

    public Map<String, String> getMetaLabels() {
        Map<String, String> labels = new LinkedHashMap<>(getSelectorLabels());
        labels.put(LABEL_APP_NAME, type.getLabel());
        labels.put(LABEL_PART_OF, clusterId);
        labels.put(LABEL_MANAGED_BY, MANAGED_BY_VALUE);
        return Collections.unmodifiableMap(labels);
    }

    public String getHeadlessServiceDomain() {
        return getHeadlessServiceName() + "." + namespace + ".svc.cluster.local";
    }

    /**
     * Stable per-pod hostnames of the workload set: {@code <sts>-<i>.<headless domain>}.
     */
    public List<String> getInstanceHostnames(int instanceCount) {
        List<String> hosts = new ArrayList<>();
        for (int i = 0; i < instanceCount; i++) {
            hosts.add(getStatefulSetName() + "-" + i + "." + getHeadlessServiceDomain());
        }
        return hosts;
    }
}
