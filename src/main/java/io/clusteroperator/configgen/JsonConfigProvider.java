package io.clusteroperator.configgen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.ClusterSpec;
import io.clusteroperator.models.HttpProxiesSpec;
import io.clusteroperator.models.InstanceSpec;
import io.clusteroperator.models.LocationSpec;
import io.clusteroperator.models.LoggerSpec;
import io.clusteroperator.models.UISpec;
import io.fabric8.kubernetes.api.model.VolumeMount;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static io.clusteroperator.config.Constants.DEFAULT_MONITORING_PORT;

/**
 * Renders role configs as JSON documents with sorted keys, so equal configs are equal strings.
 */
@Slf4j
public class JsonConfigProvider implements ConfigProvider {

    private static final int HTTP_PROXY_HTTP_PORT = 80;

    private final String clusterId;
    private final String namespace;
    private final ObjectMapper objectMapper;

    public JsonConfigProvider(String clusterId, String namespace) {
        this.clusterId = clusterId;
        this.namespace = namespace;
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String generate(ComponentRole role, ClusterSpec clusterSpec) throws ConfigException {
        ComponentType type = role.getType();
        InstanceSpec instanceSpec = role.getInstanceSpec();
        if (instanceSpec == null) {
            throw new ConfigException("no instance spec for " + type.getComponentName());
        }

        ObjectNode root = objectMapper.createObjectNode();
        root.put("cluster_id", clusterId);
        root.put("role", type.getLabel());
        root.put("group", role.getGroup());
        root.put("rpc_port", type.getRpcPort());
        root.put("monitoring_port", monitoringPort(instanceSpec));
        root.put("use_ipv6", clusterSpec.isUseIpv6());

        if (type != ComponentType.DISCOVERY) {
            root.set("primary_master", primaryMasterSection(clusterSpec));
        }
        if (clusterSpec.getDiscovery() != null) {
            root.set("discovery", addresses(ComponentType.DISCOVERY, clusterSpec.getDiscovery().getInstanceCount()));
        }
        root.set("locations", locationsSection(type, instanceSpec));
        root.set("logging", loggersSection(instanceSpec.getLoggers()));

        switch (type) {
            case HTTP_PROXY:
                root.put("http_port", HTTP_PROXY_HTTP_PORT);
                root.put("proxy_role", ((HttpProxiesSpec) instanceSpec).getRole());
                break;
            case UI:
                root.set("ui", uiSection(clusterSpec, (UISpec) instanceSpec));
                break;
            default:
                break;
        }
        return render(root);
    }

    @Override
    public boolean needsReload(String deployedPayload, String desiredPayload) throws ConfigException {
        if (deployedPayload == null) {
            return true;
        }
        JsonNode desired = parse(desiredPayload, "desired config");
        try {
            return !objectMapper.readTree(deployedPayload).equals(desired);
        } catch (JsonProcessingException e) {
            log.warn("Deployed config is not valid JSON, treating as stale: {}", e.getOriginalMessage());
            return true;
        }
    }

    @Override
    public String applyOverrides(String payload, String overrides) throws ConfigException {
        if (overrides == null || overrides.isBlank()) {
            return payload;
        }
        JsonNode base = parse(payload, "generated config");
        JsonNode patch = parse(overrides, "config overrides");
        if (!base.isObject() || !patch.isObject()) {
            throw new ConfigException("config overrides must be a JSON object");
        }
        merge((ObjectNode) base, (ObjectNode) patch);
        return render(base);
    }

    private void merge(ObjectNode target, ObjectNode patch) {
        Iterator<Map.Entry<String, JsonNode>> fields = patch.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                merge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue().deepCopy());
            }
        }
    }

    private ObjectNode primaryMasterSection(ClusterSpec clusterSpec) throws ConfigException {
        if (clusterSpec.getPrimaryMasters() == null) {
            throw new ConfigException("primaryMasters is not configured");
        }
        ObjectNode section = addresses(ComponentType.PRIMARY_MASTER, clusterSpec.getPrimaryMasters().getInstanceCount());
        section.put("cell_tag", clusterSpec.getPrimaryMasters().getCellTag());
        return section;
    }

    private ObjectNode addresses(ComponentType type, int instanceCount) {
        Labeller labeller = new Labeller(clusterId, namespace, type);
        ObjectNode section = objectMapper.createObjectNode();
        ArrayNode addresses = section.putArray("addresses");
        for (String host : labeller.getInstanceHostnames(instanceCount)) {
            addresses.add(host + ":" + type.getRpcPort());
        }
        return section;
    }

    private ArrayNode locationsSection(ComponentType type, InstanceSpec instanceSpec) throws ConfigException {
        ArrayNode locations = objectMapper.createArrayNode();
        for (LocationSpec location : instanceSpec.getLocations()) {
            if (location.getLocationType() == null || location.getPath() == null) {
                throw new ConfigException(type.getComponentName() + " declares a location without type or path");
            }
            if (!isUnderMount(location.getPath(), instanceSpec.getVolumeMounts())) {
                throw new ConfigException("location " + location.getPath() + " of " + type.getComponentName()
                        + " is not under any volume mount");
            }
            ObjectNode node = locations.addObject();
            node.put("type", location.getLocationType().getValue());
            node.put("path", location.getPath());
        }
        return locations;
    }

    private static boolean isUnderMount(String path, List<VolumeMount> mounts) {
        for (VolumeMount mount : mounts) {
            String mountPath = mount.getMountPath();
            if (mountPath != null && (path.equals(mountPath) || path.startsWith(mountPath.endsWith("/") ? mountPath : mountPath + "/"))) {
                return true;
            }
        }
        return false;
    }

    private ObjectNode loggersSection(List<LoggerSpec> loggers) {
        ObjectNode logging = objectMapper.createObjectNode();
        ObjectNode writers = logging.putObject("writers");
        ArrayNode rules = logging.putArray("rules");
        for (LoggerSpec logger : loggers) {
            if (logger.getName() == null) {
                continue;
            }
            ObjectNode writer = writers.putObject(logger.getName());
            writer.put("type", logger.getWriterType());
            writer.put("format", logger.getFormat());
            writer.put("compression", logger.getCompression());
            if (logger.getRotationPolicy() != null) {
                ObjectNode rotation = writer.putObject("rotation_policy");
                if (logger.getRotationPolicy().getMaxTotalSizeToKeep() != null) {
                    rotation.put("max_total_size_to_keep", logger.getRotationPolicy().getMaxTotalSizeToKeep());
                }
                if (logger.getRotationPolicy().getRotationPeriodMilliseconds() != null) {
                    rotation.put("rotation_period", logger.getRotationPolicy().getRotationPeriodMilliseconds());
                }
            }
            ObjectNode rule = rules.addObject();
            rule.put("min_level", logger.getMinLogLevel());
            rule.putArray("writers").add(logger.getName());
            if (logger.getCategoriesFilter() != null) {
                ArrayNode categories = rule.putArray(
                        "exclude".equalsIgnoreCase(logger.getCategoriesFilter().getType())
                                ? "exclude_categories" : "include_categories");
                logger.getCategoriesFilter().getValues().forEach(categories::add);
            }
        }
        return logging;
    }

    private ObjectNode uiSection(ClusterSpec clusterSpec, UISpec uiSpec) {
        ObjectNode ui = objectMapper.createObjectNode();
        if (!clusterSpec.getHttpProxies().isEmpty()) {
            Labeller proxies = new Labeller(clusterId, namespace, ComponentType.HTTP_PROXY,
                    clusterSpec.getHttpProxies().get(0).getRole());
            ui.put("proxy", proxies.getBalancerServiceName() + "." + namespace + ".svc.cluster.local:" + HTTP_PROXY_HTTP_PORT);
        }
        if (clusterSpec.getAdminCredentials() != null) {
            ui.put("credentials_secret", clusterSpec.getAdminCredentials().getName());
        }
        ui.put("service_type", uiSpec.getServiceType());
        return ui;
    }

    private static int monitoringPort(InstanceSpec instanceSpec) {
        return instanceSpec.getMonitoringPort() != null ? instanceSpec.getMonitoringPort() : DEFAULT_MONITORING_PORT;
    }

    private JsonNode parse(String json, String what) throws ConfigException {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigException(what + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String render(JsonNode node) throws ConfigException {
        try {
            // ObjectNode keeps insertion order; go through a sorted map for a canonical form
            Object canonical = objectMapper.treeToValue(node, Object.class);
            return objectMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new ConfigException("failed to render config: " + e.getOriginalMessage(), e);
        }
    }
}
