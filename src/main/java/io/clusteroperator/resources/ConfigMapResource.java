package io.clusteroperator.resources;

import io.clusteroperator.labeller.Labeller;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;

import java.util.Map;

import static io.clusteroperator.config.Constants.ANNOTATION_CONFIG_CHECKSUM;

/**
 * Config artifact of a server: one file in a ConfigMap, annotated with the payload checksum.
 */
public class ConfigMapResource extends ManagedResource<ConfigMap> {

    public ConfigMapResource(ResourceAccessor accessor, Labeller labeller) {
        super(accessor, labeller, ConfigMap.class, labeller.getConfigMapName());
    }

    public ConfigMap build(String fileName, String payload, String checksum) {
        ConfigMap configMap = new ConfigMapBuilder()
                .withMetadata(buildMetadata())
                .withData(Map.of(fileName, payload))
                .build();
        configMap.getMetadata().setAnnotations(Map.of(ANNOTATION_CONFIG_CHECKSUM, checksum));
        return configMap;
    }

    public String getDeployedPayload(String fileName) {
        if (!exists() || getOldObject().getData() == null) {
            return null;
        }
        return getOldObject().getData().get(fileName);
    }
}
