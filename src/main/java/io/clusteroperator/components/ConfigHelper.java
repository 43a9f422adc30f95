package io.clusteroperator.components;

import com.google.common.hash.Hashing;
import io.clusteroperator.configgen.ComponentRole;
import io.clusteroperator.configgen.ConfigException;
import io.clusteroperator.configgen.ConfigProvider;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.ClusterSpec;
import io.clusteroperator.resources.AccessorException;
import io.clusteroperator.resources.ConfigMapResource;
import io.clusteroperator.resources.ObjectRef;
import io.clusteroperator.resources.Observed;
import io.clusteroperator.resources.ResourceAccessor;
import io.fabric8.kubernetes.api.model.ConfigMap;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Owns the config artifact of one server: generates the desired payload (with user overrides
 * merged in) and compares it to the deployed one.
 * The payload is generated once per {@link #apply}, after the overrides were read; nothing is
 * generated before that. A generation failure is kept as {@link #getConfigError()} instead of being thrown.
 */
@Slf4j
public class ConfigHelper {

    /**
     * State read by {@link #load}; applied atomically with the server's other objects.
     */
    public static final class Loaded {
        private final Observed<ConfigMap> configMap;
        private final Observed<ConfigMap> overrides;

        private Loaded(Observed<ConfigMap> configMap, Observed<ConfigMap> overrides) {
            this.configMap = configMap;
            this.overrides = overrides;
        }
    }

    private final ConfigMapResource configMap;
    private final ObjectRef<ConfigMap> overridesRef;
    private final ResourceAccessor accessor;
    private final ConfigProvider provider;
    private final ComponentRole role;
    private final ClusterSpec clusterSpec;
    private final String fileName;

    private String desiredPayload;
    private ConfigException configError;
    private boolean applied;

    public ConfigHelper(ResourceAccessor accessor, Labeller labeller, ConfigProvider provider,
                        ComponentRole role, ClusterSpec clusterSpec) {
        this.accessor = accessor;
        this.configMap = new ConfigMapResource(accessor, labeller);
        this.overridesRef = clusterSpec.getConfigOverrides() == null ? null
                : ObjectRef.of(ConfigMap.class, labeller.getNamespace(), clusterSpec.getConfigOverrides().getName());
        this.provider = provider;
        this.role = role;
        this.clusterSpec = clusterSpec;
        this.fileName = role.getType().getConfigFileName();
    }

    public Loaded load(ReconcileContext ctx) throws AccessorException {
        ctx.ensureActive();
        Observed<ConfigMap> current = configMap.load();
        Observed<ConfigMap> overrides = Observed.missing();
        if (overridesRef != null) {
            ctx.ensureActive();
            overrides = accessor.fetch(overridesRef);
        }
        return new Loaded(current, overrides);
    }

    public void apply(Loaded loaded) {
        configMap.apply(loaded.configMap);
        String overrides = null;
        if (loaded.overrides.exists() && loaded.overrides.get().getData() != null) {
            overrides = loaded.overrides.get().getData().get(fileName);
        }
        regenerate(overrides);
        applied = true;
    }

    private void regenerate(String overrides) {
        try {
            String generated = provider.generate(role, clusterSpec);
            desiredPayload = provider.applyOverrides(generated, overrides);
            configError = null;
        } catch (ConfigException e) {
            log.warn("Config generation failed for {}: {}", role.getType().getComponentName(), e.getMessage());
            desiredPayload = null;
            configError = e;
        }
    }

    public ConfigException getConfigError() {
        return configError;
    }

    public String getFileName() {
        return fileName;
    }

    public ConfigMapResource getConfigMap() {
        return configMap;
    }

    public boolean exists() {
        return configMap.exists();
    }

    /**
     * True when the artifact is missing or its payload differs from the desired one.
     * Always false while generation is failing, since there is nothing to write.
     */
    public boolean needSync() {
        if (!applied) {
            return true;
        }
        if (configError != null) {
            return false;
        }
        if (!configMap.exists()) {
            return true;
        }
        try {
            return provider.needsReload(configMap.getDeployedPayload(fileName), desiredPayload);
        } catch (ConfigException e) {
            return true;
        }
    }

    public boolean needReload() throws ConfigException {
        checkApplied();
        if (configError != null) {
            throw configError;
        }
        return provider.needsReload(configMap.getDeployedPayload(fileName), desiredPayload);
    }

    public ConfigMap build() throws ConfigException {
        checkApplied();
        if (configError != null) {
            throw configError;
        }
        String checksum = Hashing.sha256().hashString(desiredPayload, StandardCharsets.UTF_8).toString();
        return configMap.build(fileName, desiredPayload, checksum);
    }

    private void checkApplied() {
        if (!applied) {
            throw new IllegalStateException("config of " + role.getType().getComponentName() + " was not loaded");
        }
    }
}
