package io.clusteroperator.configgen;

import io.clusteroperator.models.ClusterSpec;

/**
 * Produces per-role configuration payloads.
 */
public interface ConfigProvider {

    String generate(ComponentRole role, ClusterSpec clusterSpec) throws ConfigException;

    /**
     * Whether a deployed payload differs from the desired one in a way the server must be restarted for.
     * A missing deployed payload always needs reload.
     */
    boolean needsReload(String deployedPayload, String desiredPayload) throws ConfigException;

    /**
     * Deep-merges user overrides into a generated payload; overrides win on conflicts.
     */
    String applyOverrides(String payload, String overrides) throws ConfigException;
}
