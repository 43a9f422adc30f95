package io.clusteroperator.store;

import java.nio.file.Paths;

import static io.clusteroperator.config.Constants.*;

/**
 * etcd key layout for cluster records under a configurable root prefix.
 */
public class EtcdPathResolver {

    private final String rootPrefix;

    public EtcdPathResolver(String rootPrefix) {
        this.rootPrefix = rootPrefix;
    }

    /**
     * Pattern: /<root>/clusters
     */
    public String getClustersPrefix() {
        return Paths.get(PATH_DELIMITER, rootPrefix, PATH_CLUSTERS).toString();
    }

    /**
     * Pattern: /<root>/clusters/<cluster-id>
     */
    public String getClusterPath(String clusterId) {
        return Paths.get(getClustersPrefix(), clusterId).toString();
    }

    /**
     * Pattern: /<root>/leader-election
     */
    public String getLeaderElectionPath() {
        return Paths.get(PATH_DELIMITER, rootPrefix, PATH_LEADER_ELECTION).toString();
    }

    /**
     * Last path segment of a cluster key, or null when the key is not under the clusters prefix.
     */
    public String clusterIdFromKey(String key) {
        String prefix = getClustersPrefix() + PATH_DELIMITER;
        if (key == null || !key.startsWith(prefix) || key.length() == prefix.length()) {
            return null;
        }
        String rest = key.substring(prefix.length());
        return rest.contains(PATH_DELIMITER) ? null : rest;
    }
}
