package io.clusteroperator.util;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Environment lookups used to identify this operator replica.
 */
public final class EnvironmentUtils {

    public static final String NODE_NAME_ENV = "NODE_NAME";
    public static final String HOSTNAME_ENV = "HOSTNAME";

    private EnvironmentUtils() {
        // Utility class
    }

    /**
     * Get environment variable with default value; blank counts as unset.
     */
    public static String getEnv(String name, String defaultValue) {
        String value = System.getenv(name);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    /**
     * Identity of this replica for leader election and metric tags:
     * NODE_NAME, then HOSTNAME, then the local host name, then "unknown".
     */
    public static String getNodeName() {
        String fromEnv = getEnv(NODE_NAME_ENV, getEnv(HOSTNAME_ENV, null));
        if (fromEnv != null) {
            return fromEnv;
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "unknown";
        }
    }
}
