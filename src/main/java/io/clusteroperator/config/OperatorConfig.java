package io.clusteroperator.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static io.clusteroperator.config.Constants.*;

/**
 * Configuration for the operator.
 * Loads the {@code operator} and {@code etcd} sections of application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class OperatorConfig {

    private final String[] etcdEndpoints;
    private final String rootPrefix;
    private final long reconcileIntervalSeconds;
    private final Duration tickTimeout;
    private final int fetchParallelism;
    private final String defaultNamespace;
    private final boolean dryRun;
    private final Duration creationTimeout;
    private final Duration drainTimeout;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    static final String EXTERNAL_CONFIG_ENV_VAR = "OPERATOR_CONFIG_FILE";

    public OperatorConfig() {
        this(null);
    }

    /**
     * Loads from the given file when it exists, otherwise from the usual locations.
     */
    public OperatorConfig(String explicitPath) {
        ConfigModel config = loadYamlConfig(explicitPath);
        Operator operator = config.getOperator() != null ? config.getOperator() : new Operator();

        this.etcdEndpoints = parseEndpoints(config);
        this.rootPrefix = nonBlankOr(operator.getRootPrefix(), DEFAULT_ROOT_PREFIX);
        this.reconcileIntervalSeconds = positiveOr(operator.getReconcileIntervalSeconds(), DEFAULT_RECONCILE_INTERVAL_SECONDS);
        this.tickTimeout = Duration.ofSeconds(positiveOr(operator.getTickTimeoutSeconds(), DEFAULT_TICK_TIMEOUT_SECONDS));
        this.fetchParallelism = (int) positiveOr(
                operator.getFetchParallelism() == null ? null : operator.getFetchParallelism().longValue(),
                DEFAULT_FETCH_PARALLELISM);
        this.defaultNamespace = nonBlankOr(operator.getNamespace(), DEFAULT_NAMESPACE);
        this.dryRun = Boolean.TRUE.equals(operator.getDryRun());
        this.creationTimeout = Duration.ofSeconds(positiveOr(operator.getCreationTimeoutSeconds(), DEFAULT_CREATION_TIMEOUT_SECONDS));
        this.drainTimeout = Duration.ofSeconds(positiveOr(operator.getDrainTimeoutSeconds(), DEFAULT_DRAIN_TIMEOUT_SECONDS));

        log.info("Loaded operator config - etcd endpoints: {}, root prefix: {}, reconcile interval: {}s, dry run: {}",
                String.join(", ", etcdEndpoints), rootPrefix, reconcileIntervalSeconds, dryRun);
    }

    private ConfigModel loadYamlConfig(String explicitPath) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        String externalConfigPath = explicitPath != null ? explicitPath : System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified: {}", externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        if (inputStream == null) {
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
            List<String> endpoints = config.getEtcd().getEndpoints();
            if (!endpoints.isEmpty()) {
                return endpoints.toArray(new String[0]);
            }
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private static long positiveOr(Long value, long fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static String nonBlankOr(String value, String fallback) {
        return value != null && !value.isBlank() ? value.trim() : fallback;
    }

    /**
     * Configuration model for the application.yml file. Sections Spring reads itself
     * (server, management, spring) are accepted and ignored here.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Operator operator;
        private Object server;
        private Object management;
        private Object spring;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Operator {
        private String id;
        private String rootPrefix;
        private Long reconcileIntervalSeconds;
        private Long tickTimeoutSeconds;
        private Integer fetchParallelism;
        private String namespace;
        private Boolean dryRun;
        private Long creationTimeoutSeconds;
        private Long drainTimeoutSeconds;
    }
}
