package io.clusteroperator;

import io.clusteroperator.config.OperatorConfig;
import io.clusteroperator.election.LeaderElection;
import io.clusteroperator.metrics.MetricsProvider;
import io.clusteroperator.reconciler.ClusterReconciler;
import io.clusteroperator.resources.KubernetesResourceAccessor;
import io.clusteroperator.resources.ResourceAccessor;
import io.clusteroperator.store.ClusterStore;
import io.clusteroperator.store.EtcdClusterStore;
import io.clusteroperator.store.EtcdPathResolver;
import io.clusteroperator.util.EnvironmentUtils;
import io.etcd.jetcd.Client;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static io.clusteroperator.config.Constants.LEADER_ELECTION_TTL_SECONDS;

/**
 * Main Spring Boot application class for the cluster lifecycle operator.
 *
 * The operator reads cluster records from etcd, reconciles the Kubernetes objects of every
 * cluster toward its spec and writes the observed status back. Only the elected replica
 * runs reconcile loops; every replica serves the read-only status API.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.clusteroperator")
public class ClusterOperatorApplication {

    public static void main(String[] args) {
        log.info("Starting Cluster Lifecycle Operator");

        try {
            SpringApplication.run(ClusterOperatorApplication.class, args);
            log.info("Cluster Lifecycle Operator started successfully");
        } catch (Exception e) {
            log.error("Failed to start Cluster Lifecycle Operator: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public OperatorConfig config() {
        OperatorConfig config = new OperatorConfig();
        log.info("Loaded configuration");
        return config;
    }

    /**
     * Closed by the cluster store that owns it.
     */
    @Bean(destroyMethod = "")
    public Client etcdClient(OperatorConfig config) {
        log.info("Connecting to etcd at {}", String.join(", ", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public ClusterStore clusterStore(Client etcdClient, OperatorConfig config) {
        log.info("Initializing etcd cluster store under /{}", config.getRootPrefix());
        return new EtcdClusterStore(etcdClient, config.getRootPrefix());
    }

    @Bean
    public KubernetesClient kubernetesClient() {
        log.info("Initializing Kubernetes client");
        return new KubernetesClientBuilder().build();
    }

    @Bean
    public ResourceAccessor resourceAccessor(KubernetesClient kubernetesClient) {
        return new KubernetesResourceAccessor(kubernetesClient);
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, @Value("${operator.id:}") String operatorId) {
        String id = operatorId == null || operatorId.isBlank() ? EnvironmentUtils.getNodeName() : operatorId;
        return new MetricsProvider(meterRegistry, id);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(OperatorConfig config) {
        log.info("Initializing fetch executor with {} threads", config.getFetchParallelism());
        return Executors.newFixedThreadPool(config.getFetchParallelism(), r -> {
            Thread t = new Thread(r);
            t.setName("component-fetch-" + t.getId());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ClusterReconciler clusterReconciler(ExecutorService fetchExecutor, OperatorConfig config) {
        return new ClusterReconciler(fetchExecutor, config.getCreationTimeout());
    }

    @Bean
    public LeaderElection leaderElection(Client etcdClient, OperatorConfig config,
                                         @Value("${operator.id:}") String operatorId) {
        String nodeId = operatorId == null || operatorId.isBlank() ? EnvironmentUtils.getNodeName() : operatorId;
        String electionKey = new EtcdPathResolver(config.getRootPrefix()).getLeaderElectionPath();
        return new LeaderElection(etcdClient, electionKey, nodeId, LEADER_ELECTION_TTL_SECONDS);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public OperatorManager operatorManager(ClusterStore clusterStore, ResourceAccessor resourceAccessor,
                                           ClusterReconciler clusterReconciler, OperatorConfig config,
                                           MetricsProvider metricsProvider, LeaderElection leaderElection) {
        log.info("Initializing OperatorManager");
        return new OperatorManager(clusterStore, resourceAccessor, clusterReconciler, config, metricsProvider,
                leaderElection, Clock.systemUTC());
    }
}
