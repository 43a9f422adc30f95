package io.clusteroperator.components;

import io.clusteroperator.configgen.ComponentRole;
import io.clusteroperator.configgen.ConfigException;
import io.clusteroperator.configgen.ConfigProvider;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.ClusterSpec;
import io.clusteroperator.models.InstanceSpec;
import io.clusteroperator.models.LocationSpec;
import io.clusteroperator.resources.AccessorException;
import io.clusteroperator.resources.BalancerServiceResource;
import io.clusteroperator.resources.HeadlessServiceResource;
import io.clusteroperator.resources.ManagedResource;
import io.clusteroperator.resources.MonitoringServiceResource;
import io.clusteroperator.resources.Observed;
import io.clusteroperator.resources.ResourceAccessor;
import io.clusteroperator.resources.StatefulSetResource;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.fabric8.kubernetes.api.model.VolumeMount;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;

import static io.clusteroperator.config.Constants.*;

/**
 * Managed server backed by a StatefulSet. Image is the role override, else the cluster default.
 */
@Slf4j
public class StatefulServer implements ManagedServer {

    private final Labeller labeller;
    private final ClusterSpec clusterSpec;
    private final InstanceSpec instanceSpec;
    private final String image;
    private final String binaryPath;
    private final int rpcPort;
    private final int monitoringPort;

    private final StatefulSetResource statefulSet;
    private final HeadlessServiceResource headlessService;
    private final MonitoringServiceResource monitoringService;
    private final ConfigHelper configHelper;

    private BalancerServiceResource balancerService;
    private String balancerServiceType;
    private int balancerPort;

    private StatefulSet builtStatefulSet;

    public StatefulServer(ResourceAccessor accessor, Labeller labeller,
                          ConfigProvider configProvider, ComponentRole role, ClusterSpec clusterSpec,
                          String defaultImage) {
        this.labeller = labeller;
        this.clusterSpec = clusterSpec;
        this.instanceSpec = role.getInstanceSpec();
        this.image = instanceSpec.getImage() != null ? instanceSpec.getImage() : defaultImage;
        this.binaryPath = role.getType().getBinaryPath();
        this.rpcPort = role.getType().getRpcPort();
        this.monitoringPort = instanceSpec.getMonitoringPort() != null
                ? instanceSpec.getMonitoringPort() : DEFAULT_MONITORING_PORT;
        this.statefulSet = new StatefulSetResource(accessor, labeller);
        this.headlessService = new HeadlessServiceResource(accessor, labeller);
        this.monitoringService = new MonitoringServiceResource(accessor, labeller);
        this.configHelper = new ConfigHelper(accessor, labeller, configProvider, role, clusterSpec);
    }

    /**
     * Adds a load-balanced service in front of the pods.
     */
    public StatefulServer withBalancer(ResourceAccessor accessor,
                                       String serviceType, int port) {
        this.balancerService = new BalancerServiceResource(accessor, labeller);
        this.balancerServiceType = serviceType;
        this.balancerPort = port;
        return this;
    }

    @Override
    public void fetch(ReconcileContext ctx) throws AccessorException {
        ctx.ensureActive();
        Observed<StatefulSet> sts = statefulSet.load();
        ctx.ensureActive();
        Observed<Service> headless = headlessService.load();
        ctx.ensureActive();
        Observed<Service> monitoring = monitoringService.load();
        Observed<Service> balancer = Observed.missing();
        if (balancerService != null) {
            ctx.ensureActive();
            balancer = balancerService.load();
        }
        ConfigHelper.Loaded config = configHelper.load(ctx);

        statefulSet.apply(sts);
        headlessService.apply(headless);
        monitoringService.apply(monitoring);
        if (balancerService != null) {
            balancerService.apply(balancer);
        }
        configHelper.apply(config);
    }

    private boolean exists() {
        return statefulSet.exists()
                && headlessService.exists()
                && monitoringService.exists()
                && (balancerService == null || balancerService.exists())
                && configHelper.exists();
    }

    @Override
    public boolean needSync() {
        return configHelper.needSync()
                || !exists()
                || statefulSet.needSync(instanceSpec.getInstanceCount());
    }

    @Override
    public boolean needUpdate() {
        if (!exists()) {
            return false;
        }
        if (!image.equals(statefulSet.getDeployedImage())) {
            return true;
        }
        try {
            return configHelper.needReload();
        } catch (ConfigException e) {
            return false;
        }
    }

    @Override
    public boolean arePodsReady(ReconcileContext ctx) {
        return statefulSet.arePodsReady();
    }

    @Override
    public boolean arePodsRemoved() {
        return headlessService.exists() && statefulSet.arePodsRemoved();
    }

    @Override
    public void sync(ReconcileContext ctx) throws SyncException {
        try {
            write(ctx, configHelper.getConfigMap(), configHelper.build());
        } catch (ConfigException e) {
            throw new SyncException(configHelper.getConfigMap().getRef(), e);
        }
        write(ctx, headlessService, headlessService.build(rpcPort));
        write(ctx, monitoringService, monitoringService.build(monitoringPort));
        if (balancerService != null) {
            write(ctx, balancerService, balancerService.build(balancerServiceType, balancerPort));
        }
        write(ctx, statefulSet, buildStatefulSet());
    }

    @Override
    public void removePods(ReconcileContext ctx) throws SyncException {
        StatefulSet scaledDown = ManagedResource.copyOf(rebuildStatefulSet());
        scaledDown.getSpec().setReplicas(0);
        log.info("Removing pods of {}", labeller.getComponentName());
        write(ctx, statefulSet, scaledDown);
    }

    @Override
    public void requestDrain(ReconcileContext ctx) throws SyncException {
        ctx.assertMutable();
        ctx.ensureActive();
        try {
            log.info("Requesting drain of {}", labeller.getComponentName());
            statefulSet.requestDrain(ctx.now());
        } catch (AccessorException e) {
            throw new SyncException(statefulSet.getRef(), e);
        }
    }

    @Override
    public boolean isDrainRequested() {
        return statefulSet.isDrainRequested();
    }

    @Override
    public boolean isDrained(ReconcileContext ctx) {
        return statefulSet.isDrained(ctx.now(), ctx.getDrainTimeout());
    }

    @Override
    public StatefulSet buildStatefulSet() {
        if (builtStatefulSet != null) {
            return builtStatefulSet;
        }
        return rebuildStatefulSet();
    }

    @Override
    public StatefulSet rebuildStatefulSet() {
        List<VolumeMount> volumeMounts = new ArrayList<>(instanceSpec.getVolumeMounts());
        volumeMounts.add(new VolumeMountBuilder()
                .withName(CONFIG_VOLUME_NAME)
                .withMountPath(CONFIG_MOUNT_PATH)
                .withReadOnly(true)
                .build());

        List<Volume> volumes = new ArrayList<>(instanceSpec.getVolumes());
        volumes.add(new VolumeBuilder()
                .withName(CONFIG_VOLUME_NAME)
                .withNewConfigMap()
                    .withName(labeller.getConfigMapName())
                .endConfigMap()
                .build());

        Container main = new ContainerBuilder()
                .withName(MAIN_CONTAINER_NAME)
                .withImage(image)
                .withCommand(binaryPath, "--config", CONFIG_MOUNT_PATH + "/" + configHelper.getFileName())
                .withVolumeMounts(volumeMounts)
                .withResources(instanceSpec.getResources())
                .addNewPort()
                    .withName("rpc")
                    .withContainerPort(rpcPort)
                .endPort()
                .build();

        Container prepare = new ContainerBuilder()
                .withName(PREPARE_CONTAINER_NAME)
                .withImage(image)
                .withCommand("bash", "-c", locationInitCommand(instanceSpec.getLocations()))
                .withVolumeMounts(volumeMounts)
                .build();

        StatefulSet built = statefulSet.newBase();
        built.getSpec().setReplicas(instanceSpec.getInstanceCount());
        built.getSpec().setServiceName(headlessService.getName());
        built.getSpec().setVolumeClaimTemplates(new ArrayList<>(instanceSpec.getVolumeClaimTemplates()));
        built.getSpec().getTemplate().setSpec(new PodSpecBuilder()
                .withImagePullSecrets(new ArrayList<>(clusterSpec.getImagePullSecrets()))
                .withSetHostnameAsFQDN(true)
                .withContainers(main)
                .withInitContainers(prepare)
                .withVolumes(volumes)
                .withAffinity(instanceSpec.getAffinity())
                .withNodeSelector(new HashMap<>(instanceSpec.getNodeSelector()))
                .withTolerations(new ArrayList<>(instanceSpec.getTolerations()))
                .build());

        builtStatefulSet = built;
        return built;
    }

    @Override
    public ConfigException getConfigError() {
        return configHelper.getConfigError();
    }

    public String getImage() {
        return image;
    }

    static String locationInitCommand(List<LocationSpec> locations) {
        List<String> steps = new ArrayList<>();
        for (LocationSpec location : locations) {
            String path = "'" + location.getPath() + "'";
            steps.add("mkdir -p " + path + " && test -w " + path);
        }
        return steps.isEmpty() ? "true" : String.join(" && ", steps);
    }

    private <T extends HasMetadata> void write(ReconcileContext ctx, ManagedResource<T> resource, T desired)
            throws SyncException {
        ctx.assertMutable();
        ctx.ensureActive();
        try {
            resource.write(desired);
        } catch (AccessorException e) {
            throw new SyncException(resource.getRef(), e);
        }
    }
}
