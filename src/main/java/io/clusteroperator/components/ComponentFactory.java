package io.clusteroperator.components;

import io.clusteroperator.configgen.ComponentRole;
import io.clusteroperator.configgen.ConfigProvider;
import io.clusteroperator.configgen.JsonConfigProvider;
import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.ClusterSpec;
import io.clusteroperator.models.DataNodesSpec;
import io.clusteroperator.models.ExecNodesSpec;
import io.clusteroperator.models.HttpProxiesSpec;
import io.clusteroperator.models.InstanceSpec;
import io.clusteroperator.models.RpcProxiesSpec;
import io.clusteroperator.resources.ResourceAccessor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the components of one cluster from its spec. Sections absent from the spec produce
 * no component.
 */
@Slf4j
@Getter
public class ComponentFactory {

    private final ResourceAccessor accessor;
    private final String clusterId;
    private final String namespace;
    private final ClusterSpec clusterSpec;
    private final ConfigProvider configProvider;

    public ComponentFactory(ResourceAccessor accessor, String clusterId, String namespace, ClusterSpec clusterSpec) {
        this(accessor, clusterId, namespace, clusterSpec, new JsonConfigProvider(clusterId, namespace));
    }

    public ComponentFactory(ResourceAccessor accessor, String clusterId, String namespace, ClusterSpec clusterSpec,
                            ConfigProvider configProvider) {
        this.accessor = accessor;
        this.clusterId = clusterId;
        this.namespace = namespace;
        this.clusterSpec = clusterSpec;
        this.configProvider = configProvider;
    }

    public Labeller labeller(ComponentType type, String group) {
        return new Labeller(clusterId, namespace, type, group);
    }

    /**
     * Server for one role group. UI runs the UI image by default, everything else the core image.
     */
    public StatefulServer newServer(Labeller labeller, InstanceSpec instanceSpec) {
        String defaultImage = labeller.getType() == ComponentType.UI && clusterSpec.getUiImage() != null
                ? clusterSpec.getUiImage() : clusterSpec.getCoreImage();
        ComponentRole role = new ComponentRole(labeller.getType(), labeller.getGroup(), instanceSpec);
        return new StatefulServer(accessor, labeller, configProvider, role, clusterSpec, defaultImage);
    }

    public ComponentGraph createAll() {
        List<Component> components = new ArrayList<>();

        if (clusterSpec.getDiscovery() != null) {
            components.add(new Discovery(this, clusterSpec.getDiscovery()));
        }

        List<Component> onMaster = new ArrayList<>();
        if (clusterSpec.getPrimaryMasters() != null) {
            Component master = new PrimaryMaster(this, clusterSpec.getPrimaryMasters());
            components.add(master);
            onMaster.add(master);
        }

        if (clusterSpec.getSchedulers() != null) {
            components.add(new Scheduler(this, clusterSpec.getSchedulers(), onMaster));
        }
        if (clusterSpec.getControllerAgents() != null) {
            components.add(new ControllerAgent(this, clusterSpec.getControllerAgents(), onMaster));
        }

        List<Component> uiDependencies = new ArrayList<>(onMaster);
        for (HttpProxiesSpec proxies : clusterSpec.getHttpProxies()) {
            Component proxy = new HttpProxy(this, proxies, onMaster);
            components.add(proxy);
            uiDependencies.add(proxy);
        }
        for (RpcProxiesSpec proxies : clusterSpec.getRpcProxies()) {
            components.add(new RpcProxy(this, proxies, onMaster));
        }
        for (DataNodesSpec nodes : clusterSpec.getDataNodes()) {
            components.add(new DataNode(this, nodes, onMaster));
        }
        for (ExecNodesSpec nodes : clusterSpec.getExecNodes()) {
            components.add(new ExecNode(this, nodes, onMaster));
        }

        if (clusterSpec.getUi() != null) {
            components.add(new Ui(this, clusterSpec.getUi(), uiDependencies));
        }

        log.debug("Built {} components for cluster {}", components.size(), clusterId);
        return new ComponentGraph(components);
    }
}
