package io.clusteroperator.models;

import io.clusteroperator.enums.LocationType;
import io.fabric8.kubernetes.api.model.VolumeMountBuilder;

import java.util.List;

/**
 * Cluster specs shared by the component and reconciler tests.
 */
public final class TestSpecs {

    public static final String CORE_IMAGE = "registry.local/core:23.2";
    public static final String UI_IMAGE = "registry.local/ui:1.0";

    private TestSpecs() {
    }

    public static ClusterSpec discoveryOnly() {
        ClusterSpec spec = new ClusterSpec();
        spec.setCoreImage(CORE_IMAGE);
        spec.setDiscovery(instances(1));
        return spec;
    }

    public static ClusterSpec mastersAndSchedulers() {
        ClusterSpec spec = new ClusterSpec();
        spec.setCoreImage(CORE_IMAGE);
        MastersSpec masters = new MastersSpec();
        masters.setInstanceCount(3);
        spec.setPrimaryMasters(masters);
        spec.setSchedulers(instances(2));
        return spec;
    }

    public static ClusterSpec full() {
        ClusterSpec spec = mastersAndSchedulers();
        spec.setUiImage(UI_IMAGE);
        spec.setDiscovery(instances(1));
        spec.setControllerAgents(instances(1));

        HttpProxiesSpec http = new HttpProxiesSpec();
        http.setRole("public");
        spec.getHttpProxies().add(http);
        spec.getRpcProxies().add(new RpcProxiesSpec());

        DataNodesSpec data = new DataNodesSpec();
        data.setInstanceCount(3);
        data.getVolumeMounts().add(new VolumeMountBuilder().withName("data").withMountPath("/data").build());
        data.getLocations().add(new LocationSpec(LocationType.CHUNK_STORE, "/data/chunks"));
        spec.getDataNodes().add(data);

        spec.getExecNodes().add(new ExecNodesSpec());
        spec.setUi(new UISpec());
        return spec;
    }

    public static InstanceSpec instances(int count) {
        InstanceSpec spec = new InstanceSpec();
        spec.setInstanceCount(count);
        return spec;
    }

    public static List<String> fullComponentNames() {
        return List.of("Discovery", "Master", "Scheduler", "ControllerAgent", "HttpProxy-public", "RpcProxy",
                "DataNode", "ExecNode", "UI");
    }
}
