package io.clusteroperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.fabric8.kubernetes.api.model.LocalObjectReference;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of a cluster. Owned by whoever edits the cluster record;
 * the operator only reads it.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterSpec {

    private String coreImage;

    private String uiImage;

    private List<LocalObjectReference> imagePullSecrets = new ArrayList<>();

    private LocalObjectReference configOverrides;

    private LocalObjectReference adminCredentials;

    private boolean enableFullUpdate = true;

    private boolean useIpv6;

    private InstanceSpec discovery;

    private MastersSpec primaryMasters;

    private InstanceSpec schedulers;

    private InstanceSpec controllerAgents;

    private List<HttpProxiesSpec> httpProxies = new ArrayList<>();

    private List<RpcProxiesSpec> rpcProxies = new ArrayList<>();

    private List<DataNodesSpec> dataNodes = new ArrayList<>();

    private List<ExecNodesSpec> execNodes = new ArrayList<>();

    private UISpec ui;
}
