package io.clusteroperator.enums;

/**
 * Roles of the managed cluster. The label value is written to every object the role owns;
 * the binary is launched with the role's config file mounted under /config.
 */
public enum ComponentType {
    DISCOVERY("Discovery", "discovery", 9020, false),
    PRIMARY_MASTER("Master", "master", 9010, true),
    SCHEDULER("Scheduler", "scheduler", 9011, true),
    CONTROLLER_AGENT("ControllerAgent", "controller-agent", 9014, false),
    HTTP_PROXY("HttpProxy", "http-proxy", 9016, false),
    RPC_PROXY("RpcProxy", "rpc-proxy", 9013, false),
    DATA_NODE("DataNode", "data-node", 9012, true),
    EXEC_NODE("ExecNode", "exec-node", 9029, true),
    UI("UI", "ui", 8080, false);

    private final String componentName;
    private final String label;
    private final int rpcPort;
    private final boolean drainable;

    ComponentType(String componentName, String label, int rpcPort, boolean drainable) {
        this.componentName = componentName;
        this.label = label;
        this.rpcPort = rpcPort;
        this.drainable = drainable;
    }

    public String getComponentName() {
        return componentName;
    }

    public String getLabel() {
        return label;
    }

    public int getRpcPort() {
        return rpcPort;
    }

    /**
     * Whether instances of this role can be gracefully drained before their pods are removed.
     */
    public boolean isDrainable() {
        return drainable;
    }

    public String getBinaryPath() {
        return "/usr/bin/server-" + label;
    }

    public String getConfigFileName() {
        return label + ".json";
    }
}
