package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.RpcProxiesSpec;

import java.util.List;

/**
 * One RPC proxy group. Gets a balancer service only when a service type is requested.
 */
public class RpcProxy extends ServerComponent {

    public RpcProxy(ComponentFactory factory, RpcProxiesSpec spec, List<Component> dependencies) {
        this(factory, factory.labeller(ComponentType.RPC_PROXY, spec.getRole()), spec, dependencies);
    }

    private RpcProxy(ComponentFactory factory, Labeller labeller, RpcProxiesSpec spec, List<Component> dependencies) {
        super(labeller, server(factory, labeller, spec), dependencies);
    }

    private static StatefulServer server(ComponentFactory factory, Labeller labeller, RpcProxiesSpec spec) {
        StatefulServer server = factory.newServer(labeller, spec);
        if (spec.getServiceType() != null) {
            server.withBalancer(factory.getAccessor(), spec.getServiceType(), ComponentType.RPC_PROXY.getRpcPort());
        }
        return server;
    }
}
