package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.HttpProxiesSpec;

import java.util.List;

/**
 * One HTTP proxy group, exposed through a balancer service on the HTTP port.
 */
public class HttpProxy extends ServerComponent {

    static final int HTTP_PORT = 80;

    public HttpProxy(ComponentFactory factory, HttpProxiesSpec spec, List<Component> dependencies) {
        this(factory, factory.labeller(ComponentType.HTTP_PROXY, spec.getRole()), spec, dependencies);
    }

    private HttpProxy(ComponentFactory factory, Labeller labeller, HttpProxiesSpec spec,
                      List<Component> dependencies) {
        super(labeller,
                factory.newServer(labeller, spec).withBalancer(factory.getAccessor(), spec.getServiceType(), HTTP_PORT),
                dependencies);
    }
}
