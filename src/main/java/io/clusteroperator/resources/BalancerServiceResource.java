package io.clusteroperator.resources;

import io.clusteroperator.labeller.Labeller;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;

/**
 * Load-balanced entry point for client-facing roles (proxies, UI).
 */
public class BalancerServiceResource extends ManagedResource<Service> {

    public BalancerServiceResource(ResourceAccessor accessor, Labeller labeller) {
        super(accessor, labeller, Service.class, labeller.getBalancerServiceName());
    }

    public Service build(String serviceType, int port) {
        return new ServiceBuilder()
                .withMetadata(buildMetadata())
                .withNewSpec()
                    .withType(serviceType == null ? "ClusterIP" : serviceType)
                    .withSelector(labeller.getSelectorLabels())
                    .addNewPort()
                        .withName("balancer")
                        .withPort(port)
                        .withTargetPort(new IntOrString(port))
                    .endPort()
                .endSpec()
                .build();
    }
}
