package io.clusteroperator.resources;

import io.clusteroperator.labeller.Labeller;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;

/**
 * Headless service giving every pod of the workload set a stable DNS name.
 */
public class HeadlessServiceResource extends ManagedResource<Service> {

    public HeadlessServiceResource(ResourceAccessor accessor, Labeller labeller) {
        super(accessor, labeller, Service.class, labeller.getHeadlessServiceName());
    }

    public Service build(int rpcPort) {
        return new ServiceBuilder()
                .withMetadata(buildMetadata())
                .withNewSpec()
                    .withClusterIP("None")
                    .withPublishNotReadyAddresses(true)
                    .withSelector(labeller.getSelectorLabels())
                    .addNewPort()
                        .withName("rpc")
                        .withPort(rpcPort)
                    .endPort()
                .endSpec()
                .build();
    }
}
