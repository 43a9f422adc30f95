package io.clusteroperator.resources;

import io.clusteroperator.labeller.Labeller;
import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceBuilder;

public class MonitoringServiceResource extends ManagedResource<Service> {

    public MonitoringServiceResource(ResourceAccessor accessor, Labeller labeller) {
        super(accessor, labeller, Service.class, labeller.getMonitoringServiceName());
    }

    public Service build(int monitoringPort) {
        return new ServiceBuilder()
                .withMetadata(buildMetadata())
                .withNewSpec()
                    .withSelector(labeller.getSelectorLabels())
                    .addNewPort()
                        .withName("metrics")
                        .withPort(monitoringPort)
                        .withTargetPort(new IntOrString(monitoringPort))
                    .endPort()
                .endSpec()
                .build();
    }
}
