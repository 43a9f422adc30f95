package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.InstanceSpec;

import java.util.List;

public class Scheduler extends ServerComponent {

    public Scheduler(ComponentFactory factory, InstanceSpec spec, List<Component> dependencies) {
        this(factory, factory.labeller(ComponentType.SCHEDULER, null), spec, dependencies);
    }

    private Scheduler(ComponentFactory factory, Labeller labeller, InstanceSpec spec, List<Component> dependencies) {
        super(labeller, factory.newServer(labeller, spec), dependencies);
    }
}
