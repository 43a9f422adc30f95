package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.InstanceSpec;

import java.util.List;

public class ControllerAgent extends ServerComponent {

    public ControllerAgent(ComponentFactory factory, InstanceSpec spec, List<Component> dependencies) {
        this(factory, factory.labeller(ComponentType.CONTROLLER_AGENT, null), spec, dependencies);
    }

    private ControllerAgent(ComponentFactory factory, Labeller labeller, InstanceSpec spec,
                            List<Component> dependencies) {
        super(labeller, factory.newServer(labeller, spec), dependencies);
    }
}
