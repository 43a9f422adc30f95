package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.InstanceSpec;

import java.util.List;

/**
 * Discovery service. Depends on nothing.
 */
public class Discovery extends ServerComponent {

    public Discovery(ComponentFactory factory, InstanceSpec spec) {
        this(factory, factory.labeller(ComponentType.DISCOVERY, null), spec);
    }

    private Discovery(ComponentFactory factory, Labeller labeller, InstanceSpec spec) {
        super(labeller, factory.newServer(labeller, spec), List.of());
    }
}
