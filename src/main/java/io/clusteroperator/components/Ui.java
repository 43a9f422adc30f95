package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.UISpec;

import java.util.List;

/**
 * Web UI. Waits for the masters and for every HTTP proxy group it may talk to.
 */
public class Ui extends ServerComponent {

    public Ui(ComponentFactory factory, UISpec spec, List<Component> dependencies) {
        this(factory, factory.labeller(ComponentType.UI, null), spec, dependencies);
    }

    private Ui(ComponentFactory factory, Labeller labeller, UISpec spec, List<Component> dependencies) {
        super(labeller,
                factory.newServer(labeller, spec).withBalancer(factory.getAccessor(), spec.getServiceType(),
                        ComponentType.UI.getRpcPort()),
                dependencies);
    }
}
