package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.DataNodesSpec;

import java.util.List;

public class DataNode extends ServerComponent {

    public DataNode(ComponentFactory factory, DataNodesSpec spec, List<Component> dependencies) {
        this(factory, factory.labeller(ComponentType.DATA_NODE, spec.getName()), spec, dependencies);
    }

    private DataNode(ComponentFactory factory, Labeller labeller, DataNodesSpec spec, List<Component> dependencies) {
        super(labeller, factory.newServer(labeller, spec), dependencies);
    }
}
