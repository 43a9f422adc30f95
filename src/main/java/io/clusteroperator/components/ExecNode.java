package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.ExecNodesSpec;

import java.util.List;

public class ExecNode extends ServerComponent {

    public ExecNode(ComponentFactory factory, ExecNodesSpec spec, List<Component> dependencies) {
        this(factory, factory.labeller(ComponentType.EXEC_NODE, spec.getName()), spec, dependencies);
    }

    private ExecNode(ComponentFactory factory, Labeller labeller, ExecNodesSpec spec, List<Component> dependencies) {
        super(labeller, factory.newServer(labeller, spec), dependencies);
    }
}
