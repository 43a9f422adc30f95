package io.clusteroperator.components;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.labeller.Labeller;
import io.clusteroperator.models.MastersSpec;

import java.util.List;

/**
 * Primary masters. Every other role except discovery waits for them.
 */
public class PrimaryMaster extends ServerComponent {

    public PrimaryMaster(ComponentFactory factory, MastersSpec spec) {
        this(factory, factory.labeller(ComponentType.PRIMARY_MASTER, null), spec);
    }

    private PrimaryMaster(ComponentFactory factory, Labeller labeller, MastersSpec spec) {
        super(labeller, factory.newServer(labeller, spec), List.of());
    }
}
