package io.clusteroperator.components;

import io.clusteroperator.models.ComponentStatus;
import lombok.Value;

@Value
public class ComponentDecision {

    ComponentStatus status;
    ComponentAction action;

    public static ComponentDecision of(ComponentStatus status) {
        return new ComponentDecision(status, ComponentAction.NONE);
    }

    public static ComponentDecision of(ComponentStatus status, ComponentAction action) {
        return new ComponentDecision(status, action);
    }
}
