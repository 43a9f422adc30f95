package io.clusteroperator.configgen;

import io.clusteroperator.enums.ComponentType;
import io.clusteroperator.models.InstanceSpec;
import lombok.Value;

/**
 * What a config is generated for: the role type, its group and the instance spec of that group.
 */
@Value
public class ComponentRole {

    ComponentType type;
    String group;
    InstanceSpec instanceSpec;
}
