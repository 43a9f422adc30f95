package io.clusteroperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * One group of HTTP proxies. Groups are told apart by role; the balancer service type
 * decides how the group is exposed outside the cluster.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class HttpProxiesSpec extends InstanceSpec {

    private String role = "default";

    private String serviceType = "ClusterIP";
}
