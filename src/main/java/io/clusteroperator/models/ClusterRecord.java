package io.clusteroperator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One cluster as stored in etcd. The revision is the key's modRevision at read time
 * and is used for compare-and-swap when the status is written back.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterRecord {

    @JsonProperty("cluster_id")
    private String clusterId;

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("spec")
    private ClusterSpec spec;

    @JsonProperty("status")
    private ClusterStatus status;

    @JsonIgnore
    private long revision;
}
