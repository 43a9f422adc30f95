package io.clusteroperator.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.clusteroperator.enums.ClusterState;
import io.clusteroperator.enums.SyncStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Observed status of a cluster as written back to its record after each successful tick.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClusterStatus {

    @JsonProperty("state")
    @Builder.Default
    private ClusterState state = ClusterState.CREATING;

    @JsonProperty("sync_status")
    private SyncStatus syncStatus;

    @JsonProperty("message")
    private String message;

    @JsonProperty("update_status")
    @Builder.Default
    private UpdateStatus updateStatus = UpdateStatus.none();

    @JsonProperty("components")
    @Builder.Default
    private Map<String, ComponentStatus> components = new LinkedHashMap<>();

    @JsonProperty("creation_started_at")
    private Instant creationStartedAt;

    @JsonProperty("last_transition_time")
    private Instant lastTransitionTime;

    public static ClusterStatus initial() {
        return ClusterStatus.builder().build();
    }
}
