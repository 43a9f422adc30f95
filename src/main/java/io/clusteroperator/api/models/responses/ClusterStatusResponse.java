package io.clusteroperator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.clusteroperator.enums.ClusterState;
import io.clusteroperator.enums.SyncStatus;
import io.clusteroperator.models.ClusterRecord;
import io.clusteroperator.models.ClusterStatus;
import io.clusteroperator.models.UpdateStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Aggregate status of one cluster, without per-component detail.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClusterStatusResponse {
    private String clusterId;
    private String namespace;
    private ClusterState state;
    private SyncStatus syncStatus;
    private String message;
    private UpdateStatus updateStatus;
    private Instant lastTransitionTime;
    private long revision;

    public static ClusterStatusResponse from(ClusterRecord record) {
        ClusterStatus status = record.getStatus();
        return ClusterStatusResponse.builder()
            .clusterId(record.getClusterId())
            .namespace(record.getNamespace())
            .state(status.getState())
            .syncStatus(status.getSyncStatus())
            .message(status.getMessage())
            .updateStatus(status.getUpdateStatus())
            .lastTransitionTime(status.getLastTransitionTime())
            .revision(record.getRevision())
            .build();
    }
}
