package io.clusteroperator.api.handlers;

import io.clusteroperator.api.models.responses.ClusterStatusResponse;
import io.clusteroperator.api.models.responses.ErrorResponse;
import io.clusteroperator.models.ClusterRecord;
import io.clusteroperator.store.ClusterStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Read-only REST surface over the status the operator writes back to each cluster record.
 *
 * Operations:
 * - GET /{clusterId}/_status - aggregate cluster status and update wave
 * - GET /{clusterId}/_status/components - per-component sync statuses
 */
@Slf4j
@RestController
@RequestMapping("/{clusterId}")
public class ClusterStatusHandler {

    private final ClusterStore clusterStore;

    public ClusterStatusHandler(ClusterStore clusterStore) {
        this.clusterStore = clusterStore;
    }

    @GetMapping("/_status")
    public ResponseEntity<Object> getStatus(@PathVariable String clusterId) {
        try {
            log.debug("Getting status of cluster '{}'", clusterId);
            Optional<ClusterRecord> record = clusterStore.getCluster(clusterId);
            if (record.isEmpty()) {
                return ErrorResponse.clusterNotFound(clusterId).toResponseEntity();
            }
            if (record.get().getStatus() == null) {
                return ErrorResponse.notReconciled(clusterId).toResponseEntity();
            }
            return ResponseEntity.ok(ClusterStatusResponse.from(record.get()));
        } catch (Exception e) {
            log.error("Error getting status of cluster '{}': {}", clusterId, e.getMessage());
            return ErrorResponse.storeUnavailable(clusterId, e.getMessage()).toResponseEntity();
        }
    }

    @GetMapping("/_status/components")
    public ResponseEntity<Object> getComponentStatuses(@PathVariable String clusterId) {
        try {
            log.debug("Getting component statuses of cluster '{}'", clusterId);
            Optional<ClusterRecord> record = clusterStore.getCluster(clusterId);
            if (record.isEmpty()) {
                return ErrorResponse.clusterNotFound(clusterId).toResponseEntity();
            }
            if (record.get().getStatus() == null) {
                return ErrorResponse.notReconciled(clusterId).toResponseEntity();
            }
            return ResponseEntity.ok(record.get().getStatus().getComponents());
        } catch (Exception e) {
            log.error("Error getting component statuses of cluster '{}': {}", clusterId, e.getMessage());
            return ErrorResponse.storeUnavailable(clusterId, e.getMessage()).toResponseEntity();
        }
    }
}
