package io.clusteroperator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Error body of the status API. Every error names the cluster it was raised for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {

    public static final String CLUSTER_NOT_FOUND = "cluster_not_found";
    public static final String STATUS_NOT_AVAILABLE = "status_not_available";
    public static final String STORE_UNAVAILABLE = "store_unavailable";

    private String clusterId;
    private String error;
    private String reason;
    private Integer status;

    public static ErrorResponse clusterNotFound(String clusterId) {
        return ErrorResponse.builder()
            .clusterId(clusterId)
            .error(CLUSTER_NOT_FOUND)
            .reason("no record for cluster " + clusterId)
            .status(HttpStatus.NOT_FOUND.value())
            .build();
    }

    public static ErrorResponse notReconciled(String clusterId) {
        return ErrorResponse.builder()
            .clusterId(clusterId)
            .error(STATUS_NOT_AVAILABLE)
            .reason("cluster " + clusterId + " has not been reconciled yet")
            .status(HttpStatus.NOT_FOUND.value())
            .build();
    }

    public static ErrorResponse storeUnavailable(String clusterId, String message) {
        return ErrorResponse.builder()
            .clusterId(clusterId)
            .error(STORE_UNAVAILABLE)
            .reason(message)
            .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
            .build();
    }

    public ResponseEntity<Object> toResponseEntity() {
        return ResponseEntity.status(status).body(this);
    }
}
