package io.clusteroperator.api.handlers;

import io.clusteroperator.api.models.responses.ClusterStatusResponse;
import io.clusteroperator.api.models.responses.ErrorResponse;
import io.clusteroperator.enums.ClusterState;
import io.clusteroperator.enums.SyncStatus;
import io.clusteroperator.models.ClusterRecord;
import io.clusteroperator.models.ClusterStatus;
import io.clusteroperator.models.ComponentStatus;
import io.clusteroperator.models.TestSpecs;
import io.clusteroperator.store.ClusterStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class ClusterStatusHandlerTest {

    @Mock
    private ClusterStore clusterStore;

    @InjectMocks
    private ClusterStatusHandler handler;

    private final String testClusterId = "test-cluster";

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private ClusterRecord reconciledRecord() {
        ClusterStatus status = ClusterStatus.initial();
        status.setState(ClusterState.RUNNING);
        status.setSyncStatus(SyncStatus.READY);
        status.setMessage("All components are ready");
        status.getComponents().put("Discovery", ComponentStatus.ready());
        return new ClusterRecord(testClusterId, "clusters", TestSpecs.discoveryOnly(), status, 17L);
    }

    @Test
    void testGetStatus_Success() throws Exception {
        // Given
        when(clusterStore.getCluster(testClusterId)).thenReturn(Optional.of(reconciledRecord()));

        // When
        ResponseEntity<Object> response = handler.getStatus(testClusterId);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        ClusterStatusResponse body = (ClusterStatusResponse) response.getBody();
        assertThat(body.getClusterId()).isEqualTo(testClusterId);
        assertThat(body.getState()).isEqualTo(ClusterState.RUNNING);
        assertThat(body.getSyncStatus()).isEqualTo(SyncStatus.READY);
        assertThat(body.getMessage()).isEqualTo("All components are ready");
        assertThat(body.getRevision()).isEqualTo(17L);
    }

    @Test
    void testGetStatus_ClusterNotFound() throws Exception {
        // Given
        when(clusterStore.getCluster(testClusterId)).thenReturn(Optional.empty());

        // When
        ResponseEntity<Object> response = handler.getStatus(testClusterId);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getError()).isEqualTo(ErrorResponse.CLUSTER_NOT_FOUND);
        assertThat(error.getClusterId()).isEqualTo(testClusterId);
        assertThat(error.getReason()).isEqualTo("no record for cluster test-cluster");
    }

    @Test
    void testGetStatus_NotReconciledYet() throws Exception {
        // Given
        ClusterRecord record = new ClusterRecord(testClusterId, "clusters", TestSpecs.discoveryOnly(), null, 3L);
        when(clusterStore.getCluster(testClusterId)).thenReturn(Optional.of(record));

        // When
        ResponseEntity<Object> response = handler.getStatus(testClusterId);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(((ErrorResponse) response.getBody()).getError()).isEqualTo("status_not_available");
    }

    @Test
    void testGetStatus_StoreFailure() throws Exception {
        // Given
        when(clusterStore.getCluster(testClusterId)).thenThrow(new RuntimeException("etcd unavailable"));

        // When
        ResponseEntity<Object> response = handler.getStatus(testClusterId);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getError()).isEqualTo(ErrorResponse.STORE_UNAVAILABLE);
        assertThat(error.getClusterId()).isEqualTo(testClusterId);
        assertThat(error.getReason()).isEqualTo("etcd unavailable");
    }

    @Test
    @SuppressWarnings("unchecked")
    void testGetComponentStatuses_Success() throws Exception {
        // Given
        when(clusterStore.getCluster(testClusterId)).thenReturn(Optional.of(reconciledRecord()));

        // When
        ResponseEntity<Object> response = handler.getComponentStatuses(testClusterId);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, ComponentStatus> body = (Map<String, ComponentStatus>) response.getBody();
        assertThat(body).containsOnlyKeys("Discovery");
        assertThat(body.get("Discovery").getSyncStatus()).isEqualTo(SyncStatus.READY);
    }

    @Test
    void testGetComponentStatuses_ClusterNotFound() throws Exception {
        // Given
        when(clusterStore.getCluster(testClusterId)).thenReturn(Optional.empty());

        // When
        ResponseEntity<Object> response = handler.getComponentStatuses(testClusterId);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }
}
