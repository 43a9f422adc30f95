package io.clusteroperator.store;

import io.clusteroperator.models.ClusterRecord;
import io.clusteroperator.models.ClusterStatus;
import io.clusteroperator.resources.ConflictException;

import java.util.List;
import java.util.Optional;

/**
 * Storage of cluster records (spec + status), one externally versioned record per cluster.
 */
public interface ClusterStore extends AutoCloseable {

    /**
     * Get all cluster records under the operator's root prefix
     */
    List<ClusterRecord> listClusters() throws Exception;

    /**
     * Get one cluster record; the returned record carries the revision it was read at
     */
    Optional<ClusterRecord> getCluster(String clusterId) throws Exception;

    /**
     * Replace the status of a record, provided the record was not modified since it was read.
     *
     * @throws ConflictException if the stored revision no longer matches {@code record.getRevision()}
     */
    void updateStatus(ClusterRecord record, ClusterStatus status) throws Exception;

    /**
     * Create or replace a record unconditionally
     */
    void putCluster(ClusterRecord record) throws Exception;

    /**
     * Invoke the callback whenever the cluster's record changes. Closing the handle stops the watch.
     */
    AutoCloseable watchCluster(String clusterId, Runnable onChange);
}
