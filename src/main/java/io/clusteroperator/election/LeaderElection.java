package io.clusteroperator.election;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.Election;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Operator-level leader election: only the winning replica runs reconcile loops.
 * Leadership is tied to a lease; losing the lease keep-alive steps the node down and
 * notifies the listener.
 */
@Slf4j
public class LeaderElection {

    /**
     * Notified on leadership changes. Callbacks run on etcd client threads.
     */
    public interface Listener {
        void onElected();

        void onStepDown();
    }

    private final Client etcdClient;
    private final String electionKey;
    private final String nodeId;
    private final long ttlSeconds;
    private final AtomicBoolean isLeader = new AtomicBoolean(false);
    private final AtomicBoolean isShuttingDown = new AtomicBoolean(false);

    public LeaderElection(Client etcdClient, String electionKey, String nodeId, long ttlSeconds) {
        this.etcdClient = etcdClient;
        this.electionKey = electionKey;
        this.nodeId = nodeId;
        this.ttlSeconds = ttlSeconds;
    }

    /**
     * Campaign in the background. The returned future completes when this node wins.
     */
    public CompletableFuture<Boolean> startElection(Listener listener) {
        log.info("LeaderElection - Starting leader election for node {} on {}", nodeId, electionKey);
        Election election = etcdClient.getElectionClient();
        CompletableFuture<Boolean> result = new CompletableFuture<>();

        CompletableFuture.runAsync(() -> {
            try {
                long leaseId = etcdClient.getLeaseClient().grant(ttlSeconds).get().getID();
                etcdClient.getLeaseClient().keepAlive(leaseId, new StreamObserver<LeaseKeepAliveResponse>() {
                    @Override
                    public void onNext(LeaseKeepAliveResponse res) {
                        // lease refreshed
                    }

                    @Override
                    public void onError(Throwable t) {
                        if (!isShuttingDown.get()) {
                            log.error("LeaderElection - Lease keep-alive error for node {}: {}", nodeId, t.getMessage());
                            result.completeExceptionally(t);
                        }
                        stepDown(listener);
                    }

                    @Override
                    public void onCompleted() {
                        log.warn("LeaderElection - Lease keep-alive completed for node {}, stepping down", nodeId);
                        stepDown(listener);
                    }
                });

                election.campaign(ByteSequence.from(electionKey, UTF_8), leaseId, ByteSequence.from(nodeId, UTF_8))
                        .thenAccept(leaderKey -> {
                            log.info("LeaderElection - Node {} is now the leader", nodeId);
                            isLeader.set(true);
                            listener.onElected();
                            result.complete(true);
                        })
                        .exceptionally(ex -> {
                            if (!isShuttingDown.get()) {
                                log.error("LeaderElection - Node {} failed during campaign: {}", nodeId, ex.getMessage(), ex);
                                result.completeExceptionally(ex);
                            }
                            isLeader.set(false);
                            return null;
                        });
            } catch (Exception e) {
                log.error("LeaderElection - Election error for node {}: {}", nodeId, e.getMessage(), e);
                isLeader.set(false);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    public boolean isLeader() {
        return isLeader.get();
    }

    /**
     * Suppresses error logging from the lease observer; call before closing the etcd client.
     */
    public void shutdown() {
        log.info("LeaderElection - Shutting down leader election for node {}", nodeId);
        isShuttingDown.set(true);
        isLeader.set(false);
    }

    private void stepDown(Listener listener) {
        if (isLeader.compareAndSet(true, false)) {
            listener.onStepDown();
        }
    }
}
