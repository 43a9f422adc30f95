package io.clusteroperator.election;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.Election;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.election.CampaignResponse;
import io.etcd.jetcd.lease.LeaseGrantResponse;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.etcd.jetcd.support.CloseableClient;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for operator leader election
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LeaderElectionTest {

    private static final String ELECTION_KEY = "/cluster-operator/leader-election";
    private static final String NODE_ID = "operator-1";

    @Mock
    private Client etcdClient;

    @Mock
    private Election electionClient;

    @Mock
    private Lease leaseClient;

    @Mock
    private LeaseGrantResponse leaseGrantResponse;

    @Mock
    private CampaignResponse campaignResponse;

    @Mock
    private LeaderElection.Listener listener;

    private LeaderElection leaderElection;

    @BeforeEach
    void setUp() {
        leaderElection = new LeaderElection(etcdClient, ELECTION_KEY, NODE_ID, 15L);
        when(etcdClient.getElectionClient()).thenReturn(electionClient);
        when(etcdClient.getLeaseClient()).thenReturn(leaseClient);
        when(leaseGrantResponse.getID()).thenReturn(12345L);
        when(leaseClient.grant(anyLong())).thenReturn(CompletableFuture.completedFuture(leaseGrantResponse));
    }

    @Test
    void testInitialLeaderState() {
        assertFalse(leaderElection.isLeader());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSuccessfulLeaderElection() throws Exception {
        when(leaseClient.keepAlive(anyLong(), any(StreamObserver.class))).thenReturn(mock(CloseableClient.class));
        when(electionClient.campaign(any(ByteSequence.class), anyLong(), any(ByteSequence.class)))
                .thenReturn(CompletableFuture.completedFuture(campaignResponse));

        Boolean isLeader = leaderElection.startElection(listener).get(5, TimeUnit.SECONDS);

        assertTrue(isLeader);
        assertTrue(leaderElection.isLeader());
        verify(listener).onElected();
        verify(leaseClient).grant(15L);
        verify(electionClient).campaign(eq(ByteSequence.from(ELECTION_KEY, UTF_8)), eq(12345L),
                eq(ByteSequence.from(NODE_ID, UTF_8)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testFailedLeaderElection() {
        when(leaseClient.keepAlive(anyLong(), any(StreamObserver.class))).thenReturn(mock(CloseableClient.class));
        CompletableFuture<CampaignResponse> campaignFuture = new CompletableFuture<>();
        campaignFuture.completeExceptionally(new RuntimeException("Election failed"));
        when(electionClient.campaign(any(ByteSequence.class), anyLong(), any(ByteSequence.class)))
                .thenReturn(campaignFuture);

        CompletableFuture<Boolean> electionResult = leaderElection.startElection(listener);

        assertThrows(Exception.class, () -> electionResult.get(5, TimeUnit.SECONDS));
        assertFalse(leaderElection.isLeader());
        verify(listener, never()).onElected();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testLeaseLossStepsDown() throws Exception {
        when(electionClient.campaign(any(ByteSequence.class), anyLong(), any(ByteSequence.class)))
                .thenReturn(CompletableFuture.completedFuture(campaignResponse));
        doAnswer(invocation -> {
            StreamObserver<LeaseKeepAliveResponse> observer = invocation.getArgument(1);
            CompletableFuture.runAsync(() -> {
                try {
                    Thread.sleep(50);
                    observer.onCompleted();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            return null;
        }).when(leaseClient).keepAlive(anyLong(), any(StreamObserver.class));

        assertTrue(leaderElection.startElection(listener).get(5, TimeUnit.SECONDS));

        verify(listener, timeout(2000)).onStepDown();
        assertFalse(leaderElection.isLeader());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testKeepAliveErrorBeforeElectionFails() {
        CompletableFuture<CampaignResponse> never = new CompletableFuture<>();
        when(electionClient.campaign(any(ByteSequence.class), anyLong(), any(ByteSequence.class))).thenReturn(never);
        doAnswer(invocation -> {
            StreamObserver<LeaseKeepAliveResponse> observer = invocation.getArgument(1);
            observer.onError(new RuntimeException("Keep alive error"));
            return null;
        }).when(leaseClient).keepAlive(anyLong(), any(StreamObserver.class));

        CompletableFuture<Boolean> electionResult = leaderElection.startElection(listener);

        assertThrows(Exception.class, () -> electionResult.get(5, TimeUnit.SECONDS));
        assertFalse(leaderElection.isLeader());
        verify(listener, never()).onStepDown();
    }
}
