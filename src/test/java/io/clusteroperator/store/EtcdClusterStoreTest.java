package io.clusteroperator.store;

import io.clusteroperator.enums.ClusterState;
import io.clusteroperator.models.ClusterRecord;
import io.clusteroperator.models.ClusterStatus;
import io.clusteroperator.models.TestSpecs;
import io.clusteroperator.resources.ConflictException;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Txn;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.PutResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.watch.WatchEvent;
import io.etcd.jetcd.watch.WatchResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for EtcdClusterStore.
 */
class EtcdClusterStoreTest {

    private Client etcdClient;
    private KV kvClient;
    private Watch watchClient;
    private EtcdClusterStore store;

    @BeforeEach
    void setUp() {
        etcdClient = mock(Client.class);
        kvClient = mock(KV.class);
        watchClient = mock(Watch.class);
        store = new EtcdClusterStore(etcdClient, kvClient, watchClient, new EtcdPathResolver("operator"));
    }

    // ------------------------- helpers -------------------------

    private GetResponse mockGetResponse(List<KeyValue> kvs) {
        GetResponse resp = mock(GetResponse.class);
        when(resp.getKvs()).thenReturn(kvs);
        when(resp.getCount()).thenReturn((long) kvs.size());
        return resp;
    }

    private KeyValue mockKv(String key, String value, long modRevision) {
        KeyValue kv = mock(KeyValue.class);
        when(kv.getKey()).thenReturn(ByteSequence.from(key, UTF_8));
        when(kv.getValue()).thenReturn(ByteSequence.from(value, UTF_8));
        when(kv.getModRevision()).thenReturn(modRevision);
        return kv;
    }

    private String recordJson(String clusterId) throws Exception {
        ClusterRecord record = new ClusterRecord(clusterId, "clusters", TestSpecs.discoveryOnly(), null, 0);
        return EtcdClusterStore.createObjectMapper().writeValueAsString(record);
    }

    private Txn mockTxn(boolean succeeded) {
        Txn txn = mock(Txn.class);
        TxnResponse response = mock(TxnResponse.class);
        when(response.isSucceeded()).thenReturn(succeeded);
        when(txn.If(any())).thenReturn(txn);
        when(txn.Then(any())).thenReturn(txn);
        when(txn.Else(any())).thenReturn(txn);
        when(txn.commit()).thenReturn(CompletableFuture.completedFuture(response));
        when(kvClient.txn()).thenReturn(txn);
        return txn;
    }

    // ------------------------- read tests -------------------------

    @Test
    void testGetClusterCarriesRevision() throws Exception {
        KeyValue kv = mockKv("/operator/clusters/c1", recordJson("c1"), 42L);
        GetResponse response = mockGetResponse(List.of(kv));
        when(kvClient.get(ByteSequence.from("/operator/clusters/c1", UTF_8)))
                .thenReturn(CompletableFuture.completedFuture(response));

        Optional<ClusterRecord> record = store.getCluster("c1");

        assertThat(record).isPresent();
        assertThat(record.get().getClusterId()).isEqualTo("c1");
        assertThat(record.get().getNamespace()).isEqualTo("clusters");
        assertThat(record.get().getRevision()).isEqualTo(42L);
        assertThat(record.get().getSpec().getDiscovery().getInstanceCount()).isEqualTo(1);
        assertThat(record.get().getSpec().isEnableFullUpdate()).isTrue();
    }

    @Test
    void testGetClusterMissing() throws Exception {
        GetResponse response = mockGetResponse(List.of());
        when(kvClient.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(response));

        assertThat(store.getCluster("nope")).isEmpty();
    }

    @Test
    void testListClustersSkipsForeignAndBrokenKeys() throws Exception {
        List<KeyValue> kvs = List.of(
                mockKv("/operator/clusters/a", recordJson("a"), 5L),
                mockKv("/operator/clusters/a/extra", "{}", 6L),
                mockKv("/operator/clusters/broken", "not json", 7L),
                mockKv("/operator/clusters/b", recordJson("b"), 8L));
        GetResponse response = mockGetResponse(kvs);
        when(kvClient.get(any(ByteSequence.class), any(GetOption.class)))
                .thenReturn(CompletableFuture.completedFuture(response));

        List<ClusterRecord> records = store.listClusters();

        assertThat(records).extracting(ClusterRecord::getClusterId).containsExactly("a", "b");
        assertThat(records).extracting(ClusterRecord::getRevision).containsExactly(5L, 8L);
    }

    // ------------------------- write tests -------------------------

    @Test
    void testUpdateStatusSucceedsAtReadRevision() throws Exception {
        Txn txn = mockTxn(true);
        ClusterRecord record = new ClusterRecord("c1", "clusters", TestSpecs.discoveryOnly(), null, 42L);
        ClusterStatus status = ClusterStatus.builder()
                .state(ClusterState.RUNNING)
                .creationStartedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .build();

        assertThatCode(() -> store.updateStatus(record, status)).doesNotThrowAnyException();

        verify(kvClient).txn();
        verify(txn).If(any());
        verify(txn).Then(any());
        verify(txn).Else(any());
        verify(txn).commit();
    }

    @Test
    void testUpdateStatusConflict() {
        mockTxn(false);
        ClusterRecord record = new ClusterRecord("c1", "clusters", TestSpecs.discoveryOnly(), null, 42L);

        assertThatThrownBy(() -> store.updateStatus(record, ClusterStatus.initial()))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("c1")
                .hasMessageContaining("42");
    }

    @Test
    void testStatusRoundTripsThroughJson() throws Exception {
        ClusterStatus status = ClusterStatus.builder()
                .state(ClusterState.RECONFIGURATION)
                .creationStartedAt(Instant.parse("2026-01-01T00:00:00Z"))
                .lastTransitionTime(Instant.parse("2026-01-02T10:15:30Z"))
                .build();
        ClusterRecord record = new ClusterRecord("c1", "clusters", TestSpecs.discoveryOnly(), status, 3L);

        String json = EtcdClusterStore.createObjectMapper().writeValueAsString(record);
        ClusterRecord read = EtcdClusterStore.createObjectMapper().readValue(json, ClusterRecord.class);

        assertThat(json).contains("\"last_transition_time\":\"2026-01-02T10:15:30Z\"");
        assertThat(json).doesNotContain("revision");
        assertThat(read.getStatus()).isEqualTo(status);
    }

    @Test
    void testPutClusterWritesRecord() throws Exception {
        when(kvClient.put(any(ByteSequence.class), any(ByteSequence.class)))
                .thenReturn(CompletableFuture.completedFuture(mock(PutResponse.class)));
        ClusterRecord record = new ClusterRecord("c1", "clusters", TestSpecs.discoveryOnly(), null, 0);

        store.putCluster(record);

        ArgumentCaptor<ByteSequence> value = ArgumentCaptor.forClass(ByteSequence.class);
        verify(kvClient).put(eq(ByteSequence.from("/operator/clusters/c1", UTF_8)), value.capture());
        ClusterRecord written = EtcdClusterStore.createObjectMapper()
                .readValue(value.getValue().toString(UTF_8), ClusterRecord.class);
        assertThat(written.getClusterId()).isEqualTo("c1");
        assertThat(written.getSpec().getCoreImage()).isEqualTo(TestSpecs.CORE_IMAGE);
    }

    // ------------------------- watch tests -------------------------

    @Test
    @SuppressWarnings("unchecked")
    void testWatchInvokesCallbackOncePerResponse() throws Exception {
        Watch.Watcher watcher = mock(Watch.Watcher.class);
        ArgumentCaptor<Consumer<WatchResponse>> listener = ArgumentCaptor.forClass(Consumer.class);
        when(watchClient.watch(any(ByteSequence.class), listener.capture())).thenReturn(watcher);
        AtomicInteger calls = new AtomicInteger();

        AutoCloseable handle = store.watchCluster("c1", calls::incrementAndGet);

        KeyValue changed = mockKv("/operator/clusters/c1", "{}", 9L);
        WatchEvent put = mock(WatchEvent.class);
        when(put.getEventType()).thenReturn(WatchEvent.EventType.PUT);
        when(put.getKeyValue()).thenReturn(changed);
        WatchEvent delete = mock(WatchEvent.class);
        when(delete.getEventType()).thenReturn(WatchEvent.EventType.DELETE);
        WatchResponse response = mock(WatchResponse.class);
        when(response.getEvents()).thenReturn(List.of(put, put));
        WatchResponse deletion = mock(WatchResponse.class);
        when(deletion.getEvents()).thenReturn(List.of(delete));

        listener.getValue().accept(response);
        listener.getValue().accept(deletion);
        handle.close();

        assertThat(calls.get()).isEqualTo(1);
        verify(watcher).close();
    }

    @Test
    void testCloseClosesClient() {
        store.close();

        verify(etcdClient).close();
    }
}
