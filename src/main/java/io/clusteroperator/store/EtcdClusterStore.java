package io.clusteroperator.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.clusteroperator.models.ClusterRecord;
import io.clusteroperator.models.ClusterStatus;
import io.clusteroperator.resources.ConflictException;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.etcd.jetcd.watch.WatchEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.clusteroperator.config.Constants.PATH_DELIMITER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * etcd-based implementation of ClusterStore.
 * Each cluster is a single JSON document; status writes are compare-and-swap on the key's modRevision.
 */
@Slf4j
public class EtcdClusterStore implements ClusterStore {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private final Client etcdClient;
    private final KV kvClient;
    private final Watch watchClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    public EtcdClusterStore(Client etcdClient, String rootPrefix) {
        this(etcdClient, etcdClient.getKVClient(), etcdClient.getWatchClient(), new EtcdPathResolver(rootPrefix));
    }

    /**
     * Constructor with injected dependencies (used by tests)
     */
    EtcdClusterStore(Client etcdClient, KV kvClient, Watch watchClient, EtcdPathResolver pathResolver) {
        this.etcdClient = etcdClient;
        this.kvClient = kvClient;
        this.watchClient = watchClient;
        this.pathResolver = pathResolver;
        this.objectMapper = createObjectMapper();
        log.info("EtcdClusterStore initialized under prefix {}", pathResolver.getClustersPrefix());
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public List<ClusterRecord> listClusters() throws Exception {
        String prefix = pathResolver.getClustersPrefix() + PATH_DELIMITER;
        ByteSequence prefixBytes = ByteSequence.from(prefix, UTF_8);
        GetResponse response = kvClient.get(prefixBytes, GetOption.newBuilder().withPrefix(prefixBytes).build())
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        List<ClusterRecord> records = new ArrayList<>();
        for (KeyValue kv : response.getKvs()) {
            String key = kv.getKey().toString(UTF_8);
            String clusterId = pathResolver.clusterIdFromKey(key);
            if (clusterId == null) {
                log.debug("Skipping non-cluster key {}", key);
                continue;
            }
            try {
                records.add(toRecord(clusterId, kv));
            } catch (Exception e) {
                log.error("Skipping unreadable cluster record {}: {}", key, e.getMessage());
            }
        }
        log.debug("Retrieved {} cluster records from etcd", records.size());
        return records;
    }

    @Override
    public Optional<ClusterRecord> getCluster(String clusterId) throws Exception {
        GetResponse response = executeEtcdGet(pathResolver.getClusterPath(clusterId));
        if (response.getCount() == 0 || response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toRecord(clusterId, response.getKvs().get(0)));
    }

    @Override
    public void updateStatus(ClusterRecord record, ClusterStatus status) throws Exception {
        ClusterRecord updated = new ClusterRecord(record.getClusterId(), record.getNamespace(),
                record.getSpec(), status, record.getRevision());
        ByteSequence keyBytes = ByteSequence.from(pathResolver.getClusterPath(record.getClusterId()), UTF_8);
        ByteSequence valueBytes = ByteSequence.from(objectMapper.writeValueAsString(updated), UTF_8);

        TxnResponse txnResponse = kvClient.txn()
                .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(record.getRevision())))
                .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
                .Else(Op.get(keyBytes, GetOption.DEFAULT))
                .commit()
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        if (!txnResponse.isSucceeded()) {
            throw new ConflictException("Cluster " + record.getClusterId()
                    + " was modified after revision " + record.getRevision());
        }
        log.debug("Stored status of cluster {} (state {})", record.getClusterId(), status.getState());
    }

    @Override
    public void putCluster(ClusterRecord record) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(pathResolver.getClusterPath(record.getClusterId()), UTF_8);
        ByteSequence valueBytes = ByteSequence.from(objectMapper.writeValueAsString(record), UTF_8);
        kvClient.put(keyBytes, valueBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        log.info("Stored cluster record {}", record.getClusterId());
    }

    @Override
    public AutoCloseable watchCluster(String clusterId, Runnable onChange) {
        ByteSequence keyBytes = ByteSequence.from(pathResolver.getClusterPath(clusterId), UTF_8);
        Watch.Watcher watcher = watchClient.watch(keyBytes, watchResponse -> {
            for (WatchEvent event : watchResponse.getEvents()) {
                if (event.getEventType() == WatchEvent.EventType.PUT) {
                    log.debug("Cluster record {} changed at revision {}", clusterId,
                            event.getKeyValue().getModRevision());
                    onChange.run();
                    break;
                }
            }
        });
        return watcher::close;
    }

    @Override
    public void close() {
        log.info("Closing etcd cluster store");
        if (etcdClient != null) {
            etcdClient.close();
        }
    }

    private GetResponse executeEtcdGet(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, UTF_8);
        return kvClient.get(keyBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private ClusterRecord toRecord(String clusterId, KeyValue kv) throws Exception {
        ClusterRecord record = objectMapper.readValue(kv.getValue().toString(UTF_8), ClusterRecord.class);
        if (record.getClusterId() == null) {
            record.setClusterId(clusterId);
        }
        record.setRevision(kv.getModRevision());
        return record;
    }
}
