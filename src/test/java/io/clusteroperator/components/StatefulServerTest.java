package io.clusteroperator.components;

import io.clusteroperator.enums.ClusterState;
import io.clusteroperator.enums.LocationType;
import io.clusteroperator.models.ClusterSpec;
import io.clusteroperator.models.LocationSpec;
import io.clusteroperator.models.TestSpecs;
import io.clusteroperator.models.UpdateStatus;
import io.clusteroperator.resources.InMemoryResourceAccessor;
import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static io.clusteroperator.config.Constants.*;
import static org.assertj.core.api.Assertions.*;

class StatefulServerTest {

    private static final String NAMESPACE = "ns";
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private InMemoryResourceAccessor accessor;

    @BeforeEach
    void setUp() {
        accessor = new InMemoryResourceAccessor();
    }

    private ReconcileContext ctx(Instant now) {
        return ReconcileContext.forTick("c1", NAMESPACE, ClusterState.RUNNING, UpdateStatus.none(),
                Clock.fixed(now, ZoneOffset.UTC), null, Duration.ofMinutes(5));
    }

    private StatefulServer fetchedServer(ClusterSpec spec, String componentName, ReconcileContext ctx) throws Exception {
        ServerComponent component = (ServerComponent) new ComponentFactory(accessor, "c1", NAMESPACE, spec)
                .createAll().get(componentName).orElseThrow();
        component.fetch(ctx);
        return (StatefulServer) component.getServer();
    }

    @Test
    void testRebuildIsPure() throws Exception {
        ClusterSpec spec = TestSpecs.full();
        StatefulServer server = fetchedServer(spec, "DataNode", ctx(NOW));

        StatefulSet first = server.rebuildStatefulSet();
        StatefulSet second = server.rebuildStatefulSet();

        assertThat(second).isNotSameAs(first);
        assertThat(second).isEqualTo(first);
        assertThat(second.getSpec().getReplicas()).isEqualTo(3);
    }

    @Test
    void testBuildIsCachedUntilRebuild() throws Exception {
        StatefulServer server = fetchedServer(TestSpecs.discoveryOnly(), "Discovery", ctx(NOW));

        StatefulSet built = server.buildStatefulSet();

        assertThat(server.buildStatefulSet()).isSameAs(built);
        StatefulSet rebuilt = server.rebuildStatefulSet();
        assertThat(rebuilt).isNotSameAs(built);
        assertThat(server.buildStatefulSet()).isSameAs(rebuilt);
    }

    @Test
    void testWorkloadSetShape() throws Exception {
        StatefulServer server = fetchedServer(TestSpecs.full(), "DataNode", ctx(NOW));

        StatefulSet sts = server.buildStatefulSet();
        Container main = sts.getSpec().getTemplate().getSpec().getContainers().get(0);
        Container prepare = sts.getSpec().getTemplate().getSpec().getInitContainers().get(0);

        assertThat(sts.getMetadata().getName()).isEqualTo("c1-data-node");
        assertThat(sts.getSpec().getServiceName()).isEqualTo("c1-data-node");
        assertThat(main.getImage()).isEqualTo(TestSpecs.CORE_IMAGE);
        assertThat(main.getCommand()).containsExactly("/usr/bin/server-data-node", "--config", "/config/data-node.json");
        assertThat(main.getVolumeMounts()).extracting("mountPath").containsExactly("/data", CONFIG_MOUNT_PATH);
        assertThat(prepare.getCommand()).containsExactly("bash", "-c", "mkdir -p '/data/chunks' && test -w '/data/chunks'");
        assertThat(sts.getSpec().getTemplate().getSpec().getVolumes())
                .extracting("name").contains(CONFIG_VOLUME_NAME);
    }

    @Test
    void testImageOverrideAndUiDefault() throws Exception {
        ClusterSpec spec = TestSpecs.full();
        spec.getSchedulers().setImage("registry.local/core:24.1");

        assertThat(fetchedServer(spec, "Scheduler", ctx(NOW)).getImage()).isEqualTo("registry.local/core:24.1");
        assertThat(fetchedServer(spec, "Master", ctx(NOW)).getImage()).isEqualTo(TestSpecs.CORE_IMAGE);
        assertThat(fetchedServer(spec, "UI", ctx(NOW)).getImage()).isEqualTo(TestSpecs.UI_IMAGE);
    }

    @Test
    void testLocationInitCommand() {
        assertThat(StatefulServer.locationInitCommand(List.of())).isEqualTo("true");
        assertThat(StatefulServer.locationInitCommand(List.of(
                new LocationSpec(LocationType.CHUNK_STORE, "/data/chunks"),
                new LocationSpec(LocationType.LOGS, "/logs"))))
                .isEqualTo("mkdir -p '/data/chunks' && test -w '/data/chunks' && mkdir -p '/logs' && test -w '/logs'");
    }

    @Test
    void testSyncWritesEveryObjectIncludingBalancer() throws Exception {
        ReconcileContext ctx = ctx(NOW);
        StatefulServer server = fetchedServer(TestSpecs.full(), "HttpProxy-public", ctx);

        server.sync(ctx);

        assertThat(accessor.getWrites()).containsExactly(
                "ConfigMap:ns/c1-http-proxy-public-config",
                "Service:ns/c1-http-proxy-public",
                "Service:ns/c1-http-proxy-public-monitoring",
                "Service:ns/c1-http-proxy-public-lb",
                "StatefulSet:ns/c1-http-proxy-public");
        ConfigMap config = accessor.get(ConfigMap.class, NAMESPACE, "c1-http-proxy-public-config");
        assertThat(config.getMetadata().getAnnotations()).containsKey(ANNOTATION_CONFIG_CHECKSUM);
        assertThat(accessor.get(Service.class, NAMESPACE, "c1-http-proxy-public").getSpec().getClusterIP())
                .isEqualTo("None");
    }

    @Test
    void testNeverCreatedServerNeedsSyncNotUpdate() throws Exception {
        StatefulServer server = fetchedServer(TestSpecs.discoveryOnly(), "Discovery", ctx(NOW));

        assertThat(server.needSync()).isTrue();
        assertThat(server.needUpdate()).isFalse();
        assertThat(server.arePodsRemoved()).isFalse();
        assertThat(server.arePodsReady(ctx(NOW))).isFalse();
    }

    @Test
    void testImageChangeNeedsUpdate() throws Exception {
        ClusterSpec spec = TestSpecs.discoveryOnly();
        ReconcileContext ctx = ctx(NOW);
        fetchedServer(spec, "Discovery", ctx).sync(ctx);

        spec.getDiscovery().setImage("registry.local/core:24.1");
        StatefulServer server = fetchedServer(spec, "Discovery", ctx(NOW));

        assertThat(server.needUpdate()).isTrue();
        assertThat(server.needSync()).isFalse();
    }

    @Test
    void testRemovePodsScalesWorkloadSetToZero() throws Exception {
        ClusterSpec spec = TestSpecs.discoveryOnly();
        ReconcileContext ctx = ctx(NOW);
        fetchedServer(spec, "Discovery", ctx).sync(ctx);
        accessor.markAllPodsReady();
        accessor.clearWrites();

        StatefulServer server = fetchedServer(spec, "Discovery", ctx(NOW));
        server.removePods(ctx(NOW));

        assertThat(accessor.getWrites()).containsExactly("StatefulSet:ns/c1-discovery");
        assertThat(accessor.get(StatefulSet.class, NAMESPACE, "c1-discovery").getSpec().getReplicas()).isZero();
        assertThat(server.buildStatefulSet().getSpec().getReplicas()).isEqualTo(1);
        assertThat(server.arePodsRemoved()).isFalse();

        accessor.markPodsGone(NAMESPACE, "c1-discovery");
        assertThat(fetchedServer(spec, "Discovery", ctx(NOW)).arePodsRemoved()).isTrue();
    }

    @Test
    void testDrainHandshake() throws Exception {
        ClusterSpec spec = TestSpecs.mastersAndSchedulers();
        ReconcileContext ctx = ctx(NOW);
        fetchedServer(spec, "Master", ctx).sync(ctx);

        StatefulServer server = fetchedServer(spec, "Master", ctx(NOW));
        assertThat(server.isDrainRequested()).isFalse();
        server.requestDrain(ctx(NOW));

        StatefulServer requested = fetchedServer(spec, "Master", ctx(NOW));
        assertThat(requested.isDrainRequested()).isTrue();
        assertThat(requested.isDrained(ctx(NOW.plusSeconds(60)))).isFalse();
        assertThat(requested.isDrained(ctx(NOW.plus(Duration.ofMinutes(5))))).isTrue();

        accessor.annotate(StatefulSet.class, NAMESPACE, "c1-master", ANNOTATION_DRAINED, "true");
        assertThat(fetchedServer(spec, "Master", ctx(NOW)).isDrained(ctx(NOW))).isTrue();
    }

    @Test
    void testDrainRequestRejectedWhenReadOnly() throws Exception {
        ClusterSpec spec = TestSpecs.mastersAndSchedulers();
        ReconcileContext ctx = ctx(NOW);
        fetchedServer(spec, "Master", ctx).sync(ctx);
        StatefulServer server = fetchedServer(spec, "Master", ctx(NOW));

        assertThatThrownBy(() -> server.requestDrain(ctx(NOW).readOnly()))
                .isInstanceOf(InvariantViolationException.class);
    }
}
