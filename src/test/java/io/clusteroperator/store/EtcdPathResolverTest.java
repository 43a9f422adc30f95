package io.clusteroperator.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EtcdPathResolverTest {

    private final EtcdPathResolver resolver = new EtcdPathResolver("cluster-operator");

    @Test
    void testPaths() {
        assertThat(resolver.getClustersPrefix()).isEqualTo("/cluster-operator/clusters");
        assertThat(resolver.getClusterPath("prod")).isEqualTo("/cluster-operator/clusters/prod");
        assertThat(resolver.getLeaderElectionPath()).isEqualTo("/cluster-operator/leader-election");
    }

    @Test
    void testClusterIdFromKey() {
        assertThat(resolver.clusterIdFromKey("/cluster-operator/clusters/prod")).isEqualTo("prod");
        assertThat(resolver.clusterIdFromKey("/cluster-operator/clusters/prod/extra")).isNull();
        assertThat(resolver.clusterIdFromKey("/cluster-operator/clusters/")).isNull();
        assertThat(resolver.clusterIdFromKey("/other/clusters/prod")).isNull();
        assertThat(resolver.clusterIdFromKey(null)).isNull();
    }
}
