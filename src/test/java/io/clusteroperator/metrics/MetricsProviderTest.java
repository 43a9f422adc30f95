package io.clusteroperator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class MetricsProviderTest {

    private static final String TEST_OPERATOR_ID = "operator-01";

    private MeterRegistry registry;
    private MetricsProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new MetricsProvider(registry, TEST_OPERATOR_ID);
    }

    @Test
    void testCounterIsTaggedWithHostname() {
        Counter counter = provider.counter("test.counter", Map.of("clusterId", "c1"));

        counter.increment();
        counter.increment(2.0);

        assertThat(counter.getId().getTag("hostname")).isEqualTo(TEST_OPERATOR_ID);
        assertThat(counter.getId().getTag("clusterId")).isEqualTo("c1");
        assertThat(counter.count()).isEqualTo(3.0);
    }

    @Test
    void testGaugeIsCachedByNameAndTags() {
        AtomicDouble first = provider.gauge("test.gauge", Map.of("clusterId", "c1", "component", "Master"));
        AtomicDouble again = provider.gauge("test.gauge", Map.of("component", "Master", "clusterId", "c1"));
        AtomicDouble other = provider.gauge("test.gauge", Map.of("clusterId", "c2", "component", "Master"));

        again.set(3);

        assertThat(again).isSameAs(first);
        assertThat(other).isNotSameAs(first);
        Gauge gauge = registry.find("test.gauge").tag("clusterId", "c1").gauge();
        assertThat(gauge.value()).isEqualTo(3.0);
        assertThat(registry.find("test.gauge").gauges()).hasSize(2);
    }

    @Test
    void testTimerRecords() {
        Timer timer = provider.timer("test.timer", Map.of("clusterId", "c1"));

        timer.record(100, TimeUnit.MILLISECONDS);

        assertThat(timer.getId().getTag("hostname")).isEqualTo(TEST_OPERATOR_ID);
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(100);
    }
}
