package io.replicapacker.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.replicapacker.metrics.MetricsConstants.*;
import static org.assertj.core.api.Assertions.*;

class MetricsProviderTest {

    private static final String TEST_PACKER_ID = "test-packer-01";

    private MeterRegistry registry;
    private MetricsProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new MetricsProvider(registry, TEST_PACKER_ID);
    }

    @Test
    void testCounterIsTaggedWithPackerId() {
        Counter counter = provider.counter("test.counter", Map.of("environment", "test"));

        counter.increment();
        counter.increment(5.0);

        assertThat(counter.getId().getTag("hostname")).isEqualTo(TEST_PACKER_ID);
        assertThat(counter.getId().getTag("environment")).isEqualTo("test");
        assertThat(counter.count()).isEqualTo(6.0);
    }

    @Test
    void testGaugeIsRegisteredOnce() {
        AtomicDouble first = provider.gauge("test.gauge", Map.of("type", "servers"));
        AtomicDouble second = provider.gauge("test.gauge", Map.of("type", "servers"));

        second.set(3);

        assertThat(second).isSameAs(first);
        Gauge gauge = registry.find("test.gauge").gauge();
        assertThat(gauge).isNotNull();
        assertThat(gauge.value()).isEqualTo(3.0);
    }

    @Test
    void testRecordPlan() {
        // When
        provider.recordPlan("Random", 4, 101, Duration.ofMillis(25));
        provider.recordPlan("Random", 3, 101, Duration.ofMillis(15));

        // Then
        assertThat(registry.find(PLANS_METRIC_NAME).tag(STRATEGY_TAG, "Random").counter().count()).isEqualTo(2.0);
        assertThat(registry.find(TRIALS_METRIC_NAME).counter().count()).isEqualTo(202.0);
        assertThat(registry.find(PLAN_SERVER_COUNT_METRIC_NAME).gauge().value()).isEqualTo(3.0);
        Timer timer = registry.find(OPTIMIZE_DURATION_METRIC_NAME).timer();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(40.0);
    }

    @Test
    void testRecordFailure() {
        provider.recordFailure("UnplaceableReplicaException");
        provider.recordFailure("UnplaceableReplicaException");
        provider.recordFailure("InvalidCapacityException");

        assertThat(registry.find(PLAN_FAILURES_METRIC_NAME).tag(REASON_TAG, "UnplaceableReplicaException")
            .counter().count()).isEqualTo(2.0);
        assertThat(registry.find(PLAN_FAILURES_METRIC_NAME).tag(REASON_TAG, "InvalidCapacityException")
            .counter().count()).isEqualTo(1.0);
    }
}
