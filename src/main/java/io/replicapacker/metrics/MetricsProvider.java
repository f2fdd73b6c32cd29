package io.replicapacker.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import static io.replicapacker.metrics.MetricsConstants.OPTIMIZE_DURATION_METRIC_NAME;
import static io.replicapacker.metrics.MetricsConstants.PLANS_METRIC_NAME;
import static io.replicapacker.metrics.MetricsConstants.PLAN_FAILURES_METRIC_NAME;
import static io.replicapacker.metrics.MetricsConstants.PLAN_SERVER_COUNT_METRIC_NAME;
import static io.replicapacker.metrics.MetricsConstants.REASON_TAG;
import static io.replicapacker.metrics.MetricsConstants.STRATEGY_TAG;
import static io.replicapacker.metrics.MetricsConstants.TRIALS_METRIC_NAME;

/*
 * MetricsProvider creates the counters, gauges and timers of the packer and records
 * the outcome of each planning request on them. Every meter is tagged with the packer id.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String HOST_NAME_TAG = "hostname";

    private final MeterRegistry registry;
    private final String hostname;
    // Gauges are registered once per id; later lookups reuse the same value holder
    private final Map<String, AtomicDouble> gauges = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${packer.id:replica-packer}") String packerId) {
        this.registry = registry;
        this.hostname = packerId;
        log.info("MetricsProvider initialized for packer: {}", hostname);
    }

    /**
     * Record a successful plan: its size, the number of packer runs it took and the search time.
     *
     * @param strategy name of the ordering strategy used
     * @param serverCount servers in the chosen plan
     * @param trials packer runs evaluated
     * @param duration wall time of the search
     */
    public void recordPlan(String strategy, int serverCount, int trials, Duration duration) {
        Map<String, String> tags = Map.of(STRATEGY_TAG, strategy);
        counter(PLANS_METRIC_NAME, tags).increment();
        counter(TRIALS_METRIC_NAME, tags).increment(trials);
        timer(OPTIMIZE_DURATION_METRIC_NAME, tags).record(duration);
        gauge(PLAN_SERVER_COUNT_METRIC_NAME, tags).set(serverCount);
    }

    /**
     * Record a rejected planning request.
     *
     * @param reason short failure class, e.g. the exception's simple name
     */
    public void recordFailure(String reason) {
        counter(PLAN_FAILURES_METRIC_NAME, Map.of(REASON_TAG, reason)).increment();
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags.
     *
     * @return the AtomicDouble backing the gauge, shared by all callers using the same name and tags
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String key = name + new TreeMap<>(tags);
        return gauges.computeIfAbsent(key, k -> {
            AtomicDouble gaugeValue = new AtomicDouble(0);
            Gauge.builder(name, gaugeValue::get).tags(mapToTagArray(tags)).register(registry);
            return gaugeValue;
        });
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    /**
     * Convert a map of tags to an array of alternating keys and values, including hostname.
     */
    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = HOST_NAME_TAG;
        tagArray[index] = hostname;
        return tagArray;
    }
}
