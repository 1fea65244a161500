package com.sentinel.enginehealth.infra.metrics.impl.prometheus;

import com.sentinel.enginehealth.infra.metrics.Counter;
import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.infra.metrics.Timer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Histogram;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus simpleclient backed registry.
 *
 * <p>One collector is registered per metric name; every distinct set of label
 * values becomes a child of it. Label names of a metric are fixed by its first use.
 */
public final class PrometheusMetricsRegistry implements MetricsRegistry {

    private final CollectorRegistry registry;
    private final Map<String, io.prometheus.client.Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Histogram> histograms = new ConcurrentHashMap<>();

    public PrometheusMetricsRegistry() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusMetricsRegistry(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public Counter counter(String name, String... tags) {
        io.prometheus.client.Counter counter = counters.computeIfAbsent(name, n ->
                io.prometheus.client.Counter.build()
                        .name(sanitizeName(n))
                        .help("Counter " + n)
                        .labelNames(labelNames(tags))
                        .register(registry));
        return new PrometheusCounterAdapter(counter, labelValues(tags));
    }

    @Override
    public Timer timer(String name, String... tags) {
        Histogram histogram = histograms.computeIfAbsent(name, n ->
                Histogram.build()
                        .name(sanitizeName(n) + "_seconds")
                        .help("Timer " + n)
                        .buckets(0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0)
                        .labelNames(labelNames(tags))
                        .register(registry));
        return new PrometheusTimerAdapter(histogram, labelValues(tags));
    }

    public CollectorRegistry getCollectorRegistry() {
        return registry;
    }

    static String sanitizeName(String name) {
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9_:]", "_")
                .replaceAll("_{2,}", "_");
    }

    private static String[] labelNames(String[] tags) {
        requirePairs(tags);
        String[] labels = new String[tags.length / 2];
        for (int i = 0; i < labels.length; i++) {
            labels[i] = tags[i * 2];
        }
        return labels;
    }

    private static String[] labelValues(String[] tags) {
        requirePairs(tags);
        String[] values = new String[tags.length / 2];
        for (int i = 0; i < values.length; i++) {
            values[i] = tags[i * 2 + 1];
        }
        return values;
    }

    private static void requirePairs(String[] tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs: " + Arrays.toString(tags));
        }
    }
}
