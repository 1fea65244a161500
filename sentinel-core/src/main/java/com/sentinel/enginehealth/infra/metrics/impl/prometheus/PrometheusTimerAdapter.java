package com.sentinel.enginehealth.infra.metrics.impl.prometheus;

import com.sentinel.enginehealth.infra.metrics.Timer;

import java.time.Duration;

/**
 * Bridges {@link Timer} to a Prometheus histogram measured in seconds.
 */
final class PrometheusTimerAdapter implements Timer {

    private final io.prometheus.client.Histogram.Child histogram;

    PrometheusTimerAdapter(io.prometheus.client.Histogram histogram, String[] labelValues) {
        if (histogram == null) {
            throw new IllegalArgumentException("Histogram cannot be null");
        }
        this.histogram = histogram.labels(labelValues);
    }

    @Override
    public void record(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("Duration must be non-negative: " + duration);
        }
        histogram.observe(duration.toNanos() / 1_000_000_000.0);
    }

    @Override
    public long count() {
        double[] buckets = histogram.get().buckets;
        return buckets.length == 0 ? 0L : (long) buckets[buckets.length - 1];
    }
}
