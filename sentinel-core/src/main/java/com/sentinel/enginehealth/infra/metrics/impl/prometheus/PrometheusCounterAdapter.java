package com.sentinel.enginehealth.infra.metrics.impl.prometheus;

import com.sentinel.enginehealth.infra.metrics.Counter;

/**
 * Bridges {@link Counter} to a Prometheus counter child bound to label values.
 */
final class PrometheusCounterAdapter implements Counter {

    private final io.prometheus.client.Counter.Child counter;

    PrometheusCounterAdapter(io.prometheus.client.Counter counter, String[] labelValues) {
        if (counter == null) {
            throw new IllegalArgumentException("Counter cannot be null");
        }
        this.counter = counter.labels(labelValues);
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Prometheus counters cannot decrease: " + amount);
        }
        counter.inc(amount);
    }

    @Override
    public long count() {
        return (long) counter.get();
    }
}
