package com.sentinel.enginehealth.infra.metrics.internal;

import com.sentinel.enginehealth.infra.metrics.Counter;
import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.infra.metrics.Timer;

import java.time.Duration;

/**
 * Registry that discards everything.
 */
public final class NoOpMetricsRegistry implements MetricsRegistry {

    private static final Counter NO_OP_COUNTER = new Counter() {
        @Override
        public void increment(long amount) {
        }

        @Override
        public long count() {
            return 0;
        }
    };

    private static final Timer NO_OP_TIMER = new Timer() {
        @Override
        public void record(Duration duration) {
        }

        @Override
        public long count() {
            return 0;
        }
    };

    @Override
    public Counter counter(String name, String... tags) {
        return NO_OP_COUNTER;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return NO_OP_TIMER;
    }
}
