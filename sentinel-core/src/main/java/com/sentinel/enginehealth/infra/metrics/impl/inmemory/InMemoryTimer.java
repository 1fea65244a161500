package com.sentinel.enginehealth.infra.metrics.impl.inmemory;

import com.sentinel.enginehealth.infra.metrics.Timer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Timer that keeps every recording, for assertions in tests.
 */
final class InMemoryTimer implements Timer {

    private final String key;
    private final List<Duration> recordings = new CopyOnWriteArrayList<>();

    InMemoryTimer(String key) {
        this.key = key;
    }

    @Override
    public void record(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("Timer " + key + " needs a non-negative duration");
        }
        recordings.add(duration);
    }

    @Override
    public long count() {
        return recordings.size();
    }

    List<Duration> recordings() {
        return new ArrayList<>(recordings);
    }
}
