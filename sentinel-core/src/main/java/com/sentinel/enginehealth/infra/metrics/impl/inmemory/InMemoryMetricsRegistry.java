package com.sentinel.enginehealth.infra.metrics.impl.inmemory;

import com.sentinel.enginehealth.infra.metrics.Counter;
import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.infra.metrics.Timer;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry holding every metric in memory.
 *
 * <p>Metrics are keyed by name plus tags, so {@code counter("x", "k", "a")} and
 * {@code counter("x", "k", "b")} are distinct. The {@code get*} helpers sum over all
 * tag combinations of a name unless tags are given.
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(key(name, tags), InMemoryCounter::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(key(name, tags), InMemoryTimer::new);
    }

    // Test helper methods

    public long getCounterValue(String name, String... tags) {
        if (tags.length > 0) {
            InMemoryCounter counter = counters.get(key(name, tags));
            return counter != null ? counter.count() : 0L;
        }
        return counters.entrySet().stream()
                .filter(e -> nameOf(e.getKey()).equals(name))
                .mapToLong(e -> e.getValue().count())
                .sum();
    }

    public List<Duration> getTimerRecordings(String name, String... tags) {
        InMemoryTimer timer = timers.get(key(name, tags));
        return timer != null ? timer.recordings() : Collections.emptyList();
    }

    public void reset() {
        counters.clear();
        timers.clear();
    }

    private static String key(String name, String[] tags) {
        if (tags.length % 2 != 0) {
            throw new IllegalArgumentException("Tags must be key/value pairs: " + String.join(",", tags));
        }
        return tags.length == 0 ? name : name + "{" + String.join(",", tags) + "}";
    }

    private static String nameOf(String key) {
        int brace = key.indexOf('{');
        return brace < 0 ? key : key.substring(0, brace);
    }
}
