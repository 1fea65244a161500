package com.sentinel.enginehealth.infra.metrics.impl.inmemory;

import com.sentinel.enginehealth.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

final class InMemoryCounter implements Counter {

    private final String key;
    private final LongAdder value = new LongAdder();

    InMemoryCounter(String key) {
        this.key = key;
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter " + key + " cannot decrease: " + amount);
        }
        value.add(amount);
    }

    @Override
    public long count() {
        return value.sum();
    }

    @Override
    public String toString() {
        return key + "=" + count();
    }
}
