/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.rules;

import it.unimi.dsi.fastutil.doubles.DoubleArrayFIFOQueue;

/**
 * Accumulated true time of a condition over a trailing window.
 *
 * <p>Only true intervals are kept, as parallel start/end queues. Intervals are trimmed
 * at the window edge, so the total is exact rather than per-sample. Not thread-safe.
 */
public final class RollingWindow {

    private final double windowSec;
    private final DoubleArrayFIFOQueue starts = new DoubleArrayFIFOQueue();
    private final DoubleArrayFIFOQueue ends = new DoubleArrayFIFOQueue();
    private double total;

    public RollingWindow(double windowSec) {
        if (!(windowSec > 0)) {
            throw new IllegalArgumentException("windowSec must be positive");
        }
        this.windowSec = windowSec;
    }

    /**
     * Adds the interval {@code [from, to]} when it was true, then drops whatever lies
     * before {@code to - windowSec}.
     */
    public void add(double from, double to, boolean wasTrue) {
        if (wasTrue && to > from) {
            if (!ends.isEmpty() && ends.lastDouble() == from) {
                ends.dequeueLastDouble();
                ends.enqueue(to);
            } else {
                starts.enqueue(from);
                ends.enqueue(to);
            }
            total += to - from;
        }
        evictBefore(to - windowSec);
    }

    public double trueSeconds() {
        return total;
    }

    public int intervalCount() {
        return starts.size();
    }

    public void reset() {
        starts.clear();
        ends.clear();
        total = 0.0;
    }

    private void evictBefore(double cutoff) {
        while (!starts.isEmpty()) {
            double start = starts.firstDouble();
            double end = ends.firstDouble();
            if (end <= cutoff) {
                starts.dequeueDouble();
                ends.dequeueDouble();
                total -= end - start;
            } else {
                if (start < cutoff) {
                    starts.dequeueDouble();
                    starts.enqueueFirst(cutoff);
                    total -= cutoff - start;
                }
                break;
            }
        }
        if (starts.isEmpty()) {
            total = 0.0;
        }
    }
}
