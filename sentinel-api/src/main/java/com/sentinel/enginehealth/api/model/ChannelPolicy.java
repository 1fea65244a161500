/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.Objects;

/**
 * Validity rules for one channel: one policy for statistics, one for alerting,
 * plus literal-value filters.
 */
public record ChannelPolicy(
        ValidityPolicy statsPolicy,
        ValidityPolicy alertPolicy,
        boolean excludeZero,
        boolean excludeNegative) {

    public static final ChannelPolicy ALWAYS = new ChannelPolicy(
            ValidityPolicy.ALWAYS_VALID, ValidityPolicy.ALWAYS_VALID, false, false);

    public ChannelPolicy {
        Objects.requireNonNull(statsPolicy, "statsPolicy");
        Objects.requireNonNull(alertPolicy, "alertPolicy");
    }

    public static ChannelPolicy of(ValidityPolicy both) {
        return new ChannelPolicy(both, both, false, false);
    }

    /**
     * Whether a present value passes the literal filters.
     */
    public boolean acceptsValue(double value) {
        if (Double.isNaN(value)) {
            return false;
        }
        if (excludeZero && value == 0.0) {
            return false;
        }
        return !(excludeNegative && value < 0.0);
    }
}
