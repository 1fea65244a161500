/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Summary of one channel over the samples its statistics policy marks valid.
 * When {@code noValidData} is set the numeric fields are {@code NaN}.
 */
public record ChannelStatistics(
        @JsonProperty("channel") String channel,
        @JsonProperty("min") double min,
        @JsonProperty("max") double max,
        @JsonProperty("mean") double mean,
        @JsonProperty("stdDev") double stdDev,
        @JsonProperty("validCount") long validCount,
        @JsonProperty("totalCount") long totalCount,
        @JsonProperty("policy") ValidityPolicy policy,
        @JsonProperty("noValidData") boolean noValidData) {

    public static ChannelStatistics empty(String channel, long totalCount, ValidityPolicy policy) {
        return new ChannelStatistics(channel, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                0, totalCount, policy, true);
    }
}
