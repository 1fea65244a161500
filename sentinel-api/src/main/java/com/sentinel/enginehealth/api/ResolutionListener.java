/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api;

import java.util.Map;

/**
 * Callback for profile resolution stages.
 *
 * <p>Stages run in order: {@code CHAIN_WALK}, {@code THRESHOLD_MERGE},
 * {@code RULE_MERGE}, {@code VALIDATION}.
 */
public interface ResolutionListener {

    void onStageComplete(String profileId, StageResult result);

    default void onError(String profileId, String stageName, Exception error) {
    }

    /**
     * @param stageName     stage that finished
     * @param durationNanos wall time of the stage
     * @param metrics       stage-specific figures such as {@code chainLength} or {@code ruleCount}
     */
    record StageResult(String stageName, long durationNanos, Map<String, Object> metrics) {

        public long durationMicros() {
            return durationNanos / 1_000;
        }
    }
}
