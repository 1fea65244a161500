/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One firing of a rule or of a profile threshold.
 *
 * @param ruleId    id of the rule that fired
 * @param category  rule category, or the channel the rule watches
 * @param severity  alert severity
 * @param onsetTime time the condition had persisted long enough to fire
 * @param clearTime first moment of the false run that cleared it; {@code null} while open
 * @param message   rule description, or its name when it has none
 * @param breach    threshold, unit and readings of a threshold alert; {@code null} for rule alerts
 */
public record AlertEvent(
        @JsonProperty("ruleId") String ruleId,
        @JsonProperty("category") String category,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("onsetTime") double onsetTime,
        @JsonProperty("clearTime") Double clearTime,
        @JsonProperty("message") String message,
        @JsonProperty("breach") @JsonInclude(JsonInclude.Include.NON_NULL) ThresholdBreach breach) {

    public AlertEvent(String ruleId, String category, Severity severity, double onsetTime, Double clearTime,
                      String message) {
        this(ruleId, category, severity, onsetTime, clearTime, message, null);
    }

    public boolean isOpen() {
        return clearTime == null;
    }

    public AlertEvent cleared(double time) {
        return new AlertEvent(ruleId, category, severity, onsetTime, time, message, breach);
    }

    public AlertEvent withBreach(ThresholdBreach updated) {
        return new AlertEvent(ruleId, category, severity, onsetTime, clearTime, message, updated);
    }

    /**
     * Duration of the alert; an open alert is measured up to {@code endOfRecording}.
     */
    public double duration(double endOfRecording) {
        double end = clearTime != null ? clearTime : endOfRecording;
        return Math.max(0.0, end - onsetTime);
    }
}
