/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.rules;

/**
 * Persistence state of one rule between samples. Times are NaN when unset.
 *
 * @param firing       whether the rule currently has an open alert
 * @param trueSince    start of the current stretch of true samples
 * @param lastFalseAt  first false sample of the current false stretch
 * @param onsetTime    onset of the open alert
 */
public record RuleState(boolean firing, double trueSince, double lastFalseAt, double onsetTime) {

    public static final RuleState IDLE = new RuleState(false, Double.NaN, Double.NaN, Double.NaN);
}
