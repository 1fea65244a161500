/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.exceptions;

/**
 * Thrown when a single rule cannot be parsed or prepared for evaluation.
 * Callers isolate it per rule: the rule is skipped and the others continue.
 */
public class MalformedRuleException extends SentinelException {

    private final String ruleId;

    public MalformedRuleException(String ruleId, String reason) {
        super("Malformed rule '" + ruleId + "': " + reason);
        this.ruleId = ruleId;
    }

    public MalformedRuleException(String ruleId, String reason, Throwable cause) {
        super("Malformed rule '" + ruleId + "': " + reason, cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
