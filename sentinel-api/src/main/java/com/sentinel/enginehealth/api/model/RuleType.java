/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.Locale;

/**
 * Closed set of rule variants. Each variant has its own evaluation path.
 */
public enum RuleType {
    GENERIC("generic"),
    TIP_MAP_DELTA("tip_map_delta");

    private final String key;

    RuleType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static RuleType fromKey(String key) {
        if (key == null || key.isBlank()) {
            return GENERIC;
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (RuleType type : values()) {
            if (type.key.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown rule type: " + key);
    }
}
