/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.Locale;

public enum Severity {
    WARNING("Warning"),
    CRITICAL("Critical");

    private final String displayName;

    Severity(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static Severity fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
