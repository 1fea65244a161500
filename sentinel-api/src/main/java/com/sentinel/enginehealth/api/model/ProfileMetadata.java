/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

/**
 * Descriptors of the fleet segment a profile applies to. Every field is optional.
 */
public record ProfileMetadata(
        String engineFamily,
        String fuelType,
        String application,
        String version,
        String status) {

    public static final ProfileMetadata EMPTY = new ProfileMetadata(null, null, null, null, null);
}
