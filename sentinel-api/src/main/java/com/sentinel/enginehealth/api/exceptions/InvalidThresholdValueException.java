/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.exceptions;

import java.util.List;

/**
 * Thrown when a resolved threshold tree fails its sanity checks.
 */
public class InvalidThresholdValueException extends SentinelException {

    private final String profileId;
    private final List<String> errors;

    public InvalidThresholdValueException(String profileId, List<String> errors) {
        super("Invalid threshold values in profile '" + profileId + "': " + String.join("; ", errors));
        this.profileId = profileId;
        this.errors = List.copyOf(errors);
    }

    public String getProfileId() {
        return profileId;
    }

    public List<String> getErrors() {
        return errors;
    }
}
