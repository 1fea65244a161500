/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.exceptions;

/**
 * Thrown by a profile store when a profile document cannot be read or parsed.
 */
public class ProfileStoreException extends SentinelException {

    public ProfileStoreException(String message) {
        super(message);
    }

    public ProfileStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
