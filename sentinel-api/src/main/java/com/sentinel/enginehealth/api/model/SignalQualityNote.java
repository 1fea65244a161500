/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

/**
 * Non-fatal finding reported next to analysis results.
 *
 * @param kind    category of the finding
 * @param subject channel or rule id the note is about
 * @param message human-readable detail
 */
public record SignalQualityNote(Kind kind, String subject, String message) {

    public enum Kind {
        MISSING_REQUIRED_CHANNEL,
        MALFORMED_RULE,
        NON_MONOTONIC_TIME,
        NO_VALID_DATA
    }
}
