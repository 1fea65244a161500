/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api;

import com.sentinel.enginehealth.api.model.AnalysisResult;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.ResolvedProfile;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for analyzing one recording against a resolved profile.
 */
public interface IRecordingAnalyzer {

    /**
     * Runs engine-state classification, rule evaluation and statistics over the recording.
     * Problems with single rules or channels are reported in {@link AnalysisResult#notes()}.
     */
    AnalysisResult analyze(Recording recording, ResolvedProfile profile);

    default void setTracer(Tracer tracer) {
    }
}
