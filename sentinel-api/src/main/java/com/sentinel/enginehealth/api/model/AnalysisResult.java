/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything produced by one recording analysis.
 */
public record AnalysisResult(
        String recordingId,
        String profileId,
        List<EngineState> engineStates,
        List<AlertEvent> alerts,
        List<String> messages,
        AlertSummary summary,
        Map<String, ChannelStatistics> channelStatistics,
        TimeInState engineStateTime,
        Map<String, TimeInState> timeInState,
        OperatingStats operatingStats,
        int healthScore,
        List<SignalQualityNote> notes) {

    public AnalysisResult {
        engineStates = List.copyOf(engineStates);
        alerts = List.copyOf(alerts);
        messages = List.copyOf(messages);
        channelStatistics = Collections.unmodifiableMap(new LinkedHashMap<>(channelStatistics));
        timeInState = Collections.unmodifiableMap(new LinkedHashMap<>(timeInState));
        notes = List.copyOf(notes);
    }
}
