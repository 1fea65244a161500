/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.analysis;

import com.sentinel.enginehealth.api.IRecordingAnalyzer;
import com.sentinel.enginehealth.api.model.AlertEvent;
import com.sentinel.enginehealth.api.model.AlertSummary;
import com.sentinel.enginehealth.api.model.AnalysisResult;
import com.sentinel.enginehealth.api.model.ChannelStatistics;
import com.sentinel.enginehealth.api.model.OperatingStats;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.ResolvedProfile;
import com.sentinel.enginehealth.api.model.SignalQualityNote;
import com.sentinel.enginehealth.api.model.TimeInState;
import com.sentinel.enginehealth.infra.config.AnalysisSettings;
import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.runtime.alerts.AlertFormatter;
import com.sentinel.enginehealth.runtime.alerts.AlertSummarizer;
import com.sentinel.enginehealth.runtime.alerts.HealthScoreCalculator;
import com.sentinel.enginehealth.runtime.rules.RuleEngine;
import com.sentinel.enginehealth.runtime.rules.RuleEngineResult;
import com.sentinel.enginehealth.runtime.state.EngineStateClassifier;
import com.sentinel.enginehealth.runtime.state.EngineStateTimeline;
import com.sentinel.enginehealth.runtime.stats.OperatingStatsCalculator;
import com.sentinel.enginehealth.runtime.stats.StatisticsAggregator;
import com.sentinel.enginehealth.runtime.stats.TimeInStateCalculator;
import com.sentinel.enginehealth.runtime.thresholds.ThresholdMonitor;
import com.sentinel.enginehealth.runtime.validity.ValidityMask;
import com.sentinel.enginehealth.runtime.validity.ValidityMasker;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Full analysis of one recording against a resolved profile.
 *
 * <h2>Pipeline</h2>
 * <ol>
 * <li>Classify engine state (skipping non-increasing timestamps).</li>
 * <li>Mask channel validity by policy.</li>
 * <li>Run the profile's rules and, unless disabled, its threshold limits; format the alerts.</li>
 * <li>Channel statistics, time-in-state, operating statistics and health score.</li>
 * </ol>
 *
 * <h2>Thread Safety</h2>
 * <p>Every run keeps its state on the stack, so one instance can analyze many
 * recordings concurrently.
 */
public class RecordingAnalyzer implements IRecordingAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(RecordingAnalyzer.class);

    static final String METRIC_ANALYSIS_DURATION = "sentinel_analysis_duration";

    private final AnalysisSettings settings;
    private final MetricsRegistry metrics;
    private final EngineStateClassifier classifier;
    private final ValidityMasker masker;
    private final RuleEngine ruleEngine;
    private final ThresholdMonitor thresholdMonitor;
    private final StatisticsAggregator statistics = new StatisticsAggregator();
    private final TimeInStateCalculator timeInState;
    private final OperatingStatsCalculator operatingStats;
    private Tracer tracer = OpenTelemetry.noop().getTracer("sentinel-evaluator");

    public RecordingAnalyzer() {
        this(AnalysisSettings.loadDefault(), MetricsRegistry.getInstance());
    }

    public RecordingAnalyzer(AnalysisSettings settings, MetricsRegistry metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.classifier = new EngineStateClassifier(settings.getEngineState());
        this.masker = new ValidityMasker(settings::policyFor);
        this.ruleEngine = new RuleEngine(settings.getEngineState(), metrics);
        this.thresholdMonitor = new ThresholdMonitor(settings.getEngineState(), metrics);
        this.timeInState = new TimeInStateCalculator(settings.getStaleThresholdSeconds());
        this.operatingStats = new OperatingStatsCalculator(settings);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public AnalysisResult analyze(Recording recording, ResolvedProfile profile) {
        Objects.requireNonNull(recording, "recording");
        Objects.requireNonNull(profile, "profile");

        long start = System.nanoTime();
        Span span = tracer.spanBuilder("analyze-recording").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("recordingId", String.valueOf(recording.id()));
            span.setAttribute("profileId", profile.profileId());
            span.setAttribute("sampleCount", recording.size());

            AnalysisResult result = runPipeline(recording, profile);

            span.setAttribute("alertCount", result.alerts().size());
            span.setAttribute("healthScore", result.healthScore());
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
        } finally {
            span.end();
            metrics.timer(METRIC_ANALYSIS_DURATION).recordNanos(System.nanoTime() - start);
        }
    }

    private AnalysisResult runPipeline(Recording recording, ResolvedProfile profile) {
        EngineStateTimeline timeline = classifier.classify(recording);
        ValidityMask mask = masker.mask(recording, timeline);
        List<SignalQualityNote> notes = new ArrayList<>(timeline.notes());

        RuleEngineResult rules = ruleEngine.run(profile.rules(), recording, timeline, mask);
        notes.addAll(rules.notes());
        List<AlertEvent> alerts = new ArrayList<>(rules.alerts());
        if (settings.isThresholdAlertsEnabled()) {
            alerts.addAll(thresholdMonitor.run(profile.thresholds(), recording, timeline, mask));
            alerts.sort(Comparator.comparingDouble(AlertEvent::onsetTime));
        }
        List<String> messages = new ArrayList<>(alerts.size());
        for (AlertEvent alert : alerts) {
            messages.add(alert.breach() != null
                    ? AlertFormatter.format(alert)
                    : AlertFormatter.format(alert, rules.rule(alert.ruleId()).orElse(null)));
        }

        Map<String, ChannelStatistics> channelStats = statistics.aggregate(recording, timeline, mask);
        channelStats.values().stream()
                .filter(s -> s.noValidData() && s.totalCount() > 0)
                .forEach(s -> notes.add(new SignalQualityNote(SignalQualityNote.Kind.NO_VALID_DATA, s.channel(),
                        "No sample of " + s.channel() + " is valid under " + s.policy())));

        Map<String, TimeInState> dwell = new LinkedHashMap<>();
        for (String channel : settings.getTimeInStateChannels()) {
            if (recording.hasChannel(channel)) {
                dwell.put(channel, timeInState.forChannel(recording, channel, timeline, mask));
            }
        }
        TimeInState engineStateTime = timeInState.forEngineState(recording, timeline);

        OperatingStats operating = operatingStats.calculate(recording, timeline);
        AlertSummary summary = AlertSummarizer.summarize(alerts, recording.endTime());
        int healthScore = HealthScoreCalculator.score(summary, operating);

        logger.info("Analyzed recording {} with profile {}: {} samples, {} alerts, health {}",
                recording.id(), profile.profileId(), recording.size(), alerts.size(), healthScore);
        return new AnalysisResult(recording.id(), profile.profileId(), timeline.states(), alerts,
                messages, summary, channelStats, engineStateTime, dwell, operating, healthScore, notes);
    }
}
