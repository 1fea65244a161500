/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.runtime.rules;

import com.sentinel.enginehealth.api.exceptions.MalformedRuleException;
import com.sentinel.enginehealth.api.model.AlertEvent;
import com.sentinel.enginehealth.api.model.EngineStateConfig;
import com.sentinel.enginehealth.api.model.Recording;
import com.sentinel.enginehealth.api.model.Rule;
import com.sentinel.enginehealth.api.model.SignalQualityNote;
import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import com.sentinel.enginehealth.runtime.condition.ConditionEvaluator;
import com.sentinel.enginehealth.runtime.condition.EngineStatePredicate;
import com.sentinel.enginehealth.runtime.condition.SampleFrame;
import com.sentinel.enginehealth.runtime.state.EngineStateTimeline;
import com.sentinel.enginehealth.runtime.validity.ValidityMask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs every enabled rule of a profile over a classified recording.
 *
 * <h2>Per sample, per rule</h2>
 * <ol>
 * <li>Gating: any true {@code ignoreWhen} or false {@code requireWhen} forces the base
 * condition false.</li>
 * <li>Suppression: the startup grace window and the rule's start/stop delays do the same.</li>
 * <li>Base condition, then the trigger/clear state machine.</li>
 * </ol>
 *
 * <p>A rule that reads a parameter which is neither an engine-state predicate nor a channel
 * of the recording is skipped with a warning; the other rules still run. Skipped samples
 * (non-increasing time) are not fed to any rule.
 */
public class RuleEngine {

    private static final Logger logger = LoggerFactory.getLogger(RuleEngine.class);

    static final String METRIC_RULES_SKIPPED = "sentinel_rules_skipped_total";
    static final String METRIC_ALERTS = "sentinel_alerts_total";

    private final ConditionEvaluator conditions = new ConditionEvaluator();
    private final EngineStateConfig engineConfig;
    private final MetricsRegistry metrics;

    public RuleEngine(EngineStateConfig engineConfig, MetricsRegistry metrics) {
        this.engineConfig = Objects.requireNonNull(engineConfig, "engineConfig");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public RuleEngineResult run(List<Rule> rules, Recording recording, EngineStateTimeline timeline,
                                ValidityMask mask) {
        Set<String> knownParams = new HashSet<>(recording.channels());
        knownParams.add(engineConfig.rpmChannel());
        knownParams.add(engineConfig.vswChannel());

        List<RuleRunner> runners = new ArrayList<>();
        Map<String, Rule> evaluated = new LinkedHashMap<>();
        List<SignalQualityNote> notes = new ArrayList<>();
        for (Rule rule : rules) {
            if (!rule.enabled()) {
                logger.debug("Rule {} is disabled", rule.id());
                continue;
            }
            try {
                runners.add(prepare(rule, knownParams));
                evaluated.put(rule.id(), rule);
            } catch (MalformedRuleException e) {
                logger.warn("Skipping rule {}: {}", rule.id(), e.getMessage());
                metrics.counter(METRIC_RULES_SKIPPED).increment();
                notes.add(new SignalQualityNote(SignalQualityNote.Kind.MALFORMED_RULE, rule.id(), e.getMessage()));
            }
        }

        for (int i = 0; i < recording.size(); i++) {
            if (!timeline.isAccepted(i)) {
                continue;
            }
            SampleFrame frame = new SampleFrame(i, recording.get(i), timeline.state(i),
                    timeline.isInStartupGrace(i), mask);
            for (RuleRunner runner : runners) {
                runner.step(frame, isSuppressed(runner.rule(), timeline, i, frame.time()));
            }
        }

        List<AlertEvent> alerts = new ArrayList<>();
        for (RuleRunner runner : runners) {
            alerts.addAll(runner.alerts());
        }
        alerts.sort(Comparator.comparingDouble(AlertEvent::onsetTime));
        for (AlertEvent alert : alerts) {
            metrics.counter(METRIC_ALERTS, "severity", alert.severity().name().toLowerCase(Locale.ROOT))
                    .increment();
        }
        logger.debug("Recording {}: {} rule(s) evaluated, {} alert(s)", recording.id(), runners.size(), alerts.size());
        return new RuleEngineResult(alerts, evaluated, notes);
    }

    private RuleRunner prepare(Rule rule, Set<String> knownParams) {
        for (String param : rule.referencedParameters()) {
            if (!EngineStatePredicate.isPredicate(param) && !knownParams.contains(param)) {
                throw new MalformedRuleException(rule.id(), "unknown condition parameter '" + param + "'");
            }
        }
        return new RuleRunner(rule, conditions);
    }

    private static boolean isSuppressed(Rule rule, EngineStateTimeline timeline, int index, double now) {
        if (timeline.isInStartupGrace(index)) {
            return true;
        }
        return within(timeline.lastStartAt(index), now, rule.startDelaySec())
                || within(timeline.lastStopAt(index), now, rule.stopDelaySec());
    }

    private static boolean within(double since, double now, double delay) {
        return delay > 0 && !Double.isNaN(since) && now - since < delay;
    }
}
