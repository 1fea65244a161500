/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.infra.config;

import com.sentinel.enginehealth.api.model.ChannelPolicy;
import com.sentinel.enginehealth.api.model.EngineStateConfig;
import com.sentinel.enginehealth.api.model.ValidityPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * Settings of one recording analysis: engine-state classifier timing, staleness,
 * operating-stat thresholds, categorical channels, channel validity policies and whether
 * profile thresholds raise alerts of their own.
 *
 * <p>Every scalar property can be overridden by an environment variable named
 * {@code SENTINEL_} plus the property key upper-cased with dots turned into
 * underscores, e.g. {@code engine.rpm.running.threshold} becomes
 * {@code SENTINEL_ENGINE_RPM_RUNNING_THRESHOLD}. Channel policies are set with
 * {@code policy.<channel>=STATS_POLICY,ALERT_POLICY[,excludeZero][,excludeNegative]}.
 */
public final class AnalysisSettings {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisSettings.class);

    public static final String DEFAULT_PROPERTIES = "sentinel.properties";

    static final String ENV_PREFIX = "SENTINEL_";
    static final String POLICY_PREFIX = "policy.";

    static final String RPM_CHANNEL = "engine.rpm.channel";
    static final String VSW_CHANNEL = "engine.vsw.channel";
    static final String VSW_ON_THRESHOLD = "engine.vsw.on.threshold";
    static final String RPM_CRANKING_THRESHOLD = "engine.rpm.cranking.threshold";
    static final String RPM_RUNNING_THRESHOLD = "engine.rpm.running.threshold";
    static final String RPM_STABLE_THRESHOLD = "engine.rpm.stable.threshold";
    static final String DEBOUNCE_SAMPLES = "engine.debounce.samples";
    static final String STABLE_HOLDOFF = "engine.stable.holdoff.seconds";
    static final String STOP_HOLDOFF = "engine.stop.holdoff.seconds";
    static final String KEY_OFF_DEBOUNCE = "engine.keyoff.debounce.seconds";
    static final String STARTUP_GRACE = "engine.startup.grace.seconds";
    static final String STALE_THRESHOLD = "analysis.stale.threshold.seconds";
    static final String RUNTIME_RPM = "analysis.runtime.rpm.threshold";
    static final String IDLE_RPM_CEILING = "analysis.idle.rpm.ceiling";
    static final String MAP_CHANNEL = "analysis.map.channel";
    static final String TIME_IN_STATE_CHANNELS = "analysis.time.in.state.channels";
    static final String THRESHOLD_ALERTS_ENABLED = "analysis.threshold.alerts.enabled";

    private static final List<String> SCALAR_KEYS = List.of(
            RPM_CHANNEL, VSW_CHANNEL, VSW_ON_THRESHOLD, RPM_CRANKING_THRESHOLD, RPM_RUNNING_THRESHOLD,
            RPM_STABLE_THRESHOLD, DEBOUNCE_SAMPLES, STABLE_HOLDOFF, STOP_HOLDOFF, KEY_OFF_DEBOUNCE,
            STARTUP_GRACE, STALE_THRESHOLD, RUNTIME_RPM, IDLE_RPM_CEILING, MAP_CHANNEL, TIME_IN_STATE_CHANNELS,
            THRESHOLD_ALERTS_ENABLED);

    /**
     * Policies of well-known channels. Channels not listed are always valid.
     */
    public static final Map<String, ChannelPolicy> DEFAULT_CHANNEL_POLICIES = defaultPolicies();

    public static final List<String> DEFAULT_TIME_IN_STATE_CHANNELS = List.of(
            "fuel_ctl_mode", "fuel_type", "MILout_mirror", "gov_sw_state",
            "gov_type", "sync_state", "fuel_shutoff_chk", "spark_shutoff_chk");

    private final EngineStateConfig engineState;
    private final double staleThresholdSeconds;
    private final double runtimeRpmThreshold;
    private final double idleRpmCeiling;
    private final String mapChannel;
    private final boolean thresholdAlertsEnabled;
    private final List<String> timeInStateChannels;
    private final Map<String, ChannelPolicy> channelPolicies;

    private AnalysisSettings(Builder builder) {
        this.engineState = builder.engineState;
        this.staleThresholdSeconds = builder.staleThresholdSeconds;
        this.runtimeRpmThreshold = builder.runtimeRpmThreshold;
        this.idleRpmCeiling = builder.idleRpmCeiling;
        this.mapChannel = builder.mapChannel;
        this.thresholdAlertsEnabled = builder.thresholdAlertsEnabled;
        this.timeInStateChannels = List.copyOf(builder.timeInStateChannels);
        this.channelPolicies = Collections.unmodifiableMap(new LinkedHashMap<>(builder.channelPolicies));
        if (staleThresholdSeconds <= 0) {
            throw new IllegalArgumentException("staleThresholdSeconds must be positive");
        }
        if (idleRpmCeiling < runtimeRpmThreshold) {
            throw new IllegalArgumentException("idleRpmCeiling must be >= runtimeRpmThreshold");
        }
    }

    public static AnalysisSettings defaults() {
        return builder().build();
    }

    public static AnalysisSettings loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads from the classpath first, then from the filesystem, then applies environment overrides.
     */
    public static AnalysisSettings loadFromProperties(String propertiesPath) {
        return fromProperties(readProperties(propertiesPath), System::getenv);
    }

    static AnalysisSettings fromProperties(Properties props, Function<String, String> env) {
        Properties merged = new Properties();
        merged.putAll(props);
        for (String key : SCALAR_KEYS) {
            String value = env.apply(envName(key));
            if (value != null && !value.isBlank()) {
                merged.setProperty(key, value.trim());
            }
        }

        EngineStateConfig base = EngineStateConfig.defaults();
        Builder builder = builder();
        try {
            builder.engineState(new EngineStateConfig(
                    merged.getProperty(RPM_CHANNEL, base.rpmChannel()).trim(),
                    merged.getProperty(VSW_CHANNEL, base.vswChannel()).trim(),
                    doubleProp(merged, VSW_ON_THRESHOLD, base.vswOnThreshold()),
                    doubleProp(merged, RPM_CRANKING_THRESHOLD, base.rpmCrankingThreshold()),
                    doubleProp(merged, RPM_RUNNING_THRESHOLD, base.rpmRunningThreshold()),
                    doubleProp(merged, RPM_STABLE_THRESHOLD, base.rpmStableThreshold()),
                    (int) doubleProp(merged, DEBOUNCE_SAMPLES, base.debounceSamples()),
                    doubleProp(merged, STABLE_HOLDOFF, base.stableHoldoffSeconds()),
                    doubleProp(merged, STOP_HOLDOFF, base.stopHoldoffSeconds()),
                    doubleProp(merged, KEY_OFF_DEBOUNCE, base.keyOffDebounceSeconds()),
                    doubleProp(merged, STARTUP_GRACE, base.startupGraceSeconds())));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid engine-state settings, using defaults: {}", e.getMessage());
        }
        builder.staleThresholdSeconds(doubleProp(merged, STALE_THRESHOLD, builder.staleThresholdSeconds));
        builder.runtimeRpmThreshold(doubleProp(merged, RUNTIME_RPM, builder.runtimeRpmThreshold));
        builder.idleRpmCeiling(doubleProp(merged, IDLE_RPM_CEILING, builder.idleRpmCeiling));
        builder.mapChannel(merged.getProperty(MAP_CHANNEL, builder.mapChannel).trim());
        String thresholdAlerts = merged.getProperty(THRESHOLD_ALERTS_ENABLED);
        if (thresholdAlerts != null) {
            builder.thresholdAlertsEnabled(Boolean.parseBoolean(thresholdAlerts.trim()));
        }

        String channels = merged.getProperty(TIME_IN_STATE_CHANNELS);
        if (channels != null) {
            builder.timeInStateChannels(splitList(channels));
        }

        for (String key : merged.stringPropertyNames()) {
            if (key.startsWith(POLICY_PREFIX)) {
                String channel = key.substring(POLICY_PREFIX.length());
                try {
                    builder.channelPolicy(channel, parsePolicy(merged.getProperty(key)));
                } catch (IllegalArgumentException e) {
                    logger.warn("Ignoring invalid policy for channel {}: {}", channel, e.getMessage());
                }
            }
        }
        return builder.build();
    }

    /**
     * Parses {@code STATS_POLICY,ALERT_POLICY[,excludeZero][,excludeNegative]}.
     */
    static ChannelPolicy parsePolicy(String value) {
        List<String> parts = splitList(value);
        if (parts.size() < 2) {
            throw new IllegalArgumentException("expected STATS_POLICY,ALERT_POLICY but got '" + value + "'");
        }
        ValidityPolicy stats = ValidityPolicy.valueOf(parts.get(0).toUpperCase(Locale.ROOT));
        ValidityPolicy alert = ValidityPolicy.valueOf(parts.get(1).toUpperCase(Locale.ROOT));
        List<String> flags = parts.subList(2, parts.size());
        return new ChannelPolicy(stats, alert,
                flags.stream().anyMatch("excludeZero"::equalsIgnoreCase),
                flags.stream().anyMatch("excludeNegative"::equalsIgnoreCase));
    }

    static String envName(String key) {
        return ENV_PREFIX + key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private static double doubleProp(Properties props, String key, double fallback) {
        String value = props.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid number for {}: {}", key, value);
            return fallback;
        }
    }

    private static List<String> splitList(String value) {
        List<String> parts = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                parts.add(part.trim());
            }
        }
        return parts;
    }

    static Properties readProperties(String propertiesPath) {
        Properties props = new Properties();
        try (InputStream is = AnalysisSettings.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} analysis properties from classpath: {}", props.size(), propertiesPath);
                return props;
            }
        } catch (IOException e) {
            logger.debug("Could not load {} from classpath", propertiesPath, e);
        }
        try (InputStream is = new FileInputStream(propertiesPath)) {
            props.load(is);
            logger.info("Loaded {} analysis properties from file: {}", props.size(), propertiesPath);
        } catch (IOException e) {
            logger.warn("Could not load analysis properties {}. Using defaults.", propertiesPath);
        }
        return props;
    }

    private static Map<String, ChannelPolicy> defaultPolicies() {
        Map<String, ChannelPolicy> policies = new LinkedHashMap<>();
        policies.put("Vbat", ChannelPolicy.ALWAYS);
        policies.put("Vsw", ChannelPolicy.ALWAYS);
        policies.put("rpm", ChannelPolicy.ALWAYS);
        policies.put("IAT", ChannelPolicy.of(ValidityPolicy.VALID_WHEN_KEY_ON));
        policies.put("ECT", ChannelPolicy.of(ValidityPolicy.VALID_WHEN_RUNNING));
        policies.put("MAP", new ChannelPolicy(
                ValidityPolicy.VALID_WHEN_RUNNING, ValidityPolicy.VALID_WHEN_RUNNING, true, false));
        policies.put("TIP", ChannelPolicy.of(ValidityPolicy.VALID_WHEN_RUNNING));
        policies.put("OILP_press", new ChannelPolicy(
                ValidityPolicy.VALID_WHEN_STABLE, ValidityPolicy.VALID_WHEN_STABLE, false, true));
        policies.put("eng_load", ChannelPolicy.of(ValidityPolicy.VALID_WHEN_RUNNING));
        return Collections.unmodifiableMap(policies);
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public EngineStateConfig getEngineState() {
        return engineState;
    }

    public double getStaleThresholdSeconds() {
        return staleThresholdSeconds;
    }

    public double getRuntimeRpmThreshold() {
        return runtimeRpmThreshold;
    }

    public double getIdleRpmCeiling() {
        return idleRpmCeiling;
    }

    public String getMapChannel() {
        return mapChannel;
    }

    public boolean isThresholdAlertsEnabled() {
        return thresholdAlertsEnabled;
    }

    public List<String> getTimeInStateChannels() {
        return timeInStateChannels;
    }

    public Map<String, ChannelPolicy> getChannelPolicies() {
        return channelPolicies;
    }

    /**
     * Policy of a channel, {@link ChannelPolicy#ALWAYS} when none is configured.
     */
    public ChannelPolicy policyFor(String channel) {
        return channelPolicies.getOrDefault(channel, ChannelPolicy.ALWAYS);
    }

    @Override
    public String toString() {
        return "AnalysisSettings{engineState=" + engineState
                + ", staleThresholdSeconds=" + staleThresholdSeconds
                + ", timeInStateChannels=" + timeInStateChannels
                + ", policies=" + channelPolicies.keySet() + "}";
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private EngineStateConfig engineState = EngineStateConfig.defaults();
        private double staleThresholdSeconds = 10.0;
        private double runtimeRpmThreshold = 550.0;
        private double idleRpmCeiling = 900.0;
        private String mapChannel = "MAP";
        private boolean thresholdAlertsEnabled = true;
        private List<String> timeInStateChannels = new ArrayList<>(DEFAULT_TIME_IN_STATE_CHANNELS);
        private final Map<String, ChannelPolicy> channelPolicies = new LinkedHashMap<>(DEFAULT_CHANNEL_POLICIES);

        private Builder() {
        }

        public Builder engineState(EngineStateConfig engineState) {
            this.engineState = engineState;
            return this;
        }

        public Builder staleThresholdSeconds(double seconds) {
            this.staleThresholdSeconds = seconds;
            return this;
        }

        public Builder runtimeRpmThreshold(double rpm) {
            this.runtimeRpmThreshold = rpm;
            return this;
        }

        public Builder idleRpmCeiling(double rpm) {
            this.idleRpmCeiling = rpm;
            return this;
        }

        public Builder thresholdAlertsEnabled(boolean enabled) {
            this.thresholdAlertsEnabled = enabled;
            return this;
        }

        public Builder mapChannel(String channel) {
            this.mapChannel = channel;
            return this;
        }

        public Builder timeInStateChannels(List<String> channels) {
            this.timeInStateChannels = new ArrayList<>(channels);
            return this;
        }

        public Builder timeInStateChannels(String... channels) {
            return timeInStateChannels(Arrays.asList(channels));
        }

        public Builder channelPolicy(String channel, ChannelPolicy policy) {
            this.channelPolicies.put(channel, policy);
            return this;
        }

        public Builder clearChannelPolicies() {
            this.channelPolicies.clear();
            return this;
        }

        public AnalysisSettings build() {
            return new AnalysisSettings(this);
        }
    }
}
