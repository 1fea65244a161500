package com.sentinel.enginehealth.infra.config;

import com.sentinel.enginehealth.api.model.ChannelPolicy;
import com.sentinel.enginehealth.api.model.ValidityPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisSettingsTest {

    @Test
    @DisplayName("Defaults should match the classifier's documented thresholds")
    void shouldProvideDefaults() {
        AnalysisSettings settings = AnalysisSettings.defaults();

        assertThat(settings.getEngineState().rpmRunningThreshold()).isEqualTo(500);
        assertThat(settings.getEngineState().rpmStableThreshold()).isEqualTo(800);
        assertThat(settings.getEngineState().debounceSamples()).isEqualTo(3);
        assertThat(settings.getEngineState().stableHoldoffSeconds()).isEqualTo(2.0);
        assertThat(settings.getStaleThresholdSeconds()).isEqualTo(10.0);
        assertThat(settings.policyFor("unknown_channel")).isEqualTo(ChannelPolicy.ALWAYS);
        assertThat(settings.policyFor("OILP_press").statsPolicy()).isEqualTo(ValidityPolicy.VALID_WHEN_STABLE);
        assertThat(settings.isThresholdAlertsEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should read scalar and policy properties")
    void shouldReadProperties() {
        // Given
        Properties props = new Properties();
        props.setProperty("engine.rpm.running.threshold", "450");
        props.setProperty("engine.debounce.samples", "5");
        props.setProperty("analysis.time.in.state.channels", "gov_type, sync_state");
        props.setProperty("policy.fuel_press", "VALID_WHEN_RUNNING,ALWAYS_VALID,excludeZero");

        // When
        AnalysisSettings settings = AnalysisSettings.fromProperties(props, key -> null);

        // Then
        assertThat(settings.getEngineState().rpmRunningThreshold()).isEqualTo(450);
        assertThat(settings.getEngineState().debounceSamples()).isEqualTo(5);
        assertThat(settings.getTimeInStateChannels()).containsExactly("gov_type", "sync_state");
        assertThat(settings.policyFor("fuel_press")).isEqualTo(new ChannelPolicy(
                ValidityPolicy.VALID_WHEN_RUNNING, ValidityPolicy.ALWAYS_VALID, true, false));
    }

    @Test
    @DisplayName("Environment variables should win over properties")
    void environmentShouldWin() {
        Properties props = new Properties();
        props.setProperty("engine.startup.grace.seconds", "3");
        props.setProperty("analysis.threshold.alerts.enabled", "true");
        Map<String, String> env = Map.of(
                "SENTINEL_ENGINE_STARTUP_GRACE_SECONDS", "1.5",
                "SENTINEL_ANALYSIS_THRESHOLD_ALERTS_ENABLED", "false");

        AnalysisSettings settings = AnalysisSettings.fromProperties(props, env::get);

        assertThat(settings.getEngineState().startupGraceSeconds()).isEqualTo(1.5);
        assertThat(settings.isThresholdAlertsEnabled()).isFalse();
        assertThat(AnalysisSettings.envName("engine.rpm.channel")).isEqualTo("SENTINEL_ENGINE_RPM_CHANNEL");
    }

    @Test
    @DisplayName("Should fall back to defaults for inconsistent engine thresholds")
    void shouldFallBackOnInvalidEngineSettings() {
        Properties props = new Properties();
        props.setProperty("engine.rpm.stable.threshold", "100");

        AnalysisSettings settings = AnalysisSettings.fromProperties(props, key -> null);

        assertThat(settings.getEngineState().rpmStableThreshold()).isEqualTo(800);
    }

    @Test
    @DisplayName("Should load the bundled sentinel.properties")
    void shouldLoadBundledProperties() {
        AnalysisSettings settings = AnalysisSettings.fromProperties(
                AnalysisSettings.readProperties(AnalysisSettings.DEFAULT_PROPERTIES), key -> null);

        assertThat(settings.getEngineState().vswChannel()).isEqualTo("Vsw");
        assertThat(settings.getTimeInStateChannels()).contains("gov_sw_state");
    }

    @Test
    @DisplayName("Should reject a policy without both validity policies")
    void shouldRejectIncompletePolicy() {
        assertThatThrownBy(() -> AnalysisSettings.parsePolicy("ALWAYS_VALID"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("STATS_POLICY");
    }
}
