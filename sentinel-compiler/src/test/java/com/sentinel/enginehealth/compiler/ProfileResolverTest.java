package com.sentinel.enginehealth.compiler;

import com.sentinel.enginehealth.api.IProfileStore;
import com.sentinel.enginehealth.api.ResolutionListener;
import com.sentinel.enginehealth.api.exceptions.CircularInheritanceException;
import com.sentinel.enginehealth.api.exceptions.InvalidThresholdValueException;
import com.sentinel.enginehealth.api.exceptions.ProfileNotFoundException;
import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.api.model.ResolvedProfile;
import com.sentinel.enginehealth.api.model.Rule;
import com.sentinel.enginehealth.api.model.Severity;
import com.sentinel.enginehealth.api.model.ThresholdTree;
import com.sentinel.enginehealth.compiler.store.InMemoryProfileStore;
import com.sentinel.enginehealth.infra.cache.CaffeineResolvedProfileCache;
import com.sentinel.enginehealth.infra.cache.NoOpResolvedProfileCache;
import com.sentinel.enginehealth.infra.cache.ProfileCacheConfig;
import com.sentinel.enginehealth.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProfileResolverTest {

    private InMemoryMetricsRegistry metrics;
    private ProfileResolver resolver;

    @BeforeEach
    void setUp() {
        metrics = new InMemoryMetricsRegistry();
        resolver = new ProfileResolver(new NoOpResolvedProfileCache(), metrics, true);
        resolver.setTracer(OpenTelemetry.noop().getTracer("test"));
    }

    @Nested
    @DisplayName("Chain walking")
    class ChainWalking {

        @Test
        @DisplayName("Should return a root profile unchanged with a single-element chain")
        void shouldResolveRootUnchanged() {
            // Given
            Profile root = TestProfiles.globalDefaults();
            IProfileStore store = InMemoryProfileStore.of(root);

            // When
            ResolvedProfile resolved = resolver.resolve("global-defaults", store);

            // Then
            assertThat(resolved.inheritanceChain()).containsExactly("global-defaults");
            assertThat(resolved.thresholds()).isEqualTo(root.thresholds());
            assertThat(resolved.rules()).isEqualTo(root.rules());
        }

        @Test
        @DisplayName("Should list the chain root first")
        void shouldListChainRootFirst() {
            ResolvedProfile resolved = resolver.resolve("size-y", TestProfiles.store());

            assertThat(resolved.inheritanceChain()).containsExactly("global-defaults", "family-x", "size-y");
            assertThat(resolved.profileId()).isEqualTo("size-y");
        }

        @Test
        @DisplayName("Should fail with the cycle listed from its first occurrence")
        void shouldDetectTransitiveCycle() {
            // Given a -> b -> c -> a
            IProfileStore store = InMemoryProfileStore.of(
                    Profile.of("a", "b", null, null),
                    Profile.of("b", "c", null, null),
                    Profile.of("c", "a", null, null));

            // When
            CircularInheritanceException error = catchThrowableOfType(
                    () -> resolver.resolve("a", store), CircularInheritanceException.class);

            // Then
            assertThat(error.getCycle()).containsExactly("a", "b", "c", "a");
            assertThat(error).hasMessageContaining("a -> b -> c -> a");
        }

        @Test
        @DisplayName("Should report a cycle that does not include the leaf")
        void shouldDetectCycleAboveLeaf() {
            IProfileStore store = InMemoryProfileStore.of(
                    Profile.of("leaf", "b", null, null),
                    Profile.of("b", "c", null, null),
                    Profile.of("c", "b", null, null));

            assertThatThrownBy(() -> resolver.resolve("leaf", store))
                    .isInstanceOfSatisfying(CircularInheritanceException.class,
                            e -> assertThat(e.getCycle()).containsExactly("b", "c", "b"));
        }

        @Test
        @DisplayName("Should detect a profile that is its own parent")
        void shouldDetectSelfParent() {
            IProfileStore store = InMemoryProfileStore.of(Profile.of("loop", "loop", null, null));

            assertThatThrownBy(() -> resolver.resolve("loop", store))
                    .isInstanceOfSatisfying(CircularInheritanceException.class,
                            e -> assertThat(e.getCycle()).containsExactly("loop", "loop"));
        }

        @Test
        @DisplayName("Should fail when a parent is missing")
        void shouldFailOnMissingParent() {
            IProfileStore store = InMemoryProfileStore.of(Profile.of("orphan", "ghost", null, null));

            assertThatThrownBy(() -> resolver.resolve("orphan", store))
                    .isInstanceOfSatisfying(ProfileNotFoundException.class, e -> {
                        assertThat(e.getProfileId()).isEqualTo("ghost");
                        assertThat(e.getRequestedProfileId()).isEqualTo("orphan");
                    });
            assertThat(metrics.getCounterValue(ProfileResolver.METRIC_FAILURES,
                    "reason", "ProfileNotFoundException")).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fail when the leaf itself is missing")
        void shouldFailOnMissingLeaf() {
            assertThatThrownBy(() -> resolver.resolve("nope", TestProfiles.store()))
                    .isInstanceOf(ProfileNotFoundException.class)
                    .hasMessage("Profile not found: nope");
        }
    }

    @Nested
    @DisplayName("Merging")
    class Merging {

        @Test
        @DisplayName("Should merge oil pressure bands across the chain")
        void shouldMergeEndToEndExample() {
            ResolvedProfile resolved = resolver.resolve("size-y", TestProfiles.store());

            assertThat(resolved.thresholds().find("oilPressure").orElseThrow().toPlain())
                    .isEqualTo(Map.of("warning", Map.of("min", 20.0), "critical", Map.of("min", 10.0)));
        }

        @Test
        @DisplayName("Root-only keys survive and leaf values win")
        void shouldKeepRootKeysAndPreferLeafValues() {
            // Given C (root) <- B <- A
            IProfileStore store = InMemoryProfileStore.of(
                    Profile.of("c", null, ThresholdTree.fromMap(Map.of("onlyInC", 1, "shared", 1)), List.of()),
                    Profile.of("b", "c", ThresholdTree.fromMap(Map.of("inB", 2)), List.of()),
                    Profile.of("a", "b", ThresholdTree.fromMap(Map.of("shared", 3)), List.of()));

            // When
            ResolvedProfile resolved = resolver.resolve("a", store);

            // Then
            assertThat(resolved.thresholds().numberAt("onlyInC")).hasValue(1.0);
            assertThat(resolved.thresholds().numberAt("shared")).hasValue(3.0);
            assertThat(resolved.thresholds().numberAt("inB")).hasValue(2.0);
        }

        @Test
        @DisplayName("Should take the leaf's rule whole without carrying ancestor fields")
        void shouldReplaceRulesWhole() {
            ResolvedProfile resolved = resolver.resolve("size-y", TestProfiles.store());

            Rule lowOil = resolved.rule("low-oil").orElseThrow();
            assertThat(lowOil).isEqualTo(TestProfiles.familyX().rules().get(0));
            assertThat(lowOil.triggerPersistenceSec()).isZero();
            assertThat(lowOil.severity()).isEqualTo(Severity.CRITICAL);
            assertThat(resolved.rules()).extracting(Rule::id)
                    .containsExactly("low-oil", "low-battery", "hot-coolant");
            assertThat(resolved.ruleSources())
                    .containsEntry("low-oil", "family-x")
                    .containsEntry("low-battery", "global-defaults")
                    .containsEntry("hot-coolant", "size-y");
        }

        @Test
        @DisplayName("Should produce equal results for repeated resolutions")
        void shouldBeDeterministic() {
            InMemoryProfileStore store = TestProfiles.store();

            ResolvedProfile first = resolver.resolve("size-y", store);
            ResolvedProfile second = resolver.resolve("size-y", store);

            assertThat(second).isEqualTo(first);
            assertThat(second.toMap()).isEqualTo(first.toMap());
        }

        @Test
        @DisplayName("Should expose a plain nested-map form")
        void shouldExposePlainMap() {
            Map<String, Object> plain = resolver.resolve("size-y", TestProfiles.store()).toMap();

            assertThat(plain).containsEntry("profileId", "size-y");
            assertThat(plain.get("inheritanceChain")).isEqualTo(List.of("global-defaults", "family-x", "size-y"));
            assertThat(plain.get("anomalyRules")).asList().hasSize(3);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        private final IProfileStore invalidStore = InMemoryProfileStore.of(
                Profile.of("root", null, ThresholdTree.fromMap(Map.of(
                        "oilPressure", Map.of("warning", Map.of("min", 10), "critical", Map.of("min", 15)))),
                        List.of()));

        @Test
        @DisplayName("Strict mode should reject crossed bands")
        void strictModeShouldReject() {
            assertThatThrownBy(() -> resolver.resolve("root", invalidStore))
                    .isInstanceOf(InvalidThresholdValueException.class)
                    .hasMessageContaining("critical.min (15) must be less than warning.min (10)");
        }

        @Test
        @DisplayName("Lenient mode should keep errors as warnings")
        void lenientModeShouldWarn() {
            ProfileResolver lenient = new ProfileResolver(new NoOpResolvedProfileCache(), metrics, false);

            ResolvedProfile resolved = lenient.resolve("root", invalidStore);

            assertThat(resolved.warnings()).anyMatch(w -> w.contains("critical.min"));
        }
    }

    @Test
    @DisplayName("Should resolve through the injected cache only once")
    void shouldUseInjectedCache() {
        // Given
        IProfileStore store = mock(IProfileStore.class);
        when(store.getProfile(anyString())).thenReturn(Optional.empty());
        when(store.getProfile("global-defaults")).thenReturn(Optional.of(TestProfiles.globalDefaults()));
        ProfileResolver cached = new ProfileResolver(
                new CaffeineResolvedProfileCache(ProfileCacheConfig.forProduction()), metrics, true);

        // When
        ResolvedProfile first = cached.resolve("global-defaults", store);
        ResolvedProfile second = cached.resolve("global-defaults", store);

        // Then
        assertThat(second).isSameAs(first);
        verify(store, times(1)).getProfile("global-defaults");
        assertThat(metrics.getCounterValue(ProfileResolver.METRIC_RESOLUTIONS)).isEqualTo(2);
    }

    @Test
    @DisplayName("Should notify the listener of every stage in order")
    void shouldNotifyListener() {
        List<String> stages = new ArrayList<>();
        resolver.setResolutionListener((profileId, result) -> stages.add(result.stageName()));

        resolver.resolve("size-y", TestProfiles.store());

        assertThat(stages).containsExactly("CHAIN_WALK", "THRESHOLD_MERGE", "RULE_MERGE", "VALIDATION");
    }

    @Test
    @DisplayName("Should report the failing stage to the listener")
    void shouldReportErrorStage() {
        List<String> failed = new ArrayList<>();
        resolver.setResolutionListener(new ResolutionListener() {
            @Override
            public void onStageComplete(String profileId, StageResult result) {
            }

            @Override
            public void onError(String profileId, String stageName, Exception error) {
                failed.add(stageName);
            }
        });

        assertThatThrownBy(() -> resolver.resolve("missing", TestProfiles.store()))
                .isInstanceOf(ProfileNotFoundException.class);
        assertThat(failed).containsExactly("CHAIN_WALK");
    }

    @Test
    @DisplayName("Should record a span with resolution attributes")
    void shouldRecordSpan() {
        // Given
        InMemorySpanExporter exporter = InMemorySpanExporter.create();
        SdkTracerProvider provider = SdkTracerProvider.builder()
                .addSpanProcessor(SimpleSpanProcessor.create(exporter))
                .build();
        resolver.setTracer(provider.get("test"));

        // When
        resolver.resolve("size-y", TestProfiles.store());
        assertThatThrownBy(() -> resolver.resolve("missing", TestProfiles.store()))
                .isInstanceOf(ProfileNotFoundException.class);

        // Then
        List<SpanData> spans = exporter.getFinishedSpanItems();
        assertThat(spans).hasSize(2);
        assertThat(spans.get(0).getName()).isEqualTo("resolve-profile");
        assertThat(spans.get(0).getAttributes().get(AttributeKey.stringKey("profileId"))).isEqualTo("size-y");
        assertThat(spans.get(0).getAttributes().get(AttributeKey.longKey("chainLength"))).isEqualTo(3L);
        assertThat(spans.get(1).getStatus().getStatusCode()).isEqualTo(StatusCode.ERROR);
        provider.close();
    }
}
