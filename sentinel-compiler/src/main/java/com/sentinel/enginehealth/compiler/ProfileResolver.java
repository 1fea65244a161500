/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.compiler;

import com.sentinel.enginehealth.api.IProfileResolver;
import com.sentinel.enginehealth.api.IProfileStore;
import com.sentinel.enginehealth.api.IResolvedProfileCache;
import com.sentinel.enginehealth.api.ResolutionListener;
import com.sentinel.enginehealth.api.exceptions.CircularInheritanceException;
import com.sentinel.enginehealth.api.exceptions.InvalidThresholdValueException;
import com.sentinel.enginehealth.api.exceptions.ProfileNotFoundException;
import com.sentinel.enginehealth.api.exceptions.SentinelException;
import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.api.model.ResolvedProfile;
import com.sentinel.enginehealth.api.model.ThresholdTree;
import com.sentinel.enginehealth.compiler.validation.ThresholdValidator;
import com.sentinel.enginehealth.compiler.validation.ValidationReport;
import com.sentinel.enginehealth.infra.cache.NoOpResolvedProfileCache;
import com.sentinel.enginehealth.infra.metrics.MetricsRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves a leaf profile by walking its parent chain and merging it root to leaf.
 *
 * <h2>Usage</h2>
 * <pre>
 * IProfileResolver resolver = new ProfileResolver(cache, MetricsRegistry.getInstance(), true);
 * ResolvedProfile resolved = resolver.resolve("size-y", store);
 * resolved.inheritanceChain(); // [global-defaults, family-x, size-y]
 * </pre>
 *
 * <p>Resolution is deterministic: the same leaf against an unchanged store yields an
 * equal {@link ResolvedProfile}, which is what makes the injected cache safe.
 * Missing profiles and cycles always propagate to the caller; no fallback profile is
 * substituted.
 */
public class ProfileResolver implements IProfileResolver {

    private static final Logger logger = LoggerFactory.getLogger(ProfileResolver.class);

    static final String METRIC_RESOLUTIONS = "sentinel_profile_resolutions_total";
    static final String METRIC_FAILURES = "sentinel_profile_resolution_failures_total";

    private final IResolvedProfileCache cache;
    private final MetricsRegistry metrics;
    private final ThresholdValidator validator = new ThresholdValidator();
    private final boolean strictValidation;
    private Tracer tracer = GlobalOpenTelemetry.getTracer("sentinel-compiler");
    private ResolutionListener listener;

    public ProfileResolver() {
        this(new NoOpResolvedProfileCache(), MetricsRegistry.getInstance(), true);
    }

    /**
     * @param cache            cache owned by the caller; use {@link NoOpResolvedProfileCache} to disable
     * @param metrics          metrics registry
     * @param strictValidation when set, threshold validation errors fail the resolution
     */
    public ProfileResolver(IResolvedProfileCache cache, MetricsRegistry metrics, boolean strictValidation) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.strictValidation = strictValidation;
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setResolutionListener(ResolutionListener listener) {
        this.listener = listener;
    }

    @Override
    public ResolvedProfile resolve(String leafProfileId, IProfileStore store) {
        Objects.requireNonNull(leafProfileId, "leafProfileId");
        Objects.requireNonNull(store, "store");

        Span span = tracer.spanBuilder("resolve-profile").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("profileId", leafProfileId);
            ResolvedProfile resolved = cache.getOrResolve(leafProfileId, id -> resolveUncached(id, store));
            span.setAttribute("chainLength", resolved.inheritanceChain().size());
            span.setAttribute("ruleCount", resolved.rules().size());
            metrics.counter(METRIC_RESOLUTIONS).increment();
            return resolved;
        } catch (SentinelException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            metrics.counter(METRIC_FAILURES, "reason", e.getClass().getSimpleName()).increment();
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Builds the chain from the leaf up to the root, leaf first.
     *
     * @throws ProfileNotFoundException     if an id in the chain is missing
     * @throws CircularInheritanceException if an id repeats
     */
    public static List<Profile> ancestorChain(String leafProfileId, IProfileStore store) {
        Map<String, Profile> visited = new LinkedHashMap<>();
        String currentId = leafProfileId;
        while (currentId != null) {
            if (visited.containsKey(currentId)) {
                List<String> order = new ArrayList<>(visited.keySet());
                List<String> cycle = new ArrayList<>(order.subList(order.indexOf(currentId), order.size()));
                cycle.add(currentId);
                throw new CircularInheritanceException(cycle);
            }
            String id = currentId;
            Profile profile = store.getProfile(id)
                    .orElseThrow(() -> new ProfileNotFoundException(id, leafProfileId));
            visited.put(id, profile);
            currentId = profile.parentId();
        }
        return new ArrayList<>(visited.values());
    }

    private ResolvedProfile resolveUncached(String leafProfileId, IProfileStore store) {
        String stage = "CHAIN_WALK";
        try {
            long start = System.nanoTime();
            List<Profile> chain = ancestorChain(leafProfileId, store);
            Collections.reverse(chain);
            List<String> chainIds = chain.stream().map(Profile::id).toList();
            notifyStage(leafProfileId, stage, start, Map.of("chainLength", chain.size()));

            stage = "THRESHOLD_MERGE";
            start = System.nanoTime();
            ThresholdTree.Node thresholds = ThresholdMerger.mergeAll(
                    chain.stream().map(Profile::thresholds).toList());
            notifyStage(leafProfileId, stage, start, Map.of("channelCount", thresholds.children().size()));

            stage = "RULE_MERGE";
            start = System.nanoTime();
            RuleMerger rules = new RuleMerger();
            chain.forEach(rules::apply);
            notifyStage(leafProfileId, stage, start, Map.of("ruleCount", rules.rules().size()));

            stage = "VALIDATION";
            start = System.nanoTime();
            ValidationReport report = validator.validate(thresholds);
            List<String> warnings = new ArrayList<>(report.warnings());
            if (!report.isValid()) {
                if (strictValidation) {
                    throw new InvalidThresholdValueException(leafProfileId, report.errors());
                }
                logger.warn("Profile {} has invalid thresholds: {}", leafProfileId, report.errors());
                warnings.addAll(report.errors());
            }
            notifyStage(leafProfileId, stage, start, Map.of(
                    "errors", report.errors().size(), "warnings", report.warnings().size()));

            Profile leaf = chain.get(chain.size() - 1);
            logger.debug("Resolved profile {} through chain {}", leafProfileId, chainIds);
            return new ResolvedProfile(leaf.id(), leaf.name(), leaf.description(), leaf.metadata(),
                    chainIds, thresholds, rules.rules(), rules.sources(), warnings);
        } catch (SentinelException e) {
            if (listener != null) {
                listener.onError(leafProfileId, stage, e);
            }
            throw e;
        }
    }

    private void notifyStage(String profileId, String stage, long startNanos, Map<String, Object> stageMetrics) {
        if (listener != null) {
            listener.onStageComplete(profileId,
                    new ResolutionListener.StageResult(stage, System.nanoTime() - startNanos, stageMetrics));
        }
    }
}
