/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.sentinel.enginehealth.api.IResolvedProfileCache;
import com.sentinel.enginehealth.api.model.ResolvedProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Caffeine-backed resolved-profile cache with time-to-live expiry.
 *
 * <p>{@link #getOrResolve} runs through {@link Cache#get(Object, Function)}, which
 * computes atomically per key, so concurrent callers for one profile id share a
 * single resolution. A {@link Ticker} can be injected to drive expiry in tests.
 */
public final class CaffeineResolvedProfileCache implements IResolvedProfileCache {

    private static final Logger logger = LoggerFactory.getLogger(CaffeineResolvedProfileCache.class);

    private final Cache<String, ResolvedProfile> cache;

    public CaffeineResolvedProfileCache(ProfileCacheConfig config) {
        this(config, Ticker.systemTicker());
    }

    public CaffeineResolvedProfileCache(ProfileCacheConfig config, Ticker ticker) {
        Objects.requireNonNull(config, "config");
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(config.getMaxSize())
                .expireAfterWrite(config.getTtl())
                .ticker(ticker);
        if (config.isRecordStats()) {
            builder.recordStats();
        }
        this.cache = builder.build();
        logger.debug("Created resolved-profile cache: {}", config);
    }

    @Override
    public Optional<ResolvedProfile> get(String profileId) {
        return Optional.ofNullable(cache.getIfPresent(profileId));
    }

    @Override
    public ResolvedProfile getOrResolve(String profileId, Function<String, ResolvedProfile> resolver) {
        return cache.get(profileId, resolver);
    }

    @Override
    public void invalidate(String profileId) {
        List<String> stale = cache.asMap().entrySet().stream()
                .filter(e -> e.getKey().equals(profileId) || e.getValue().inheritsFrom(profileId))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        cache.invalidateAll(stale);
        logger.debug("Invalidated {} cached profile(s) depending on {}", stale.size(), profileId);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public CacheStats stats() {
        return cache.stats();
    }
}
