/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.infra.cache;

import com.sentinel.enginehealth.api.IResolvedProfileCache;

/**
 * Creates the cache implementation selected by {@link ProfileCacheConfig#getCacheType()}.
 */
public final class ResolvedProfileCacheFactory {

    private ResolvedProfileCacheFactory() {
    }

    public static IResolvedProfileCache create(ProfileCacheConfig config) {
        return switch (config.getCacheType()) {
            case CAFFEINE -> new CaffeineResolvedProfileCache(config);
            case NO_OP -> new NoOpResolvedProfileCache();
        };
    }
}
