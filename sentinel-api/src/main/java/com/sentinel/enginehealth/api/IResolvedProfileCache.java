/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api;

import com.sentinel.enginehealth.api.model.ResolvedProfile;

import java.util.Optional;
import java.util.function.Function;

/**
 * Read-through cache of resolved profiles, owned by the caller and handed to the resolver.
 *
 * <p>Implementations guarantee at most one in-flight resolution per profile id.
 */
public interface IResolvedProfileCache {

    Optional<ResolvedProfile> get(String profileId);

    /**
     * Returns the cached profile or resolves, stores and returns it.
     * Exceptions thrown by {@code resolver} propagate and nothing is cached.
     */
    ResolvedProfile getOrResolve(String profileId, Function<String, ResolvedProfile> resolver);

    /**
     * Drops {@code profileId} and every cached profile that inherits from it.
     */
    void invalidate(String profileId);

    void invalidateAll();

    long size();
}
