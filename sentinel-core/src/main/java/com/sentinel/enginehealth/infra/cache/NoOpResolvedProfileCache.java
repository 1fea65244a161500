package com.sentinel.enginehealth.infra.cache;

import com.sentinel.enginehealth.api.IResolvedProfileCache;
import com.sentinel.enginehealth.api.model.ResolvedProfile;

import java.util.Optional;
import java.util.function.Function;

/**
 * Cache that stores nothing; every lookup resolves.
 */
public final class NoOpResolvedProfileCache implements IResolvedProfileCache {

    @Override
    public Optional<ResolvedProfile> get(String profileId) {
        return Optional.empty();
    }

    @Override
    public ResolvedProfile getOrResolve(String profileId, Function<String, ResolvedProfile> resolver) {
        return resolver.apply(profileId);
    }

    @Override
    public void invalidate(String profileId) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public long size() {
        return 0;
    }
}
