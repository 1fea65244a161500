/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.compiler.store;

import com.sentinel.enginehealth.api.IProfileStore;
import com.sentinel.enginehealth.api.IResolvedProfileCache;
import com.sentinel.enginehealth.api.exceptions.ProfileNotFoundException;
import com.sentinel.enginehealth.api.exceptions.ProfileStoreException;
import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.compiler.validation.ProfileValidator;
import com.sentinel.enginehealth.compiler.validation.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory profile store.
 *
 * <p>When a cache is attached, saving or removing a profile invalidates it together
 * with every cached descendant.
 */
public class InMemoryProfileStore implements IProfileStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryProfileStore.class);

    private final Map<String, Profile> profiles = new ConcurrentHashMap<>();
    private final ProfileValidator validator = new ProfileValidator();
    private final IResolvedProfileCache cache;

    public InMemoryProfileStore() {
        this(null);
    }

    public InMemoryProfileStore(IResolvedProfileCache cache) {
        this.cache = cache;
    }

    public static InMemoryProfileStore of(Profile... profiles) {
        InMemoryProfileStore store = new InMemoryProfileStore();
        for (Profile profile : profiles) {
            store.profiles.put(profile.id(), profile);
        }
        return store;
    }

    @Override
    public Optional<Profile> getProfile(String id) {
        return Optional.ofNullable(profiles.get(id));
    }

    @Override
    public List<String> listProfileIds() {
        return profiles.keySet().stream().sorted().collect(Collectors.toList());
    }

    /**
     * Validates and stores a profile, replacing any previous version.
     *
     * @throws ProfileStoreException if the profile fails validation
     */
    public Profile save(Profile profile) {
        ValidationReport report = validator.validate(profile);
        if (!report.isValid()) {
            throw new ProfileStoreException("Invalid profile " + profile.id() + ": " + report.errors());
        }
        report.warnings().forEach(w -> logger.warn("Profile {}: {}", profile.id(), w));
        profiles.put(profile.id(), profile);
        invalidate(profile.id());
        return profile;
    }

    /**
     * Removes a profile that no other profile inherits from.
     *
     * @throws ProfileNotFoundException if the id is unknown
     * @throws ProfileStoreException    if other profiles still name it as parent
     */
    public void remove(String id) {
        if (!profiles.containsKey(id)) {
            throw new ProfileNotFoundException(id);
        }
        List<String> children = profiles.values().stream()
                .filter(p -> id.equals(p.parentId()))
                .map(Profile::id)
                .sorted()
                .collect(Collectors.toList());
        if (!children.isEmpty()) {
            throw new ProfileStoreException("Cannot remove profile " + id + ": inherited by " + children);
        }
        profiles.remove(id);
        invalidate(id);
    }

    public int size() {
        return profiles.size();
    }

    private void invalidate(String id) {
        if (cache != null) {
            cache.invalidate(id);
        }
    }
}
