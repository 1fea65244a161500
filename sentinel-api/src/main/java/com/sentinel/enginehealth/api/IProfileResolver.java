/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api;

import com.sentinel.enginehealth.api.model.ResolvedProfile;

import io.opentelemetry.api.trace.Tracer;

/**
 * Contract for resolving a leaf profile into one self-contained configuration.
 */
public interface IProfileResolver {

    /**
     * Walks the parent chain of {@code leafProfileId} and merges it root to leaf.
     *
     * @param leafProfileId id of the profile to resolve
     * @param store         source of profile definitions
     * @return resolved profile
     * @throws com.sentinel.enginehealth.api.exceptions.ProfileNotFoundException     if any id in the chain is missing
     * @throws com.sentinel.enginehealth.api.exceptions.CircularInheritanceException if the chain loops
     * @throws com.sentinel.enginehealth.api.exceptions.InvalidThresholdValueException if strict validation fails
     */
    ResolvedProfile resolve(String leafProfileId, IProfileStore store);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a listener notified of each resolution stage.
     *
     * @param listener the listener (null to disable)
     */
    default void setResolutionListener(ResolutionListener listener) {
    }
}
