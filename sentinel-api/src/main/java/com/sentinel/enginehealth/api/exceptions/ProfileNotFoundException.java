/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api.exceptions;

/**
 * Thrown when a profile id in an inheritance chain does not exist in the store.
 */
public class ProfileNotFoundException extends SentinelException {

    private final String profileId;
    private final String requestedProfileId;

    public ProfileNotFoundException(String profileId) {
        this(profileId, profileId);
    }

    /**
     * @param profileId          the id that could not be found
     * @param requestedProfileId the leaf id whose resolution hit the missing profile
     */
    public ProfileNotFoundException(String profileId, String requestedProfileId) {
        super(profileId.equals(requestedProfileId)
                ? "Profile not found: " + profileId
                : "Profile not found: " + profileId + " (in chain of " + requestedProfileId + ")");
        this.profileId = profileId;
        this.requestedProfileId = requestedProfileId;
    }

    public String getProfileId() {
        return profileId;
    }

    public String getRequestedProfileId() {
        return requestedProfileId;
    }
}
