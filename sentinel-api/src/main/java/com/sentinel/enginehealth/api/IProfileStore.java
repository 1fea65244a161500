/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.api;

import com.sentinel.enginehealth.api.model.Profile;

import java.util.List;
import java.util.Optional;

/**
 * Read access to profile definitions, backed by whatever persistence the
 * surrounding application uses.
 */
public interface IProfileStore {

    /**
     * @param id profile id
     * @return the profile, or empty when no profile has that id
     */
    Optional<Profile> getProfile(String id);

    /**
     * Ids of every stored profile, sorted.
     */
    List<String> listProfileIds();
}
