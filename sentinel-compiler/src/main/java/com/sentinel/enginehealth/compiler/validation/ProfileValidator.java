package com.sentinel.enginehealth.compiler.validation;

import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.api.model.Rule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks of a single profile definition before it is stored.
 */
public class ProfileValidator {

    private static final Pattern ID_PATTERN = Pattern.compile("^[a-z0-9-]+$");

    public ValidationReport validate(Profile profile) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        if (!ID_PATTERN.matcher(profile.id()).matches()) {
            errors.add("profileId must contain only lowercase letters, numbers, and hyphens: " + profile.id());
        }
        if (profile.name() == null || profile.name().isBlank()) {
            errors.add("name is required");
        }
        if (profile.id().equals(profile.parentId())) {
            errors.add("profile cannot be its own parent: " + profile.id());
        }

        Set<String> ruleIds = new HashSet<>();
        for (Rule rule : profile.rules()) {
            if (!ruleIds.add(rule.id())) {
                warnings.add("duplicate rule id " + rule.id() + ", the last definition wins");
            }
        }
        return new ValidationReport(errors, warnings);
    }
}
