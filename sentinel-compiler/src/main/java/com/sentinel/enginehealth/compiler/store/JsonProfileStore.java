/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.compiler.store;

import com.sentinel.enginehealth.api.IProfileStore;
import com.sentinel.enginehealth.api.exceptions.MalformedRuleException;
import com.sentinel.enginehealth.api.exceptions.ProfileStoreException;
import com.sentinel.enginehealth.api.model.Profile;
import com.sentinel.enginehealth.compiler.parser.ProfileDocumentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only store over a directory of {@code <profileId>.json} documents.
 *
 * <p>Every lookup reads the file again; put a resolved-profile cache in front of the
 * resolver for repeated use. Malformed rules are skipped with a warning.
 */
public class JsonProfileStore implements IProfileStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonProfileStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ProfileDocumentParser parser;

    public JsonProfileStore(Path directory) {
        this(directory, new ProfileDocumentParser());
    }

    public JsonProfileStore(Path directory, ProfileDocumentParser parser) {
        if (!Files.isDirectory(directory)) {
            throw new ProfileStoreException("Profile directory does not exist: " + directory);
        }
        this.directory = directory;
        this.parser = parser;
    }

    @Override
    public Optional<Profile> getProfile(String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            return Optional.empty();
        }
        Path file = directory.resolve(id + SUFFIX);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new ProfileStoreException("Cannot read profile " + id + " from " + file, e);
        }
        ProfileDocumentParser.ParseResult result = parser.parse(json);
        for (MalformedRuleException skipped : result.skippedRules()) {
            logger.warn("Skipping rule in profile {}: {}", id, skipped.getMessage());
        }
        if (!result.profile().id().equals(id)) {
            throw new ProfileStoreException("File " + file.getFileName() + " declares profile "
                    + result.profile().id());
        }
        return Optional.of(result.profile());
    }

    @Override
    public List<String> listProfileIds() {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX) && !name.startsWith("_"))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ProfileStoreException("Cannot list profiles in " + directory, e);
        }
    }
}
