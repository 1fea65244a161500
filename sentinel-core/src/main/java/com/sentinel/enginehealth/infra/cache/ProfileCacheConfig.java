/*
 * Copyright (c) 2025 Sentinel Engine Health
 * Licensed under the Apache License, Version 2.0
 */
package com.sentinel.enginehealth.infra.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration of the resolved-profile cache.
 *
 * <p>Values are taken, in increasing precedence, from builder defaults, a properties
 * file and environment variables:
 * <pre>
 * SENTINEL_CACHE_TYPE=CAFFEINE
 * SENTINEL_CACHE_MAX_SIZE=1000
 * SENTINEL_CACHE_TTL_SECONDS=60
 * SENTINEL_CACHE_RECORD_STATS=true
 * </pre>
 */
public final class ProfileCacheConfig {

    private static final Logger logger = LoggerFactory.getLogger(ProfileCacheConfig.class);

    // ========================================================================
    // KEYS
    // ========================================================================

    static final String ENV_CACHE_TYPE = "SENTINEL_CACHE_TYPE";
    static final String ENV_MAX_SIZE = "SENTINEL_CACHE_MAX_SIZE";
    static final String ENV_TTL_SECONDS = "SENTINEL_CACHE_TTL_SECONDS";
    static final String ENV_RECORD_STATS = "SENTINEL_CACHE_RECORD_STATS";

    static final String PROP_CACHE_TYPE = "cache.type";
    static final String PROP_MAX_SIZE = "cache.max.size";
    static final String PROP_TTL_SECONDS = "cache.ttl.seconds";
    static final String PROP_RECORD_STATS = "cache.record.stats";

    public static final String DEFAULT_PROPERTIES = "sentinel-cache.properties";

    public enum CacheType {
        CAFFEINE,
        NO_OP
    }

    // ========================================================================
    // FIELDS
    // ========================================================================

    private final CacheType cacheType;
    private final long maxSize;
    private final Duration ttl;
    private final boolean recordStats;

    private ProfileCacheConfig(Builder builder) {
        this.cacheType = builder.cacheType;
        this.maxSize = builder.maxSize;
        this.ttl = builder.ttl;
        this.recordStats = builder.recordStats;
        validate();
    }

    private void validate() {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static ProfileCacheConfig forDevelopment() {
        return builder()
                .maxSize(100)
                .ttl(Duration.ofSeconds(5))
                .recordStats(true)
                .build();
    }

    public static ProfileCacheConfig forProduction() {
        return builder()
                .maxSize(10_000)
                .ttl(Duration.ofMinutes(1))
                .recordStats(true)
                .build();
    }

    public static ProfileCacheConfig disabled() {
        return builder().cacheType(CacheType.NO_OP).build();
    }

    /**
     * Defaults overridden by the process environment.
     */
    public static ProfileCacheConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    static ProfileCacheConfig fromEnvironment(Function<String, String> env) {
        Builder builder = builder();
        applyEnvironment(builder, env);
        return builder.build();
    }

    public static ProfileCacheConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads from the classpath first, then from the filesystem, then applies environment overrides.
     */
    public static ProfileCacheConfig loadFromProperties(String propertiesPath) {
        return fromProperties(readProperties(propertiesPath), System::getenv);
    }

    static ProfileCacheConfig fromProperties(Properties props, Function<String, String> env) {
        Builder builder = builder();

        String type = props.getProperty(PROP_CACHE_TYPE);
        if (type != null) {
            builder.cacheType(parseType(type));
        }
        String maxSize = props.getProperty(PROP_MAX_SIZE);
        if (maxSize != null) {
            builder.maxSize(Long.parseLong(maxSize.trim()));
        }
        String ttlSeconds = props.getProperty(PROP_TTL_SECONDS);
        if (ttlSeconds != null) {
            builder.ttl(Duration.ofSeconds(Long.parseLong(ttlSeconds.trim())));
        }
        String recordStats = props.getProperty(PROP_RECORD_STATS);
        if (recordStats != null) {
            builder.recordStats(Boolean.parseBoolean(recordStats.trim()));
        }

        applyEnvironment(builder, env);
        return builder.build();
    }

    static Properties readProperties(String propertiesPath) {
        Properties props = new Properties();
        try (InputStream is = ProfileCacheConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded {} cache properties from classpath: {}", props.size(), propertiesPath);
                return props;
            }
        } catch (IOException e) {
            logger.debug("Could not load {} from classpath", propertiesPath, e);
        }
        try (InputStream is = new FileInputStream(propertiesPath)) {
            props.load(is);
            logger.info("Loaded {} cache properties from file: {}", props.size(), propertiesPath);
        } catch (IOException e) {
            logger.warn("Could not load cache properties {}. Using defaults.", propertiesPath);
        }
        return props;
    }

    private static void applyEnvironment(Builder builder, Function<String, String> env) {
        String type = trimmed(env.apply(ENV_CACHE_TYPE));
        if (type != null) {
            builder.cacheType(parseType(type));
        }
        String maxSize = trimmed(env.apply(ENV_MAX_SIZE));
        if (maxSize != null) {
            try {
                builder.maxSize(Long.parseLong(maxSize));
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for {}: {}", ENV_MAX_SIZE, maxSize);
            }
        }
        String ttl = trimmed(env.apply(ENV_TTL_SECONDS));
        if (ttl != null) {
            try {
                builder.ttl(Duration.ofSeconds(Long.parseLong(ttl)));
            } catch (NumberFormatException e) {
                logger.warn("Invalid long value for {}: {}", ENV_TTL_SECONDS, ttl);
            }
        }
        String recordStats = trimmed(env.apply(ENV_RECORD_STATS));
        if (recordStats != null) {
            builder.recordStats(Boolean.parseBoolean(recordStats));
        }
    }

    private static CacheType parseType(String value) {
        try {
            return CacheType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid cache type '{}', using CAFFEINE", value);
            return CacheType.CAFFEINE;
        }
    }

    private static String trimmed(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public CacheType getCacheType() {
        return cacheType;
    }

    public long getMaxSize() {
        return maxSize;
    }

    public Duration getTtl() {
        return ttl;
    }

    public boolean isRecordStats() {
        return recordStats;
    }

    public Map<String, Object> toMap() {
        return Map.of(
                "cacheType", cacheType.name(),
                "maxSize", maxSize,
                "ttlSeconds", ttl.toSeconds(),
                "recordStats", recordStats);
    }

    @Override
    public String toString() {
        return "ProfileCacheConfig" + toMap();
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CacheType cacheType = CacheType.CAFFEINE;
        private long maxSize = 1_000;
        private Duration ttl = Duration.ofSeconds(60);
        private boolean recordStats = true;

        private Builder() {
        }

        public Builder cacheType(CacheType cacheType) {
            this.cacheType = cacheType;
            return this;
        }

        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public ProfileCacheConfig build() {
            return new ProfileCacheConfig(this);
        }
    }
}
