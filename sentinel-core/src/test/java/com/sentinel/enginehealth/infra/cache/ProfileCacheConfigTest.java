package com.sentinel.enginehealth.infra.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProfileCacheConfigTest {

    @Test
    @DisplayName("Should default to a one minute Caffeine cache")
    void shouldUseDefaults() {
        ProfileCacheConfig config = ProfileCacheConfig.builder().build();

        assertThat(config.getCacheType()).isEqualTo(ProfileCacheConfig.CacheType.CAFFEINE);
        assertThat(config.getTtl()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getMaxSize()).isEqualTo(1_000);
    }

    @Test
    @DisplayName("Should load the bundled properties file from the classpath")
    void shouldLoadClasspathProperties() {
        Properties props = ProfileCacheConfig.readProperties(ProfileCacheConfig.DEFAULT_PROPERTIES);
        ProfileCacheConfig config = ProfileCacheConfig.fromProperties(props, key -> null);

        assertThat(props).isNotEmpty();
        assertThat(config.getMaxSize()).isEqualTo(1000);
        assertThat(config.isRecordStats()).isTrue();
    }

    @Test
    @DisplayName("Environment variables should override properties")
    void environmentShouldOverrideProperties() {
        // Given
        Properties props = new Properties();
        props.setProperty("cache.max.size", "50");
        props.setProperty("cache.ttl.seconds", "30");
        Map<String, String> env = Map.of(
                "SENTINEL_CACHE_MAX_SIZE", "75",
                "SENTINEL_CACHE_TYPE", "no_op");

        // When
        ProfileCacheConfig config = ProfileCacheConfig.fromProperties(props, env::get);

        // Then
        assertThat(config.getMaxSize()).isEqualTo(75);
        assertThat(config.getTtl()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.getCacheType()).isEqualTo(ProfileCacheConfig.CacheType.NO_OP);
    }

    @Test
    @DisplayName("Should ignore malformed environment values")
    void shouldIgnoreMalformedEnvironment() {
        ProfileCacheConfig config = ProfileCacheConfig.fromEnvironment(
                Map.of("SENTINEL_CACHE_TTL_SECONDS", "soon")::get);

        assertThat(config.getTtl()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Should reject a non-positive size")
    void shouldRejectInvalidSize() {
        assertThatThrownBy(() -> ProfileCacheConfig.builder().maxSize(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxSize");
    }
}
