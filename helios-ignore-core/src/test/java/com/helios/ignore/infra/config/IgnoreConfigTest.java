package com.helios.ignore.infra.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IgnoreConfigTest {

    @Test
    void shouldUseDefaults() {
        IgnoreConfig config = IgnoreConfig.defaults();

        assertThat(config.isCacheEnabled()).isTrue();
        assertThat(config.getCacheMaxSize()).isZero();
        assertThat(config.isRecordStats()).isTrue();
        assertThat(config.isCaseInsensitive()).isFalse();
        assertThat(config.getReloadIntervalSeconds()).isEqualTo(10);
    }

    @Test
    void shouldLoadClasspathPropertiesAndIgnoreInvalidNumbers() {
        IgnoreConfig config = IgnoreConfig.load("config/test-ignore.properties", Map.of());

        assertThat(config.isCacheEnabled()).isFalse();
        assertThat(config.getCacheMaxSize()).isEqualTo(5000);
        assertThat(config.isRecordStats()).isFalse();
        assertThat(config.isCaseInsensitive()).isTrue();
        assertThat(config.getReloadIntervalSeconds()).isEqualTo(10);
    }

    @Test
    void shouldLetEnvironmentOverrideProperties() {
        IgnoreConfig config = IgnoreConfig.load("config/test-ignore.properties", Map.of(
                IgnoreConfig.ENV_CACHE_ENABLED, "true",
                IgnoreConfig.ENV_CACHE_MAX_SIZE, "42",
                IgnoreConfig.ENV_RELOAD_INTERVAL_SECONDS, "3"));

        assertThat(config.isCacheEnabled()).isTrue();
        assertThat(config.getCacheMaxSize()).isEqualTo(42);
        assertThat(config.getReloadIntervalSeconds()).isEqualTo(3);
        assertThat(config.isCaseInsensitive()).isTrue();
    }

    @Test
    void shouldFallBackToFileSystem(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("custom.properties");
        Files.writeString(file, "ignore.cache.max.size=7\n");

        IgnoreConfig config = IgnoreConfig.load(file.toString(), Map.of());

        assertThat(config.getCacheMaxSize()).isEqualTo(7);
        assertThat(config.isCacheEnabled()).isTrue();
    }

    @Test
    void shouldKeepDefaultsWhenFileIsMissing() {
        IgnoreConfig config = IgnoreConfig.load("does-not-exist.properties", Map.of());

        assertThat(config.toString()).isEqualTo(IgnoreConfig.defaults().toString());
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> IgnoreConfig.builder().cacheMaxSize(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> IgnoreConfig.builder().reloadIntervalSeconds(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCopyThroughBuilder() {
        IgnoreConfig original = IgnoreConfig.builder().caseInsensitive(true).cacheMaxSize(9).build();

        IgnoreConfig copy = original.toBuilder().recordStats(false).build();

        assertThat(copy.isCaseInsensitive()).isTrue();
        assertThat(copy.getCacheMaxSize()).isEqualTo(9);
        assertThat(copy.isRecordStats()).isFalse();
    }
}
