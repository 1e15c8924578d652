/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.infra.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Immutable configuration for loading and caching ignore rules.
 *
 * <p>Values are resolved in this order, later sources winning:
 * <ol>
 *   <li>builder defaults</li>
 *   <li>{@code ignore.properties} (classpath, then file system)</li>
 *   <li>environment variables</li>
 * </ol>
 *
 * <p><b>Example ignore.properties:</b>
 * <pre>
 * ignore.cache.enabled=true
 * ignore.cache.max.size=0
 * ignore.cache.record.stats=true
 * ignore.glob.case.insensitive=false
 * ignore.reload.interval.seconds=10
 * </pre>
 */
public final class IgnoreConfig {
    private static final Logger logger = Logger.getLogger(IgnoreConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "ignore.properties";

    public static final String PROP_CACHE_ENABLED = "ignore.cache.enabled";
    public static final String PROP_CACHE_MAX_SIZE = "ignore.cache.max.size";
    public static final String PROP_CACHE_RECORD_STATS = "ignore.cache.record.stats";
    public static final String PROP_CASE_INSENSITIVE = "ignore.glob.case.insensitive";
    public static final String PROP_RELOAD_INTERVAL_SECONDS = "ignore.reload.interval.seconds";

    public static final String ENV_CACHE_ENABLED = "IGNORE_CACHE_ENABLED";
    public static final String ENV_CACHE_MAX_SIZE = "IGNORE_CACHE_MAX_SIZE";
    public static final String ENV_CACHE_RECORD_STATS = "IGNORE_CACHE_RECORD_STATS";
    public static final String ENV_CASE_INSENSITIVE = "IGNORE_GLOB_CASE_INSENSITIVE";
    public static final String ENV_RELOAD_INTERVAL_SECONDS = "IGNORE_RELOAD_INTERVAL_SECONDS";

    private final boolean cacheEnabled;
    private final long cacheMaxSize;
    private final boolean recordStats;
    private final boolean caseInsensitive;
    private final long reloadIntervalSeconds;

    private IgnoreConfig(Builder builder) {
        this.cacheEnabled = builder.cacheEnabled;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.recordStats = builder.recordStats;
        this.caseInsensitive = builder.caseInsensitive;
        this.reloadIntervalSeconds = builder.reloadIntervalSeconds;
    }

    // ====================================================================
    // FACTORY METHODS
    // ====================================================================

    public static IgnoreConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES} and applies environment overrides.
     */
    public static IgnoreConfig loadDefault() {
        return load(DEFAULT_PROPERTIES, System.getenv());
    }

    /**
     * Loads a properties file from the classpath or, failing that, the file system, then
     * applies overrides from {@code environment}. A missing file leaves the defaults in place.
     */
    public static IgnoreConfig load(String propertiesPath, Map<String, String> environment) {
        Properties props = new Properties();

        try (InputStream is = IgnoreConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.fine("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not read classpath properties: " + propertiesPath, e);
        }

        if (props.isEmpty()) {
            Path file = Path.of(propertiesPath);
            if (Files.isRegularFile(file)) {
                try (InputStream is = Files.newInputStream(file)) {
                    props.load(is);
                    logger.fine("Loaded " + props.size() + " properties from file: " + propertiesPath);
                } catch (IOException e) {
                    logger.log(Level.WARNING, "Could not read properties file: " + propertiesPath + ". Using defaults.", e);
                }
            }
        }

        return builder()
                .applyProperties(props)
                .applyEnvironment(environment)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .cacheEnabled(cacheEnabled)
                .cacheMaxSize(cacheMaxSize)
                .recordStats(recordStats)
                .caseInsensitive(caseInsensitive)
                .reloadIntervalSeconds(reloadIntervalSeconds);
    }

    // ====================================================================
    // GETTERS
    // ====================================================================

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    /**
     * Maximum cached paths per ignore file; 0 means unbounded.
     */
    public long getCacheMaxSize() {
        return cacheMaxSize;
    }

    public boolean isRecordStats() {
        return recordStats;
    }

    public boolean isCaseInsensitive() {
        return caseInsensitive;
    }

    public long getReloadIntervalSeconds() {
        return reloadIntervalSeconds;
    }

    @Override
    public String toString() {
        return String.format(
                "IgnoreConfig{cacheEnabled=%b, cacheMaxSize=%d, recordStats=%b, caseInsensitive=%b, reloadIntervalSeconds=%d}",
                cacheEnabled, cacheMaxSize, recordStats, caseInsensitive, reloadIntervalSeconds);
    }

    // ====================================================================
    // BUILDER
    // ====================================================================

    public static class Builder {
        private boolean cacheEnabled = true;
        private long cacheMaxSize = 0;
        private boolean recordStats = true;
        private boolean caseInsensitive = false;
        private long reloadIntervalSeconds = 10;

        private Builder() {
        }

        public Builder cacheEnabled(boolean enabled) {
            this.cacheEnabled = enabled;
            return this;
        }

        public Builder cacheMaxSize(long size) {
            this.cacheMaxSize = size;
            return this;
        }

        public Builder recordStats(boolean enable) {
            this.recordStats = enable;
            return this;
        }

        public Builder caseInsensitive(boolean enable) {
            this.caseInsensitive = enable;
            return this;
        }

        public Builder reloadIntervalSeconds(long seconds) {
            this.reloadIntervalSeconds = seconds;
            return this;
        }

        Builder applyProperties(Properties props) {
            parseBoolean(props.getProperty(PROP_CACHE_ENABLED)).ifPresent(this::cacheEnabled);
            parseLong(PROP_CACHE_MAX_SIZE, props.getProperty(PROP_CACHE_MAX_SIZE)).ifPresent(this::cacheMaxSize);
            parseBoolean(props.getProperty(PROP_CACHE_RECORD_STATS)).ifPresent(this::recordStats);
            parseBoolean(props.getProperty(PROP_CASE_INSENSITIVE)).ifPresent(this::caseInsensitive);
            parseLong(PROP_RELOAD_INTERVAL_SECONDS, props.getProperty(PROP_RELOAD_INTERVAL_SECONDS))
                    .ifPresent(this::reloadIntervalSeconds);
            return this;
        }

        Builder applyEnvironment(Map<String, String> env) {
            parseBoolean(env.get(ENV_CACHE_ENABLED)).ifPresent(this::cacheEnabled);
            parseLong(ENV_CACHE_MAX_SIZE, env.get(ENV_CACHE_MAX_SIZE)).ifPresent(this::cacheMaxSize);
            parseBoolean(env.get(ENV_CACHE_RECORD_STATS)).ifPresent(this::recordStats);
            parseBoolean(env.get(ENV_CASE_INSENSITIVE)).ifPresent(this::caseInsensitive);
            parseLong(ENV_RELOAD_INTERVAL_SECONDS, env.get(ENV_RELOAD_INTERVAL_SECONDS))
                    .ifPresent(this::reloadIntervalSeconds);
            return this;
        }

        public IgnoreConfig build() {
            if (cacheMaxSize < 0) {
                throw new IllegalArgumentException("cacheMaxSize must be >= 0, got " + cacheMaxSize);
            }
            if (reloadIntervalSeconds <= 0) {
                throw new IllegalArgumentException("reloadIntervalSeconds must be > 0, got " + reloadIntervalSeconds);
            }
            return new IgnoreConfig(this);
        }

        private static Optional<Boolean> parseBoolean(String value) {
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            return Optional.of(Boolean.parseBoolean(value.strip()));
        }

        private static Optional<Long> parseLong(String key, String value) {
            if (value == null || value.isBlank()) {
                return Optional.empty();
            }
            try {
                return Optional.of(Long.parseLong(value.strip()));
            } catch (NumberFormatException e) {
                logger.warning("Invalid " + key + ": " + value + ", using default");
                return Optional.empty();
            }
        }
    }
}
