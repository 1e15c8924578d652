/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.helios.ignore.api.model.RuleSetFingerprint;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Path to match-result memo for one rule set.
 *
 * <p>Each instance is tagged with the fingerprint of the rule set it was built for and is
 * only ever bound to matchers whose rule set has an equal fingerprint. Entries are never
 * carried over to a cache for a different fingerprint.
 *
 * <p>Backed by Caffeine, so concurrent {@link #get} and {@link #put} need no external locking.
 * Unbounded unless a maximum size is configured.
 */
public final class MatchResultCache {
    private static final Logger logger = Logger.getLogger(MatchResultCache.class.getName());

    private final RuleSetFingerprint fingerprint;
    private final Cache<String, Boolean> entries;
    private final long maxSize;
    private final boolean statsEnabled;

    private MatchResultCache(Builder builder) {
        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder();

        if (builder.maxSize > 0) {
            cacheBuilder.maximumSize(builder.maxSize);
        }

        this.statsEnabled = builder.recordStats;
        if (builder.recordStats) {
            cacheBuilder.recordStats();
        }

        this.entries = cacheBuilder.build();
        this.fingerprint = builder.fingerprint;
        this.maxSize = builder.maxSize;

        logger.fine(() -> String.format(
                "MatchResultCache created: predicates=%d, maxSize=%d, stats=%b",
                fingerprint.size(), maxSize, statsEnabled));
    }

    public static Builder builder(RuleSetFingerprint fingerprint) {
        return new Builder(fingerprint);
    }

    public RuleSetFingerprint fingerprint() {
        return fingerprint;
    }

    /**
     * @return the cached result for {@code path}, if present
     */
    public Optional<Boolean> get(String path) {
        return Optional.ofNullable(entries.getIfPresent(path));
    }

    public void put(String path, boolean selected) {
        entries.put(path, selected);
    }

    /**
     * Membership check that does not count as a hit or miss.
     */
    public boolean contains(String path) {
        return entries.asMap().containsKey(path);
    }

    public long size() {
        return entries.estimatedSize();
    }

    public void clear() {
        entries.invalidateAll();
    }

    public CacheMetrics getMetrics() {
        if (!statsEnabled) {
            return new CacheMetrics(0, 0, 0, entries.estimatedSize(), 0.0);
        }
        CacheStats stats = entries.stats();
        return new CacheMetrics(
                stats.hitCount(),
                stats.missCount(),
                stats.evictionCount(),
                entries.estimatedSize(),
                stats.hitRate()
        );
    }

    /**
     * Cache metrics for monitoring and tuning.
     */
    public record CacheMetrics(
            long hits,
            long misses,
            long evictions,
            long currentSize,
            double hitRate
    ) {
        public long totalRequests() {
            return hits + misses;
        }

        public String format() {
            return String.format(
                    "Match cache: requests=%d, hits=%d (%.1f%%), misses=%d, evictions=%d, size=%d",
                    totalRequests(), hits, hitRate * 100, misses, evictions, currentSize
            );
        }
    }

    public static class Builder {
        private final RuleSetFingerprint fingerprint;
        private long maxSize = 0;
        private boolean recordStats = false;

        private Builder(RuleSetFingerprint fingerprint) {
            this.fingerprint = fingerprint;
        }

        /**
         * @param maxSize maximum number of cached paths; 0 or less for unbounded
         */
        public Builder maxSize(long maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public MatchResultCache build() {
            return new MatchResultCache(this);
        }
    }
}
