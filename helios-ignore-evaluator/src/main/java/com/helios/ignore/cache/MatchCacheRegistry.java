/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.cache;

import com.helios.ignore.api.model.RuleSetFingerprint;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Current result cache per ignore-file source, owned by whoever loads the rules.
 *
 * <p>On every cached (re)load the new rule set's fingerprint is compared with the one of the
 * cache registered for the same source. Equal fingerprints get the existing cache back, so a
 * no-op reload keeps its warm entries. Otherwise a fresh cache replaces the old one outright,
 * which bounds memory to the paths queried since the last real rule change.
 *
 * <p>All operations are serialized on the registry instance.
 */
public final class MatchCacheRegistry {
    private static final Logger logger = Logger.getLogger(MatchCacheRegistry.class.getName());

    private final Map<Path, MatchResultCache> caches = new HashMap<>();
    private final Function<RuleSetFingerprint, MatchResultCache> cacheFactory;

    public MatchCacheRegistry() {
        this(fingerprint -> MatchResultCache.builder(fingerprint).build());
    }

    public MatchCacheRegistry(Function<RuleSetFingerprint, MatchResultCache> cacheFactory) {
        this.cacheFactory = cacheFactory;
    }

    /**
     * Returns the cache to bind to a freshly compiled rule set for {@code source}.
     *
     * @param source      canonical path of the ignore file the rules were loaded from
     * @param fingerprint fingerprint of the new rule set
     * @return the registered cache if its fingerprint is equal, otherwise a new empty cache
     *         that replaces it
     */
    public synchronized MatchResultCache bind(Path source, RuleSetFingerprint fingerprint) {
        MatchResultCache existing = caches.get(source);
        if (existing != null && existing.fingerprint().equals(fingerprint)) {
            logger.fine(() -> "Rules unchanged for " + source + ", reusing cache with " + existing.size() + " entries");
            return existing;
        }

        MatchResultCache fresh = cacheFactory.apply(fingerprint);
        caches.put(source, fresh);
        if (existing != null) {
            logger.fine(() -> "Rules changed for " + source + ", discarding cache with " + existing.size() + " entries");
        }
        return fresh;
    }

    public synchronized Optional<MatchResultCache> get(Path source) {
        return Optional.ofNullable(caches.get(source));
    }

    public synchronized void evict(Path source) {
        caches.remove(source);
    }

    public synchronized int size() {
        return caches.size();
    }
}
