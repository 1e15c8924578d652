/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.runtime.evaluation;

import com.helios.ignore.api.IPathMatcher;
import com.helios.ignore.api.model.MatchExplanation;
import com.helios.ignore.api.model.PathPredicate;
import com.helios.ignore.api.model.RuleSet;
import com.helios.ignore.api.model.RuleSetFingerprint;
import com.helios.ignore.cache.MatchResultCache;

import java.util.List;
import java.util.Optional;

/**
 * Evaluates paths against a compiled rule set, first match wins.
 *
 * <p>The predicate list is immutable, so evaluation itself takes no lock; the optional
 * {@link MatchResultCache} is safe for concurrent use. Any number of threads may call
 * {@link #match(String)} at once.
 */
public final class IgnoreMatcher implements IPathMatcher {

    private final RuleSet ruleSet;
    private final PathPredicate[] predicates;
    private final MatchResultCache cache;

    public IgnoreMatcher(RuleSet ruleSet) {
        this(ruleSet, null);
    }

    /**
     * @param cache cache to consult and fill, or null to evaluate every call
     * @throws IllegalArgumentException if the cache was built for a different rule set
     */
    public IgnoreMatcher(RuleSet ruleSet, MatchResultCache cache) {
        if (cache != null && !cache.fingerprint().equals(ruleSet.fingerprint())) {
            throw new IllegalArgumentException("Cache fingerprint does not match rule set");
        }
        this.ruleSet = ruleSet;
        this.predicates = ruleSet.predicates().toArray(new PathPredicate[0]);
        this.cache = cache;
    }

    @Override
    public boolean match(String path) {
        if (predicates.length == 0) {
            return false;
        }

        if (cache != null) {
            Optional<Boolean> cached = cache.get(path);
            if (cached.isPresent()) {
                return cached.get();
            }
        }

        boolean result = evaluate(path);

        if (cache != null) {
            cache.put(path, result);
        }
        return result;
    }

    private boolean evaluate(String path) {
        for (PathPredicate predicate : predicates) {
            if (predicate.matches(path)) {
                return predicate.polarity().selects();
            }
        }
        return false;
    }

    @Override
    public List<String> describe() {
        return ruleSet.predicates().stream()
                .map(PathPredicate::describe)
                .toList();
    }

    @Override
    public MatchExplanation explain(String path) {
        for (int i = 0; i < predicates.length; i++) {
            if (predicates[i].matches(path)) {
                return new MatchExplanation(path, predicates[i].polarity().selects(), i, predicates[i].describe());
            }
        }
        return MatchExplanation.noMatch(path);
    }

    public RuleSet ruleSet() {
        return ruleSet;
    }

    public RuleSetFingerprint fingerprint() {
        return ruleSet.fingerprint();
    }

    /**
     * @return the bound cache, if caching was requested for this matcher
     */
    public Optional<MatchResultCache> cache() {
        return Optional.ofNullable(cache);
    }
}
