/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable, ordered list of predicates produced by one load.
 *
 * <p>Order is significant: evaluation stops at the first predicate that matches.
 * {@link #sources()} lists every file that was read to build the set, root file first,
 * so that a watcher can detect changes in included files too.
 */
public final class RuleSet {

    private static final RuleSet EMPTY = new RuleSet(List.of(), List.of());

    private final List<PathPredicate> predicates;
    private final List<Path> sources;
    private final RuleSetFingerprint fingerprint;

    public RuleSet(List<PathPredicate> predicates, List<Path> sources) {
        this.predicates = List.copyOf(predicates);
        this.sources = List.copyOf(sources);
        this.fingerprint = RuleSetFingerprint.of(this.predicates);
    }

    public static RuleSet empty() {
        return EMPTY;
    }

    public List<PathPredicate> predicates() {
        return predicates;
    }

    public List<Path> sources() {
        return sources;
    }

    public RuleSetFingerprint fingerprint() {
        return fingerprint;
    }

    public boolean isEmpty() {
        return predicates.isEmpty();
    }

    public int size() {
        return predicates.size();
    }

    @Override
    public String toString() {
        return "RuleSet{predicates=" + predicates.size() + ", sources=" + sources + "}";
    }
}
