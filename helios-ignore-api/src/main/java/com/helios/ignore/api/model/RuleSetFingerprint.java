/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.model;

import java.util.List;

/**
 * Value identity of a {@link RuleSet}: the ordered (source, polarity) pairs of its predicates.
 * Used to decide whether a result cache built for one rule set is still valid for another.
 */
public record RuleSetFingerprint(List<Entry> entries) {

    public RuleSetFingerprint {
        entries = List.copyOf(entries);
    }

    public static RuleSetFingerprint of(List<PathPredicate> predicates) {
        return new RuleSetFingerprint(predicates.stream()
                .map(p -> new Entry(p.source(), p.polarity()))
                .toList());
    }

    public int size() {
        return entries.size();
    }

    public record Entry(String source, Polarity polarity) {}
}
