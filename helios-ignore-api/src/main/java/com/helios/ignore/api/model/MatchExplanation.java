/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.model;

/**
 * Which predicate decided the result for a path.
 *
 * @param path           the path that was evaluated
 * @param selected       the match result
 * @param predicateIndex position of the deciding predicate, or -1 when nothing matched
 * @param predicate      {@link PathPredicate#describe()} of the deciding predicate, or null
 */
public record MatchExplanation(String path, boolean selected, int predicateIndex, String predicate) {

    public static MatchExplanation noMatch(String path) {
        return new MatchExplanation(path, false, -1, null);
    }

    public boolean matched() {
        return predicateIndex >= 0;
    }
}
