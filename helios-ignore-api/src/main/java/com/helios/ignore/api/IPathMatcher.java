/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api;

import com.helios.ignore.api.model.MatchExplanation;

import java.util.List;

/**
 * Contract for deciding whether paths are selected by a compiled rule set.
 *
 * <p>Evaluation is first-match-wins over declaration order: the earliest predicate
 * whose pattern matches decides the result, and a path no predicate matches is not
 * selected. A later {@code !pattern} therefore only takes effect if it is declared
 * before the broader rule it is meant to override.
 *
 * <h2>Thread Safety</h2>
 * <p>Implementations must be safe for concurrent {@link #match(String)} calls once
 * constructed. {@code match} never blocks on I/O and never throws.
 */
public interface IPathMatcher {

    /**
     * @param path slash-separated path relative to the rule root
     * @return true if the path is selected (ignored)
     */
    boolean match(String path);

    /**
     * One entry per compiled predicate in declaration order. Deselecting predicates are
     * prefixed with {@code (?exclude)}. Diagnostic output only; not meant to be re-parsed.
     */
    List<String> describe();

    /**
     * Uncached evaluation that reports which predicate decided the result.
     */
    MatchExplanation explain(String path);
}
