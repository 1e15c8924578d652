/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.model;

import java.util.Objects;

/**
 * One compiled path test paired with its polarity.
 */
public record PathPredicate(PathPattern pattern, Polarity polarity) {

    /** Prefix {@link #describe()} puts in front of deselecting predicates. */
    public static final String EXCLUDE_MARKER = "(?exclude)";

    public PathPredicate {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(polarity, "polarity");
    }

    public boolean matches(String path) {
        return pattern.matches(path);
    }

    public String source() {
        return pattern.source();
    }

    public String describe() {
        return polarity.selects() ? pattern.source() : EXCLUDE_MARKER + pattern.source();
    }
}
