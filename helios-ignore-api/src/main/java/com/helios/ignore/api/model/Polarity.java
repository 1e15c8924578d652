/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.model;

/**
 * Outcome a predicate yields when it is the first one to match a path.
 */
public enum Polarity {
    /** Matching paths are selected (ignored). */
    SELECT,
    /** Matching paths are explicitly not selected; written with a leading {@code !}. */
    DESELECT;

    public boolean selects() {
        return this == SELECT;
    }
}
