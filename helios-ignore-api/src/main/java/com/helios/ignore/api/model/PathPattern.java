/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.model;

/**
 * A compiled path test. Every compiled rule form (root-anchored, any-depth, literal
 * or spliced in from an included file) is exposed through this one contract.
 */
public interface PathPattern {

    /**
     * @param path slash-separated path, relative to the directory the rules apply to
     * @return true if the whole path matches
     */
    boolean matches(String path);

    /**
     * Canonical textual form of the compiled pattern. Two patterns with equal sources
     * are considered the same rule when fingerprinting a {@link RuleSet}.
     */
    String source();
}
