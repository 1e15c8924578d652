/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api;

/**
 * Contract for managing matcher lifecycle (hot reload).
 */
public interface IIgnoreMatcherManager {

    /**
     * Starts watching the ignore files for changes.
     */
    void start();

    /**
     * Stops watching and releases resources.
     */
    void shutdown();

    /**
     * Gets the currently active matcher.
     *
     * @return current matcher (thread-safe)
     */
    IPathMatcher getMatcher();
}
