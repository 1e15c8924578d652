/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.exceptions;

/**
 * Base type for failures while building a rule set from an ignore file.
 *
 * This is a RuntimeException to match the rest of the engine: any failure aborts the
 * whole load, and no partial rule set is ever returned.
 */
public class IgnoreCompilationException extends RuntimeException {

    private final String source;

    public IgnoreCompilationException(String message, String source) {
        super(message);
        this.source = source;
    }

    public IgnoreCompilationException(String message, String source, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    /**
     * File or logical name being compiled when the failure happened, or null if unknown.
     */
    public String getSource() {
        return source;
    }
}
