/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.exceptions;

/**
 * A rule line could not be translated into a path pattern.
 */
public class PatternCompileException extends IgnoreCompilationException {

    private final String pattern;
    private final String reason;

    public PatternCompileException(String pattern, String reason) {
        this(pattern, reason, null, null);
    }

    public PatternCompileException(String pattern, String reason, String source, Throwable cause) {
        super(String.format("Invalid pattern \"%s\" in ignore file%s: %s",
                pattern, source == null ? "" : " " + source, reason), source, cause);
        this.pattern = pattern;
        this.reason = reason;
    }

    public String getPattern() {
        return pattern;
    }

    public String getReason() {
        return reason;
    }

    /**
     * Same failure, attributed to the file it was read from.
     */
    public PatternCompileException withSource(String source) {
        return new PatternCompileException(pattern, reason, source, getCause());
    }
}
