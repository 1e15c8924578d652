/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.compiler;

import com.helios.ignore.api.model.PathPattern;

import java.util.regex.Pattern;

/**
 * Path pattern backed by an anchored regular expression. The source is the regex text.
 */
public final class RegexPathPattern implements PathPattern {

    private final Pattern regex;

    RegexPathPattern(Pattern regex) {
        this.regex = regex;
    }

    @Override
    public boolean matches(String path) {
        return regex.matcher(path).matches();
    }

    @Override
    public String source() {
        return regex.pattern();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RegexPathPattern other && source().equals(other.source());
    }

    @Override
    public int hashCode() {
        return source().hashCode();
    }

    @Override
    public String toString() {
        return source();
    }
}
