/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api;

import com.helios.ignore.api.exceptions.IgnoreCompilationException;
import com.helios.ignore.api.model.RuleSet;

import io.opentelemetry.api.trace.Tracer;
import java.io.Reader;
import java.nio.file.Path;

/**
 * Contract for compiling ignore files into an ordered rule set.
 */
public interface IIgnoreCompiler {

    /**
     * Compiles an ignore file and everything it includes.
     *
     * @param ignoreFile path to the ignore file
     * @return compiled rule set
     * @throws IgnoreCompilationException if any pattern, include or read fails
     */
    RuleSet compile(Path ignoreFile);

    /**
     * Compiles rules from an already open source.
     *
     * @param reader      rule text
     * @param logicalName name used to resolve relative includes; treated as already seen,
     *                    so the source cannot include itself
     * @return compiled rule set
     * @throws IgnoreCompilationException if any pattern, include or read fails
     */
    RuleSet compile(Reader reader, String logicalName);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }
}
