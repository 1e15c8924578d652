/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.compiler;

import com.helios.ignore.api.IIgnoreCompiler;
import com.helios.ignore.api.exceptions.IgnoreCompilationException;
import com.helios.ignore.api.exceptions.PatternCompileException;
import com.helios.ignore.api.exceptions.SourceUnavailableException;
import com.helios.ignore.api.model.PathPredicate;
import com.helios.ignore.api.model.RuleSet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Compiles ignore files into a {@link RuleSet}.
 *
 * <p>Each raw line is preprocessed before it reaches the {@link PatternCompiler}:
 * <ul>
 *   <li>blank lines and lines starting with {@code //} are skipped</li>
 *   <li>lines starting with {@code #} are compiled once</li>
 *   <li>lines ending in {@code /**} are compiled once</li>
 *   <li>lines ending in {@code /} are compiled as given and with {@code **} appended</li>
 *   <li>all other lines are compiled as given and with {@code /**} appended, so a name
 *       also matches everything beneath it</li>
 * </ul>
 *
 * Compilation is all-or-nothing: the first pattern, include or read failure aborts the load.
 * Instances hold no per-load state, but a single load is not meant to run concurrently
 * with itself on shared input.
 */
public class IgnoreFileCompiler implements IIgnoreCompiler {
    private static final Logger logger = Logger.getLogger(IgnoreFileCompiler.class.getName());

    private static final String COMMENT_PREFIX = "//";
    private static final String DIRECTIVE_PREFIX = "#";
    private static final String RECURSIVE_SUFFIX = "/**";
    private static final String DIRECTORY_SUFFIX = "/";

    private final IncludeResolver includeResolver;
    private final PatternCompiler patternCompiler;
    private Tracer tracer;

    public IgnoreFileCompiler() {
        this(OpenTelemetry.noop().getTracer("helios-ignore"), new GlobTranslator());
    }

    public IgnoreFileCompiler(Tracer tracer) {
        this(tracer, new GlobTranslator());
    }

    public IgnoreFileCompiler(Tracer tracer, GlobTranslator translator) {
        this.tracer = tracer;
        this.includeResolver = new IncludeResolver(this::compileBody);
        this.patternCompiler = new PatternCompiler(translator, includeResolver);
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = tracer;
    }

    @Override
    public RuleSet compile(Path ignoreFile) {
        Span span = tracer.spanBuilder("compile-ignore-file").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("ignoreFile", ignoreFile.toString());
            long startTime = System.nanoTime();

            InclusionChain chain = new InclusionChain();
            List<PathPredicate> predicates = includeResolver.load(ignoreFile, null, chain);
            RuleSet ruleSet = new RuleSet(predicates, chain.loadedFiles());

            recordStats(span, ruleSet, startTime);
            logger.fine(() -> "Compiled " + ignoreFile + " into " + ruleSet.size() + " predicates");
            return ruleSet;
        } catch (IgnoreCompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    @Override
    public RuleSet compile(Reader reader, String logicalName) {
        Span span = tracer.spanBuilder("compile-ignore-source").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("logicalName", logicalName);
            long startTime = System.nanoTime();

            Path logicalPath = Path.of(logicalName);
            InclusionChain chain = new InclusionChain();
            chain.markSeen(logicalPath);

            BufferedReader buffered = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
            List<PathPredicate> predicates = compileBody(buffered, logicalPath, chain);
            RuleSet ruleSet = new RuleSet(predicates, chain.loadedFiles());

            recordStats(span, ruleSet, startTime);
            return ruleSet;
        } catch (IgnoreCompilationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private List<PathPredicate> compileBody(BufferedReader reader, Path currentFile, InclusionChain chain) {
        List<PathPredicate> predicates = new ArrayList<>();
        try {
            String raw;
            while ((raw = reader.readLine()) != null) {
                String line = raw.strip();
                if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
                    continue;
                }
                for (String variant : expand(line)) {
                    predicates.addAll(compileLine(variant, currentFile, chain));
                }
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(currentFile, e);
        }
        return predicates;
    }

    /**
     * Variants of a trimmed line that are each passed through the pattern compiler.
     */
    static List<String> expand(String line) {
        if (line.startsWith(DIRECTIVE_PREFIX) || line.endsWith(RECURSIVE_SUFFIX)) {
            return List.of(line);
        } else if (line.endsWith(DIRECTORY_SUFFIX)) {
            return List.of(line, line + "**");
        } else {
            return List.of(line, line + RECURSIVE_SUFFIX);
        }
    }

    private List<PathPredicate> compileLine(String line, Path currentFile, InclusionChain chain) {
        try {
            return patternCompiler.compile(line, currentFile, chain);
        } catch (PatternCompileException e) {
            if (e.getSource() != null) {
                throw e;
            }
            throw e.withSource(currentFile.toString());
        }
    }

    private static void recordStats(Span span, RuleSet ruleSet, long startTime) {
        span.setAttribute("predicateCount", ruleSet.size());
        span.setAttribute("sourceFileCount", ruleSet.sources().size());
        span.setAttribute("compilationTimeMs", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime));
    }
}
