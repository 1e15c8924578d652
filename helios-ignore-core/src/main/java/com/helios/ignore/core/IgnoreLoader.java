/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.core;

import com.helios.ignore.api.IIgnoreCompiler;
import com.helios.ignore.api.exceptions.IgnoreCompilationException;
import com.helios.ignore.api.model.RuleSet;
import com.helios.ignore.cache.MatchCacheRegistry;
import com.helios.ignore.cache.MatchResultCache;
import com.helios.ignore.compiler.GlobTranslator;
import com.helios.ignore.compiler.IgnoreFileCompiler;
import com.helios.ignore.compiler.InclusionChain;
import com.helios.ignore.infra.config.IgnoreConfig;
import com.helios.ignore.runtime.evaluation.IgnoreMatcher;
import io.opentelemetry.api.trace.Tracer;

import java.io.Reader;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Entry points for building matchers from ignore files.
 *
 * <p>Each loader owns a {@link MatchCacheRegistry}. Cached loads of the same file share the
 * registered cache as long as the compiled rules are unchanged:
 * <pre>{@code
 * IgnoreLoader loader = IgnoreLoader.create(IgnoreConfig.loadDefault(), tracer);
 * IgnoreMatcher matcher = loader.load(Path.of(".stignore"), true);
 * if (matcher.match("build/output.o")) {
 *     // skip
 * }
 * }</pre>
 *
 * Loading is synchronous and all-or-nothing; it is not meant to run concurrently with
 * itself. The returned matchers are safe for concurrent use.
 */
public class IgnoreLoader {
    private static final Logger logger = Logger.getLogger(IgnoreLoader.class.getName());

    private final IIgnoreCompiler compiler;
    private final MatchCacheRegistry registry;

    public IgnoreLoader(IIgnoreCompiler compiler, MatchCacheRegistry registry) {
        this.compiler = compiler;
        this.registry = registry;
    }

    public static IgnoreLoader create(IgnoreConfig config, Tracer tracer) {
        IIgnoreCompiler compiler = new IgnoreFileCompiler(tracer, new GlobTranslator(config.isCaseInsensitive()));
        MatchCacheRegistry registry = new MatchCacheRegistry(fingerprint -> MatchResultCache.builder(fingerprint)
                .maxSize(config.getCacheMaxSize())
                .recordStats(config.isRecordStats())
                .build());
        return new IgnoreLoader(compiler, registry);
    }

    /**
     * Compiles {@code file} and everything it includes.
     *
     * @param cache whether to bind a result cache, reused from earlier loads of the same file
     *              when the compiled rules are identical
     * @throws IgnoreCompilationException if compilation fails; the registry is left untouched
     */
    public IgnoreMatcher load(Path file, boolean cache) {
        RuleSet ruleSet = compiler.compile(file);
        if (!cache) {
            return new IgnoreMatcher(ruleSet);
        }

        Path source = InclusionChain.canonicalize(file);
        MatchResultCache bound = registry.bind(source, ruleSet.fingerprint());
        logger.fine(() -> "Loaded " + ruleSet.size() + " predicates from " + source
                + " (cached entries: " + bound.size() + ")");
        return new IgnoreMatcher(ruleSet, bound);
    }

    /**
     * Compiles rules from an open source without caching.
     *
     * @param logicalName name used to resolve relative includes; the source may not include itself
     * @throws IgnoreCompilationException if compilation fails
     */
    public IgnoreMatcher parse(Reader reader, String logicalName) {
        return new IgnoreMatcher(compiler.compile(reader, logicalName));
    }

    public MatchCacheRegistry registry() {
        return registry;
    }
}
