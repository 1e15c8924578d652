/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.compiler;

import com.helios.ignore.api.exceptions.SourceUnavailableException;
import com.helios.ignore.api.model.PathPredicate;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Loads ignore files referenced by {@code #include} directives, rejecting files that were
 * already seen in the current load.
 */
public class IncludeResolver {
    private static final Logger logger = Logger.getLogger(IncludeResolver.class.getName());

    /**
     * Compiles the body of one opened file. Implemented by the file compiler, which
     * re-enters line preprocessing and pattern compilation for nested files.
     */
    @FunctionalInterface
    public interface BodyCompiler {
        List<PathPredicate> compile(BufferedReader reader, Path file, InclusionChain chain);
    }

    private final BodyCompiler bodyCompiler;

    public IncludeResolver(BodyCompiler bodyCompiler) {
        this.bodyCompiler = bodyCompiler;
    }

    /**
     * Resolves an include target against the directory of the including file and loads it.
     *
     * @param target      include path as written after {@code #include }
     * @param currentFile the file containing the directive
     * @param chain       files seen so far in this load
     * @return predicates of the included file, in declaration order
     * @throws SourceUnavailableException if the target is not a valid path or cannot be read
     */
    public List<PathPredicate> resolve(String target, Path currentFile, InclusionChain chain) {
        Path includeFile = resolveTarget(target, currentFile);
        logger.fine(() -> "Including " + includeFile + " from " + currentFile);
        return load(includeFile, currentFile, chain);
    }

    /**
     * Opens and compiles {@code file}.
     *
     * @param includedFrom the including file, or null for the root of a load
     */
    public List<PathPredicate> load(Path file, Path includedFrom, InclusionChain chain) {
        chain.enter(file, includedFrom);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return bodyCompiler.compile(reader, file, chain);
        } catch (IOException e) {
            throw new SourceUnavailableException(file, e);
        }
    }

    private static Path resolveTarget(String target, Path currentFile) {
        try {
            return resolvePath(target, currentFile);
        } catch (InvalidPathException e) {
            throw new SourceUnavailableException(target, currentFile.toString(), e);
        }
    }

    static Path resolvePath(String target, Path currentFile) {
        Path parent = currentFile.toAbsolutePath().getParent();
        Path includeFile = parent == null ? Path.of(target) : parent.resolve(target);
        return includeFile.normalize();
    }
}
