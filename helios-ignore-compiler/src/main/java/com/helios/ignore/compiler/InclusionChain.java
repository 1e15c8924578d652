/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.compiler;

import com.helios.ignore.api.exceptions.IncludeCycleException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Canonical identifiers of the files seen during one load.
 *
 * <p>Entries are never removed, so a file reachable twice (whether through a cycle or two
 * sibling includes) is rejected. An instance lives only for the duration of one load and
 * is not thread-safe.
 */
public final class InclusionChain {
    private static final Logger logger = Logger.getLogger(InclusionChain.class.getName());

    private final Set<Path> seen = new HashSet<>();
    private final List<Path> loaded = new ArrayList<>();

    /**
     * Records a name that is already being compiled without being read from disk,
     * e.g. the logical name of an in-memory source.
     */
    public void markSeen(Path file) {
        seen.add(canonicalize(file));
    }

    /**
     * Records that {@code file} is about to be read.
     *
     * @param includedFrom the including file, for error reporting; null for the root file
     * @return the canonical identifier of {@code file}
     * @throws IncludeCycleException if the file has already been seen in this load
     */
    public Path enter(Path file, Path includedFrom) {
        Path canonical = canonicalize(file);
        if (!seen.add(canonical)) {
            throw new IncludeCycleException(canonical, includedFrom == null ? null : includedFrom.toString());
        }
        loaded.add(canonical);
        return canonical;
    }

    /**
     * Files entered so far, in the order they were opened.
     */
    public List<Path> loadedFiles() {
        return List.copyOf(loaded);
    }

    /**
     * Real path when the file exists, otherwise the absolute normalized path.
     */
    public static Path canonicalize(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        if (Files.exists(absolute)) {
            try {
                return absolute.toRealPath();
            } catch (IOException e) {
                logger.log(Level.FINE, "Could not resolve real path of " + absolute + ", using absolute path", e);
            }
        }
        return absolute;
    }
}
