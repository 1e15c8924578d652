/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.compiler;

import com.helios.ignore.api.model.PathPredicate;
import com.helios.ignore.api.model.Polarity;

import java.nio.file.Path;
import java.util.List;

/**
 * Compiles one preprocessed rule line into predicates.
 *
 * <p>Forms, in priority order after an optional leading {@code !}:
 * <ol>
 *   <li>{@code /pattern}: anchored at the root, one predicate</li>
 *   <li>{@code **}{@code /pattern}: the pattern as given plus the pattern without the prefix</li>
 *   <li>{@code #include file}: the included file's predicates, spliced in place</li>
 *   <li>anything else: the pattern as given plus {@code **}{@code /pattern}</li>
 * </ol>
 * Any other line starting with {@code #} is an ordinary pattern containing a {@code #}.
 */
public class PatternCompiler {

    static final String NEGATION_PREFIX = "!";
    static final String ROOT_PREFIX = "/";
    static final String ANY_DEPTH_PREFIX = "**/";
    static final String INCLUDE_PREFIX = "#include ";

    private final GlobTranslator translator;
    private final IncludeResolver includeResolver;

    public PatternCompiler(GlobTranslator translator, IncludeResolver includeResolver) {
        this.translator = translator;
        this.includeResolver = includeResolver;
    }

    /**
     * @param line        trimmed, non-empty, non-comment rule text
     * @param currentFile file the line was read from, used to resolve includes
     * @param chain       files seen so far in this load
     */
    public List<PathPredicate> compile(String line, Path currentFile, InclusionChain chain) {
        Polarity polarity = Polarity.SELECT;
        if (line.startsWith(NEGATION_PREFIX)) {
            line = line.substring(NEGATION_PREFIX.length());
            polarity = Polarity.DESELECT;
        }

        if (line.startsWith(ROOT_PREFIX)) {
            return List.of(predicate(line.substring(ROOT_PREFIX.length()), polarity));
        } else if (line.startsWith(ANY_DEPTH_PREFIX)) {
            return List.of(
                    predicate(line, polarity),
                    predicate(line.substring(ANY_DEPTH_PREFIX.length()), polarity));
        } else if (line.startsWith(INCLUDE_PREFIX)) {
            String target = line.substring(INCLUDE_PREFIX.length()).strip();
            return includeResolver.resolve(target, currentFile, chain);
        } else {
            return List.of(
                    predicate(line, polarity),
                    predicate(ANY_DEPTH_PREFIX + line, polarity));
        }
    }

    private PathPredicate predicate(String glob, Polarity polarity) {
        return new PathPredicate(translator.translate(glob), polarity);
    }
}
