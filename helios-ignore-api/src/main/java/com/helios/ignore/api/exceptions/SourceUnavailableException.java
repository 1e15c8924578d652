/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.exceptions;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * An ignore file could not be opened or read.
 */
public class SourceUnavailableException extends IgnoreCompilationException {

    private final Path file;

    public SourceUnavailableException(Path file, IOException cause) {
        super("Cannot read ignore file \"" + file + "\": " + cause.getMessage(), file.toString(), cause);
        this.file = file;
    }

    /**
     * The include target is not a valid path on this file system, so no file can be named.
     */
    public SourceUnavailableException(String target, String includedFrom, InvalidPathException cause) {
        super("Invalid include path \"" + target + "\": " + cause.getReason(), includedFrom, cause);
        this.file = null;
    }

    /**
     * @return the file that could not be read, or null if the include target was not a valid path
     */
    public Path getFile() {
        return file;
    }
}
