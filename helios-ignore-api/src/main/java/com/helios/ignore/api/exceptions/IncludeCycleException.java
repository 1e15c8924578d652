/*
 * Copyright (c) 2025 Helios Ignore Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.helios.ignore.api.exceptions;

import java.nio.file.Path;

/**
 * A file was reached twice within one load, either through a cycle or a repeated include.
 */
public class IncludeCycleException extends IgnoreCompilationException {

    private final Path file;

    public IncludeCycleException(Path file, String includedFrom) {
        super("Multiple include of ignore file \"" + file + "\"", includedFrom);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
