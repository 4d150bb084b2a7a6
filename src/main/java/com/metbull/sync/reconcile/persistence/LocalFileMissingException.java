package com.metbull.sync.reconcile.persistence;

import java.nio.file.Path;

public class LocalFileMissingException extends RuntimeException {
    private final transient Path path;

    public LocalFileMissingException(Path path) {
        super("dataset file not found: " + path);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
