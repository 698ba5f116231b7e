package com.libragraph.repobuilder.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A file that is deleted when closed.
 */
public final class TemporaryFile implements AutoCloseable {

    private final Path path;

    private TemporaryFile(Path path) {
        this.path = path;
    }

    public static TemporaryFile create() throws IOException {
        return new TemporaryFile(Files.createTempFile("repobuilder-", ".tmp"));
    }

    /** Claims {@code path}; any file already there is removed on close as well. */
    public static TemporaryFile at(Path path) {
        return new TemporaryFile(path);
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete temporary file: " + path, e);
        }
    }
}
