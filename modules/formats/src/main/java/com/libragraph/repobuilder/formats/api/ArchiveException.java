package com.libragraph.repobuilder.formats.api;

/**
 * Wraps failures of archive operations, including checked I/O exceptions.
 */
public class ArchiveException extends RuntimeException {

    public ArchiveException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArchiveException(String message) {
        super(message);
    }
}
