package com.libragraph.repobuilder.formats.api;

/**
 * Thrown when a backend cannot perform an operation for a format, e.g. creating
 * cabinet files.
 */
public class UnsupportedArchiveFormatException extends ArchiveException {

    private final ArchiveFormat format;

    public UnsupportedArchiveFormatException(ArchiveFormat format, String operation) {
        super("Unsupported archive file type for " + operation + ": " + format.typeName());
        this.format = format;
    }

    public ArchiveFormat format() {
        return format;
    }
}
