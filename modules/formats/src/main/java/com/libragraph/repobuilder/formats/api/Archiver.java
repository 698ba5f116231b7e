package com.libragraph.repobuilder.formats.api;

import java.nio.file.Path;

/**
 * Format-polymorphic archive operations.
 *
 * <p>Every operation that produces a file deletes a pre-existing output first.
 * Failures surface as {@link ArchiveException}; callers decide whether they are
 * fatal.
 */
public interface Archiver {

    /**
     * Archives {@code member} (a file or directory relative to
     * {@code workingDirectory}) into {@code archive}.
     */
    void create(ArchiveFormat format, Path workingDirectory, String member, Path archive);

    /**
     * Creates an uncompressed tar file. When {@code workingDirectory} is null or
     * does not exist the tar is empty; otherwise {@code member} is added relative
     * to it.
     */
    void createTar(Path tarFile, Path workingDirectory, String member);

    /** Applies the compression layer of {@code format} to {@code file}. The input is kept. */
    void compress(Path file, ArchiveFormat format, Path outFile);

    /** Extracts every member of {@code archive} into {@code outDir}. */
    void extract(Path archive, ArchiveFormat format, Path outDir);

    /** Streams the single member {@code member} of {@code archive} into {@code outFile}. */
    void extractFile(Path archive, ArchiveFormat format, String member, Path outFile);
}
