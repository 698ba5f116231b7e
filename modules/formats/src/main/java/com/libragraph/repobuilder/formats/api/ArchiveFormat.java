package com.libragraph.repobuilder.formats.api;

import java.util.List;
import java.util.Optional;

/**
 * Closed set of archive formats a repository can hold.
 *
 * <p>Each variant carries its file-name suffix, the type name recorded in the
 * repository manifest, and the container/compression pair the embedded backend
 * dispatches on. Command templates for the external backend are kept in one
 * table in {@code ExternalArchiver}.
 */
public enum ArchiveFormat {
    CABINET(".cab", "MSCab", Container.CABINET, Compression.NONE),
    TAR_BZIP2(".tar.bz2", "TarBzip2", Container.TAR, Compression.BZIP2),
    ZIP(".zip", "Zip", Container.ZIP, Compression.NONE),
    TAR(".tar", "Tar", Container.TAR, Compression.NONE),
    TAR_LZMA(".tar.lzma", "TarLzma", Container.TAR, Compression.LZMA);

    public enum Container { CABINET, TAR, ZIP }

    public enum Compression { NONE, BZIP2, LZMA }

    /**
     * Order in which existing package archives are probed; a later hit wins, so
     * the newest format present for a package is the one used.
     */
    public static final List<ArchiveFormat> PROBE_ORDER = List.of(CABINET, TAR_BZIP2, TAR_LZMA);

    private final String extension;
    private final String typeName;
    private final Container container;
    private final Compression compression;

    ArchiveFormat(String extension, String typeName, Container container, Compression compression) {
        this.extension = extension;
        this.typeName = typeName;
        this.container = container;
        this.compression = compression;
    }

    public String extension() {
        return extension;
    }

    /** Name stored in the {@code Type} field of the repository manifest. */
    public String typeName() {
        return typeName;
    }

    public Container container() {
        return container;
    }

    public Compression compression() {
        return compression;
    }

    /** {@code id + extension}, e.g. {@code a0poster.tar.lzma}. */
    public String fileName(String baseName) {
        return baseName + extension;
    }

    /**
     * Format for new archives of the given target series: TarBzip2 before 2.7,
     * TarLzma from 2.7 on.
     */
    public static ArchiveFormat forSeries(int major, int minor) {
        if (major < 2 || (major == 2 && minor < 7)) {
            return TAR_BZIP2;
        }
        return TAR_LZMA;
    }

    public static Optional<ArchiveFormat> fromTypeName(String typeName) {
        for (ArchiveFormat f : values()) {
            if (f.typeName.equals(typeName)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
