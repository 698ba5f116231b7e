package com.libragraph.repobuilder.core.config;

import com.libragraph.repobuilder.core.manifest.ManifestSigner;
import com.libragraph.repobuilder.core.model.PackageSelection;
import com.libragraph.repobuilder.core.model.SeriesVersion;
import com.libragraph.repobuilder.core.model.TexmfLayout;
import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.types.PackageLevel;

import java.util.Optional;

/**
 * Settings of one run, created once at startup and handed to every component.
 *
 * @param startTime         run start in epoch seconds, or the explicitly configured
 *                          packaging time; stamped on rebuilt packages and the summary
 * @param layout            TEXMF prefix conventions
 * @param series            target major.minor series
 * @param selection         package selection list with its default level
 * @param releaseState      {@code stable} or {@code next}
 * @param signer            signs written manifests when present
 * @param autoCategorize    whether update-repository groups orphan packages
 * @param lastUpdatedCount  number of ids in the summary's {@code lastupd}
 * @param dbFilePrefix      base name of the database archives
 */
public record BuildSession(long startTime,
                           TexmfLayout layout,
                           SeriesVersion series,
                           PackageSelection selection,
                           String releaseState,
                           Optional<ManifestSigner> signer,
                           boolean autoCategorize,
                           int lastUpdatedCount,
                           String dbFilePrefix) {

    public static final String DEFAULT_TEXMF_PREFIX = "texmf";
    public static final String DEFAULT_DB_FILE_PREFIX = "miktex-zzdb";
    public static final int DEFAULT_LAST_UPDATED_COUNT = 20;

    /** Session with every setting at its default. */
    public static BuildSession defaults(long startTime) {
        return new BuildSession(startTime,
                new TexmfLayout(DEFAULT_TEXMF_PREFIX),
                SeriesVersion.SUPPORTED,
                PackageSelection.unlisted(PackageLevel.TOTAL),
                "stable",
                Optional.empty(),
                true,
                DEFAULT_LAST_UPDATED_COUNT,
                DEFAULT_DB_FILE_PREFIX);
    }

    public BuildSession withSelection(PackageSelection selection) {
        return new BuildSession(startTime, layout, series, selection, releaseState, signer,
                autoCategorize, lastUpdatedCount, dbFilePrefix);
    }

    public BuildSession withSeries(SeriesVersion series) {
        return new BuildSession(startTime, layout, series, selection, releaseState, signer,
                autoCategorize, lastUpdatedCount, dbFilePrefix);
    }

    public BuildSession withSigner(Optional<ManifestSigner> signer) {
        return new BuildSession(startTime, layout, series, selection, releaseState, signer,
                autoCategorize, lastUpdatedCount, dbFilePrefix);
    }

    public BuildSession withAutoCategorize(boolean autoCategorize) {
        return new BuildSession(startTime, layout, series, selection, releaseState, signer,
                autoCategorize, lastUpdatedCount, dbFilePrefix);
    }

    /** Format of new package and database archives. */
    public ArchiveFormat archiveFormat() {
        return series.archiveFormat();
    }

    /**
     * Name of database archive {@code n}: 1 holds {@code mpm.ini}, 2 the package
     * manifest files, 3 {@code package-manifests.ini}; e.g. {@code miktex-zzdb1-4.0.tar.lzma}.
     */
    public String databaseArchiveName(int n) {
        return dbFilePrefix + n + "-" + series + archiveFormat().extension();
    }
}
