package com.libragraph.repobuilder.core.config;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.manifest.FilePrivateKeyProvider;
import com.libragraph.repobuilder.core.manifest.ManifestSigner;
import com.libragraph.repobuilder.core.model.PackageListReader;
import com.libragraph.repobuilder.core.model.PackageSelection;
import com.libragraph.repobuilder.core.model.SeriesVersion;
import com.libragraph.repobuilder.core.model.TexmfLayout;
import com.libragraph.repobuilder.types.PackageLevel;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns {@code repobuilder.*} configuration into the run's {@link BuildSession}
 * and {@link RunRequest}.
 */
@ApplicationScoped
public class BuildSessionProducer {

    private static final Logger log = Logger.getLogger(BuildSessionProducer.class);

    @ConfigProperty(name = "repobuilder.mode")
    Optional<String> mode;

    @ConfigProperty(name = "repobuilder.staging-roots")
    Optional<List<String>> stagingRoots;

    @ConfigProperty(name = "repobuilder.staging-dir")
    Optional<String> stagingDir;

    @ConfigProperty(name = "repobuilder.repository")
    Optional<String> repository;

    @ConfigProperty(name = "repobuilder.texmf-parent")
    Optional<String> texmfParent;

    @ConfigProperty(name = "repobuilder.tpm-dir")
    Optional<String> tpmDir;

    @ConfigProperty(name = "repobuilder.tpm-file")
    Optional<String> tpmFile;

    @ConfigProperty(name = "repobuilder.texmf-prefix", defaultValue = BuildSession.DEFAULT_TEXMF_PREFIX)
    String texmfPrefix;

    @ConfigProperty(name = "repobuilder.series", defaultValue = "4.0")
    String series;

    @ConfigProperty(name = "repobuilder.default-level", defaultValue = "T")
    String defaultLevel;

    @ConfigProperty(name = "repobuilder.release-state", defaultValue = "stable")
    String releaseState;

    @ConfigProperty(name = "repobuilder.time-packaged")
    Optional<Long> timePackaged;

    @ConfigProperty(name = "repobuilder.package-list")
    Optional<String> packageList;

    @ConfigProperty(name = "repobuilder.private-key-file")
    Optional<String> privateKeyFile;

    @ConfigProperty(name = "repobuilder.passphrase-file")
    Optional<String> passphraseFile;

    @ConfigProperty(name = "repobuilder.auto-categorize", defaultValue = "true")
    boolean autoCategorize;

    @ConfigProperty(name = "repobuilder.last-updated-count", defaultValue = "20")
    int lastUpdatedCount;

    @ConfigProperty(name = "repobuilder.db-file-prefix", defaultValue = BuildSession.DEFAULT_DB_FILE_PREFIX)
    String dbFilePrefix;

    @Produces
    @Singleton
    public BuildSession buildSession() {
        SeriesVersion version = parseSeries(series);
        PackageLevel level = parseLevel(defaultLevel);
        PackageSelection selection = packageList
                .map(p -> new PackageListReader().read(Path.of(p), level))
                .orElseGet(() -> PackageSelection.unlisted(level));
        Optional<ManifestSigner> signer = ManifestSigner.fromProvider(new FilePrivateKeyProvider(
                privateKeyFile.filter(s -> !s.isBlank()).map(Path::of),
                passphraseFile.filter(s -> !s.isBlank()).map(Path::of)));
        long startTime = timePackaged.orElseGet(() -> Instant.now().getEpochSecond());

        log.debugf("session: series=%s, prefix=%s, default level=%s, %d listed packages, signed=%s",
                version, texmfPrefix, level.code(), selection.size(), signer.isPresent());
        return new BuildSession(startTime, new TexmfLayout(texmfPrefix), version, selection,
                releaseState, signer, autoCategorize, lastUpdatedCount, dbFilePrefix);
    }

    @Produces
    @Singleton
    public RunRequest runRequest() {
        Optional<RunMode> runMode = mode.map(m -> RunMode.fromConfigName(m)
                .orElseThrow(() -> new RepositoryBuildException("Unknown mode: " + m)));
        List<Path> roots = stagingRoots.orElse(List.of()).stream()
                .filter(s -> !s.isBlank())
                .map(String::strip)
                .map(Path::of)
                .collect(Collectors.toList());
        return new RunRequest(runMode, roots,
                path(stagingDir), path(repository), path(texmfParent), path(tpmDir), path(tpmFile));
    }

    static SeriesVersion parseSeries(String text) {
        SeriesVersion version;
        try {
            version = SeriesVersion.parse(text);
        } catch (IllegalArgumentException e) {
            throw new RepositoryBuildException(e.getMessage(), e);
        }
        if (version.compareTo(SeriesVersion.SUPPORTED) > 0) {
            throw new RepositoryBuildException("Unsupported major/minor version: " + version);
        }
        return version;
    }

    static PackageLevel parseLevel(String text) {
        if (text.isEmpty()) {
            throw new RepositoryBuildException("Missing package level.");
        }
        try {
            return PackageLevel.fromCode(text.charAt(0));
        } catch (IllegalArgumentException e) {
            throw new RepositoryBuildException(e.getMessage(), e);
        }
    }

    private static Optional<Path> path(Optional<String> value) {
        return value.filter(s -> !s.isBlank()).map(Path::of);
    }
}
