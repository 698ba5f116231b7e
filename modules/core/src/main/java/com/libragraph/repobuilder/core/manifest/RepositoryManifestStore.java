package com.libragraph.repobuilder.core.manifest;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.formats.api.Archiver;
import com.libragraph.repobuilder.util.DigestEngine;
import com.libragraph.repobuilder.util.PathNames;
import com.libragraph.repobuilder.util.TemporaryDirectory;
import com.libragraph.repobuilder.util.TemporaryFile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads the persisted database of a repository: the repository manifest from
 * database archive 1 and the package manifests from database archive 2.
 */
@ApplicationScoped
public class RepositoryManifestStore {

    private static final Logger log = Logger.getLogger(RepositoryManifestStore.class);

    public static final String MPM_INI = "mpm.ini";
    public static final String PACKAGE_MANIFESTS_INI = "package-manifests.ini";

    private final BuildSession session;
    private final Archiver archiver;
    private final PackageManifestCodec codec;

    @Inject
    public RepositoryManifestStore(BuildSession session, Archiver archiver, PackageManifestCodec codec) {
        this.session = session;
        this.archiver = archiver;
        this.codec = codec;
    }

    public RepositoryManifest loadRepositoryManifest(Path repository) {
        Path archive = repository.resolve(session.databaseArchiveName(1));
        if (!Files.isRegularFile(archive)) {
            throw new RepositoryBuildException("The repository manifest archive file does not exist.");
        }
        log.debugf("Loading repository manifest from %s...", archive);
        try (TemporaryFile ini = TemporaryFile.create()) {
            archiver.extractFile(archive, session.archiveFormat(), MPM_INI, ini.path());
            return RepositoryManifest.read(ini.path());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + archive, e);
        }
    }

    /** All package manifests of the repository, keyed by id. */
    public SortedMap<String, PackageInfo> loadPackageManifests(Path repository) {
        Path archive = repository.resolve(session.databaseArchiveName(2));
        if (!Files.isRegularFile(archive)) {
            throw new RepositoryBuildException("The TPM archive file does not exist.");
        }
        SortedMap<String, PackageInfo> table = new TreeMap<>();
        try (TemporaryDirectory tmp = TemporaryDirectory.create()) {
            archiver.extract(archive, session.archiveFormat(), tmp.path());
            Path dir = tmp.path().resolve(session.layout().packageManifestDirectory());
            if (!Files.isDirectory(dir)) {
                return table;
            }
            List<Path> manifests;
            try (Stream<Path> list = Files.list(dir)) {
                manifests = list
                        .filter(p -> DigestEngine.isPackageManifest(p.getFileName().toString()))
                        .sorted()
                        .collect(Collectors.toList());
            }
            for (Path file : manifests) {
                PackageInfo info = codec.read(file);
                info.setId(PathNames.stripExtension(file.getFileName().toString()));
                table.put(info.id(), info);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + archive, e);
        }
        log.debugf("loaded %d package manifests", table.size());
        return table;
    }
}
