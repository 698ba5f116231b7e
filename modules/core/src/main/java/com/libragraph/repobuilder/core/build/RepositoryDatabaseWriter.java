package com.libragraph.repobuilder.core.build;

import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.manifest.RepositoryManifest;
import com.libragraph.repobuilder.core.manifest.RepositoryManifestStore;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.core.model.TexmfLayout;
import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.formats.api.Archiver;
import com.libragraph.repobuilder.util.TemporaryDirectory;
import com.libragraph.repobuilder.util.TemporaryFile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Persists the repository database next to the package archives: the three
 * database archives, the file index, and the summary. Superseded archives are
 * removed before the summary is written so its listing digest sees the final
 * directory.
 */
@ApplicationScoped
public class RepositoryDatabaseWriter {

    private static final Logger log = Logger.getLogger(RepositoryDatabaseWriter.class);

    private final BuildSession session;
    private final Archiver archiver;
    private final PackageManifestWriter manifests;
    private final FileListWriter fileList;
    private final ObsoleteArchiveCleaner cleaner;
    private final RepositoryInfoWriter info;

    @Inject
    public RepositoryDatabaseWriter(BuildSession session,
                                    Archiver archiver,
                                    PackageManifestWriter manifests,
                                    FileListWriter fileList,
                                    ObsoleteArchiveCleaner cleaner,
                                    RepositoryInfoWriter info) {
        this.session = session;
        this.archiver = archiver;
        this.manifests = manifests;
        this.fileList = fileList;
        this.cleaner = cleaner;
        this.info = info;
    }

    /**
     * @param prune drop manifest sections of packages that are no longer in
     *              {@code table} or are ignored
     */
    public void write(Map<String, PackageInfo> table, Path repository, boolean prune, RepositoryManifest manifest) {
        if (prune) {
            List<String> removed = manifest.prune(table.keySet(), session.selection()::isIgnored);
            if (!removed.isEmpty()) {
                log.debugf("removed %d obsolete package sections", removed.size());
            }
        }
        ArchiveFormat format = session.archiveFormat();
        try {
            try (TemporaryFile ini = TemporaryFile.at(repository.resolve(RepositoryManifestStore.MPM_INI))) {
                manifest.write(ini.path(), session.signer());
                archiver.create(format, repository, RepositoryManifestStore.MPM_INI,
                        repository.resolve(session.databaseArchiveName(1)));
            }

            String prefix = session.layout().prefix();
            try (TemporaryDirectory texmf = TemporaryDirectory.create(repository.resolve(prefix))) {
                manifests.writeFiles(table, texmf.path().resolve(TexmfLayout.PACKAGE_MANIFEST_DIR), manifest);
                archiver.create(format, repository, prefix, repository.resolve(session.databaseArchiveName(2)));
            }

            try (TemporaryFile dump = TemporaryFile.at(repository.resolve(RepositoryManifestStore.PACKAGE_MANIFESTS_INI))) {
                manifests.dump(table, dump.path(), manifest);
                archiver.create(format, repository, RepositoryManifestStore.PACKAGE_MANIFESTS_INI,
                        repository.resolve(session.databaseArchiveName(3)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write the database of " + repository, e);
        }

        fileList.write(table, repository);
        cleaner.clean(repository);
        info.write(repository, manifest, table);
    }
}
