package com.libragraph.repobuilder.core.build;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.categorize.AutoCategorizer;
import com.libragraph.repobuilder.core.collect.PackageCollector;
import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.config.RunMode;
import com.libragraph.repobuilder.core.config.RunRequest;
import com.libragraph.repobuilder.core.manifest.RepositoryManifest;
import com.libragraph.repobuilder.core.manifest.RepositoryManifestStore;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.core.staging.PackageDisassembler;
import com.libragraph.repobuilder.core.staging.StagingDirectoryCodec;
import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Entry point of every run mode. Each mode validates its inputs and then
 * composes the collector, archive service and database writer.
 */
@ApplicationScoped
public class RepositoryBuilder {

    private static final Logger log = Logger.getLogger(RepositoryBuilder.class);

    private final BuildSession session;
    private final PackageCollector collector;
    private final StagingDirectoryCodec staging;
    private final RepositoryManifestStore store;
    private final PackageArchiveService archives;
    private final RepositoryDatabaseWriter database;
    private final HierarchyBuilder hierarchy;
    private final PackageManifestWriter manifests;
    private final AutoCategorizer categorizer;
    private final PackageDisassembler disassembler;

    @Inject
    public RepositoryBuilder(BuildSession session,
                             PackageCollector collector,
                             StagingDirectoryCodec staging,
                             RepositoryManifestStore store,
                             PackageArchiveService archives,
                             RepositoryDatabaseWriter database,
                             HierarchyBuilder hierarchy,
                             PackageManifestWriter manifests,
                             AutoCategorizer categorizer,
                             PackageDisassembler disassembler) {
        this.session = session;
        this.collector = collector;
        this.staging = staging;
        this.store = store;
        this.archives = archives;
        this.database = database;
        this.hierarchy = hierarchy;
        this.manifests = manifests;
        this.categorizer = categorizer;
        this.disassembler = disassembler;
    }

    public void run(RunRequest request) {
        RunMode mode = request.mode()
                .orElseThrow(() -> new RepositoryBuildException("No task was specified."));
        switch (mode) {
            case CREATE_PACKAGE:
                createPackage(request.stagingDir().orElseGet(() -> Path.of("").toAbsolutePath()),
                        require(request.repository(), "No repository location was specified."));
                break;
            case DISASSEMBLE:
                disassemble(
                        require(request.tpmFile(), "No package manifest file has been specified."),
                        require(request.texmfParent(), "No TEXMF parent directory has been specified."),
                        require(request.stagingDir(), "No staging directory has been specified."));
                break;
            case BUILD_HIERARCHY:
                buildHierarchy(collect(request.stagingRoots()),
                        require(request.texmfParent(), "No TEXMF parent directory has been specified."),
                        request.tpmDir());
                break;
            case UPDATE_REPOSITORY:
                SortedMap<String, PackageInfo> table = collect(request.stagingRoots());
                updateRepository(table,
                        require(request.repository(), "No repository location was specified."));
                break;
            case VERSION:
                break;
        }
    }

    /**
     * Installs the packages under {@code texmfParent} and writes the resulting
     * repository manifest into the tree's configuration directory.
     */
    public RepositoryManifest buildHierarchy(SortedMap<String, PackageInfo> table,
                                             Path texmfParent,
                                             Optional<Path> tpmDir) {
        RepositoryManifest manifest = RepositoryManifest.empty();
        hierarchy.build(table, texmfParent, manifest);
        tpmDir.ifPresent(dir -> manifests.writeFiles(table, dir, manifest));
        Path ini = texmfParent.resolve(session.layout().mpmIniPath());
        try {
            Files.createDirectories(ini.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + ini.getParent(), e);
        }
        manifest.write(ini, session.signer());
        log.infof("installed %d packages into %s", table.size(), texmfParent);
        return manifest;
    }

    /** Brings the repository in line with {@code table}, dropping packages no longer staged. */
    public RepositoryManifest updateRepository(SortedMap<String, PackageInfo> table, Path repository) {
        RepositoryManifest manifest = store.loadRepositoryManifest(repository);
        if (session.autoCategorize()) {
            categorizer.categorize(table);
        }
        update(table, repository, manifest);
        database.write(table, repository, true, manifest);
        log.infof("repository %s: %d packages", repository, manifest.size());
        return manifest;
    }

    /** Adds or replaces one staged package in an existing repository. */
    public RepositoryManifest createPackage(Path stagingDir, Path repository) {
        log.debugf("Loading repository manifest from %s...", repository);
        RepositoryManifest manifest = store.loadRepositoryManifest(repository);
        SortedMap<String, PackageInfo> table = store.loadPackageManifests(repository);
        log.debugf("Reading staging directory %s...", stagingDir);
        PackageInfo info = staging.read(stagingDir);
        collector.collectPackage(info);
        table.put(info.id(), info);
        update(table, repository, manifest);
        log.debugf("Writing database to %s...", repository);
        database.write(table, repository, false, manifest);
        return manifest;
    }

    public PackageInfo disassemble(Path packageManifestFile, Path texmfParent, Path stagingDir) {
        return disassembler.disassemble(packageManifestFile, texmfParent, stagingDir);
    }

    /**
     * Archives every package that is neither ignored nor a pure container and
     * records it in {@code manifest}.
     */
    public void update(SortedMap<String, PackageInfo> table, Path repository, RepositoryManifest manifest) {
        for (PackageInfo info : table.values()) {
            String id = info.id();
            if (session.selection().isIgnored(id) || info.isPureContainer()) {
                continue;
            }
            manifest.put(id, RepositoryManifest.LEVEL, String.valueOf(session.selection().level(id).code()));
            ArchiveFormat format = archives.createArchiveFile(info, repository, manifest);
            manifest.put(id, RepositoryManifest.MD5, info.digest().toHex());
            manifest.put(id, RepositoryManifest.TIME_PACKAGED, Long.toString(info.timePackaged()));
            manifest.put(id, RepositoryManifest.CAB_SIZE, Long.toString(info.archiveFileSize()));
            manifest.put(id, RepositoryManifest.CAB_MD5, info.archiveFileDigest().toHex());
            manifest.put(id, RepositoryManifest.TYPE, format.typeName());
            putOrDelete(manifest, id, RepositoryManifest.VERSION, info.version());
            putOrDelete(manifest, id, RepositoryManifest.TARGET_SYSTEM, info.targetSystem());
            putOrDelete(manifest, id, RepositoryManifest.MIN_TARGET_SYSTEM_VERSION, info.minTargetSystemVersion());
        }
    }

    private SortedMap<String, PackageInfo> collect(List<Path> stagingRoots) {
        if (stagingRoots.isEmpty()) {
            throw new RepositoryBuildException("No staging roots were specified.");
        }
        SortedMap<String, PackageInfo> table = collector.collectPackages(stagingRoots);
        if (table.isEmpty()) {
            throw new RepositoryBuildException("No staging directories were found.");
        }
        return table;
    }

    private static void putOrDelete(RepositoryManifest manifest, String id, String key, String value) {
        if (value.isEmpty()) {
            manifest.delete(id, key);
        } else {
            manifest.put(id, key, value);
        }
    }

    private static <T> T require(Optional<T> value, String message) {
        return value.orElseThrow(() -> new RepositoryBuildException(message));
    }
}
