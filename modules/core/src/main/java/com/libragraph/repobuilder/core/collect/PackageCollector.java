package com.libragraph.repobuilder.core.collect;

import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.core.staging.StagingDirectoryCodec;
import com.libragraph.repobuilder.util.DigestEngine;
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
 * Builds the package table from staging roots. Every sub-directory of a root
 * holding a {@code package.ini} is one package.
 */
@ApplicationScoped
public class PackageCollector {

    private static final Logger log = Logger.getLogger(PackageCollector.class);

    private final BuildSession session;
    private final StagingDirectoryCodec staging;
    private final FileCollector files;

    @Inject
    public PackageCollector(BuildSession session, StagingDirectoryCodec staging, FileCollector files) {
        this.session = session;
        this.staging = staging;
        this.files = files;
    }

    /**
     * Collects all packages below the given roots, keyed by id. Ignored packages
     * are skipped; the first occurrence of an id wins.
     */
    public SortedMap<String, PackageInfo> collectPackages(List<Path> stagingRoots) {
        SortedMap<String, PackageInfo> table = new TreeMap<>();
        for (Path root : stagingRoots) {
            collectPackages(root, table);
        }
        return table;
    }

    void collectPackages(Path stagingRoot, SortedMap<String, PackageInfo> table) {
        if (!Files.isDirectory(stagingRoot)) {
            return;
        }
        List<Path> dirs;
        try (Stream<Path> list = Files.list(stagingRoot)) {
            dirs = list.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + stagingRoot, e);
        }
        for (Path dir : dirs) {
            if (!staging.isStagingDirectory(dir)) {
                continue;
            }
            PackageInfo info = staging.read(dir);
            if (session.selection().isIgnored(info.id())) {
                continue;
            }
            log.debugf("Collecting %s...", info.id());
            if (table.containsKey(info.id())) {
                log.warnf("warning: %s already collected.", info.id());
                continue;
            }
            collectPackage(info);
            table.put(info.id(), info);
        }
    }

    /**
     * Classifies the files under the package's {@code Files/} directory. When the
     * staging metadata carries no digest it is computed from the files.
     */
    public void collectPackage(PackageInfo info) {
        Path filesDir = info.path().resolve(StagingDirectoryCodec.FILES);
        info.setFiles(files.collect(filesDir));
        if (info.digest() == null) {
            try {
                info.setDigest(DigestEngine.aggregate(DigestEngine.digestFiles(filesDir, info.allFiles())));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to digest " + filesDir, e);
            }
        }
    }
}
