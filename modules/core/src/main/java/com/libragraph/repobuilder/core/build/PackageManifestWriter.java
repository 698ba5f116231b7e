package com.libragraph.repobuilder.core.build;

import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.manifest.IniStore;
import com.libragraph.repobuilder.core.manifest.PackageManifestCodec;
import com.libragraph.repobuilder.core.manifest.RepositoryManifest;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.util.DigestEngine;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Writes package manifests of a package table, stamped with the packaging
 * time the repository manifest records for each package. Ignored packages are
 * left out.
 */
@ApplicationScoped
public class PackageManifestWriter {

    private static final Logger log = Logger.getLogger(PackageManifestWriter.class);

    private final BuildSession session;
    private final PackageManifestCodec codec;

    @Inject
    public PackageManifestWriter(BuildSession session, PackageManifestCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    /** One {@code <id>.tpm} file per package in {@code dir}. */
    public void writeFiles(Map<String, PackageInfo> table, Path dir, RepositoryManifest manifest) {
        log.debugf("writing package manifest files in %s...", dir);
        try {
            Files.createDirectories(dir);
            for (PackageInfo info : table.values()) {
                if (session.selection().isIgnored(info.id())) {
                    continue;
                }
                Path file = dir.resolve(info.id() + DigestEngine.PACKAGE_MANIFEST_SUFFIX);
                Files.deleteIfExists(file);
                codec.write(file, info, timePackaged(info, manifest));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write package manifests to " + dir, e);
        }
    }

    /** All package manifests in one store, signed when the session has a signer. */
    public void dump(Map<String, PackageInfo> table, Path file, RepositoryManifest manifest) {
        log.debugf("dumping package manifests to %s...", file);
        IniStore store = new IniStore();
        for (PackageInfo info : table.values()) {
            if (!session.selection().isIgnored(info.id())) {
                codec.put(store, info, timePackaged(info, manifest));
            }
        }
        store.write(file, session.signer());
    }

    private static long timePackaged(PackageInfo info, RepositoryManifest manifest) {
        return manifest.timePackaged(info.id()).orElse(PackageInfo.UNKNOWN_TIME);
    }
}
