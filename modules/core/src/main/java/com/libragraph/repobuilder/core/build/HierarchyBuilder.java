package com.libragraph.repobuilder.core.build;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.manifest.PackageManifestCodec;
import com.libragraph.repobuilder.core.manifest.RepositoryManifest;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.core.staging.StagingDirectoryCodec;
import com.libragraph.repobuilder.util.DigestEngine;
import com.libragraph.repobuilder.util.FileDigestTable;
import com.libragraph.repobuilder.util.Md5Digest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Materialises staged packages as one installed TEXMF tree and records each of
 * them in a repository manifest.
 */
@ApplicationScoped
public class HierarchyBuilder {

    private static final Logger log = Logger.getLogger(HierarchyBuilder.class);

    private final BuildSession session;
    private final PackageManifestCodec codec;

    @Inject
    public HierarchyBuilder(BuildSession session, PackageManifestCodec codec) {
        this.session = session;
        this.codec = codec;
    }

    /** Copies every package of {@code table} into {@code texmfParent}. */
    public void build(Map<String, PackageInfo> table, Path texmfParent, RepositoryManifest manifest) {
        for (PackageInfo info : table.values()) {
            copyPackage(info, texmfParent, manifest);
        }
    }

    void copyPackage(PackageInfo info, Path destDir, RepositoryManifest manifest) {
        log.debugf("Copying %s...", info.id());
        String id = info.id();
        long time = session.startTime();
        try {
            Path filesDir = info.path().resolve(StagingDirectoryCodec.FILES);
            FileDigestTable digests = new FileDigestTable();
            if (Files.isDirectory(filesDir)) {
                for (String file : info.allFiles()) {
                    Path source = filesDir.resolve(file);
                    if (!Files.isRegularFile(source)) {
                        throw new RepositoryBuildException("No match for " + source);
                    }
                    Path dest = destDir.resolve(file);
                    Files.createDirectories(dest.getParent());
                    digests.put(file, DigestEngine.copyAndHash(source, dest).digest());
                }
            }
            Md5Digest digest = DigestEngine.aggregate(digests);
            if (!digest.equals(info.digest())) {
                throw new RepositoryBuildException("Bad TDS digest (" + id + ").");
            }

            // written after the copy so a stale staged manifest cannot replace it
            Path tpm = destDir.resolve(session.layout().packageManifestPath(id));
            Files.createDirectories(tpm.getParent());
            codec.write(tpm, info, time);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy " + id, e);
        }

        manifest.put(id, RepositoryManifest.LEVEL, String.valueOf(session.selection().level(id).code()));
        manifest.put(id, RepositoryManifest.MD5, info.digest().toHex());
        manifest.put(id, RepositoryManifest.TIME_PACKAGED, Long.toString(time));
        putIfNotEmpty(manifest, id, RepositoryManifest.VERSION, info.version());
        putIfNotEmpty(manifest, id, RepositoryManifest.TARGET_SYSTEM, info.targetSystem());
        putIfNotEmpty(manifest, id, RepositoryManifest.MIN_TARGET_SYSTEM_VERSION, info.minTargetSystemVersion());
    }

    private static void putIfNotEmpty(RepositoryManifest manifest, String id, String key, String value) {
        if (!value.isEmpty()) {
            manifest.put(id, key, value);
        }
    }
}
