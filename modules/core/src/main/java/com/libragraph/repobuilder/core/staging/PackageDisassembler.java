package com.libragraph.repobuilder.core.staging;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.collect.PackageCollector;
import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.manifest.PackageManifestCodec;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.util.DigestEngine;
import com.libragraph.repobuilder.util.DosPathComparator;
import com.libragraph.repobuilder.util.FileDigestTable;
import com.libragraph.repobuilder.util.Md5Digest;
import com.libragraph.repobuilder.util.PathNames;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns an installed package back into a staging directory, given its package
 * manifest file and the TEXMF parent it was installed into.
 */
@ApplicationScoped
public class PackageDisassembler {

    private static final Logger log = Logger.getLogger(PackageDisassembler.class);

    private final BuildSession session;
    private final PackageManifestCodec codec;
    private final StagingDirectoryCodec staging;
    private final PackageCollector collector;

    @Inject
    public PackageDisassembler(BuildSession session,
                               PackageManifestCodec codec,
                               StagingDirectoryCodec staging,
                               PackageCollector collector) {
        this.session = session;
        this.codec = codec;
        this.staging = staging;
        this.collector = collector;
    }

    /**
     * @param packageManifestFile the installed {@code <id>.tpm}
     * @param sourceDir           the TEXMF parent holding the package's files
     * @param stagingDir          the staging directory to fill
     * @return the package as now staged, with its recomputed digest
     */
    public PackageInfo disassemble(Path packageManifestFile, Path sourceDir, Path stagingDir) {
        log.debugf("Parsing %s...", packageManifestFile);
        PackageInfo info = codec.read(packageManifestFile);

        // the manifest lists itself as a run file; it is regenerated below
        Path base = sourceDir.toAbsolutePath().normalize();
        Path manifestPath = packageManifestFile.toAbsolutePath().normalize();
        if (manifestPath.startsWith(base)) {
            String self = PathNames.relativize(base, manifestPath);
            List<String> runFiles = new ArrayList<>(info.runFiles());
            runFiles.removeIf(f -> DosPathComparator.INSTANCE.compare(f, self) == 0);
            info.setRunFiles(runFiles, info.sizeRunFiles());
        }
        info.setId(PathNames.stripExtension(packageManifestFile.getFileName().toString()));
        log.debugf(" %s (%d files)...", info.id(), info.numFiles());

        FileDigestTable digests = new FileDigestTable();
        Path filesDir = stagingDir.resolve(StagingDirectoryCodec.FILES);
        try {
            for (String file : info.allFiles()) {
                Path source = sourceDir.resolve(file);
                if (!Files.isRegularFile(source)) {
                    throw new RepositoryBuildException("No match for " + source);
                }
                Path dest = filesDir.resolve(file);
                Files.createDirectories(dest.getParent());
                digests.put(PathNames.toUnix(file), DigestEngine.copyAndHash(source, dest).digest());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to copy the files of " + info.id(), e);
        }
        Md5Digest digest = DigestEngine.aggregate(digests);
        staging.write(stagingDir, info, digests, digest);

        info.setDigest(digest);
        info.setPath(stagingDir);
        collector.collectPackage(info);
        Path tpm = filesDir.resolve(session.layout().packageManifestPath(info.id()));
        try {
            Files.createDirectories(tpm.getParent());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + tpm.getParent(), e);
        }
        codec.write(tpm, info, 0);
        return info;
    }
}
