package com.libragraph.repobuilder.core.build;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.manifest.PackageManifestCodec;
import com.libragraph.repobuilder.core.manifest.RepositoryManifest;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.core.staging.StagingDirectoryCodec;
import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.formats.api.Archiver;
import com.libragraph.repobuilder.util.DigestEngine;
import com.libragraph.repobuilder.util.Md5Digest;
import com.libragraph.repobuilder.util.TemporaryFile;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Produces the archive of one package in the repository, reusing an existing
 * archive when its content is unchanged.
 *
 * <p>An existing archive is reused only if the digest recorded in the
 * repository manifest and the digest in the package manifest inside the
 * archive both equal the package's current digest. A reused package keeps its
 * packaging time; a rebuilt one is stamped with the session's start time.
 */
@ApplicationScoped
public class PackageArchiveService {

    private static final Logger log = Logger.getLogger(PackageArchiveService.class);

    public record ExistingArchive(Path file, ArchiveFormat format) {
    }

    private final BuildSession session;
    private final Archiver archiver;
    private final PackageManifestCodec codec;

    @Inject
    public PackageArchiveService(BuildSession session, Archiver archiver, PackageManifestCodec codec) {
        this.session = session;
        this.archiver = archiver;
        this.codec = codec;
    }

    /** The archive of {@code id} in the newest format present, if any. */
    public Optional<ExistingArchive> findExisting(Path repository, String id) {
        ExistingArchive found = null;
        for (ArchiveFormat format : ArchiveFormat.PROBE_ORDER) {
            Path file = repository.resolve(format.fileName(id));
            if (Files.isRegularFile(file)) {
                found = new ExistingArchive(file, format);
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Makes sure the repository holds an up-to-date archive of {@code info} and
     * records its packaging time, size and digest on {@code info}.
     *
     * @return the format of the archive
     */
    public ArchiveFormat createArchiveFile(PackageInfo info, Path repository, RepositoryManifest manifest) {
        Optional<ExistingArchive> existing = findExisting(repository, info.id());
        Path archiveFile;
        ArchiveFormat format;
        Optional<Long> reusedTime = existing.flatMap(e -> reusableTime(info, e, manifest));
        if (reusedTime.isPresent()) {
            archiveFile = existing.get().file();
            format = existing.get().format();
            info.setTimePackaged(reusedTime.get());
            log.debugf("%s hasn't changed => keeping %s", info.id(), archiveFile.getFileName());
        } else {
            format = session.archiveFormat();
            archiveFile = repository.resolve(format.fileName(info.id()));
            info.setTimePackaged(session.startTime());
            build(info, repository, format, archiveFile);
        }
        try {
            info.setArchiveFileSize(Files.size(archiveFile));
            info.setArchiveFileDigest(DigestEngine.hashFile(archiveFile));
            Files.setLastModifiedTime(archiveFile, FileTime.from(info.timePackaged(), TimeUnit.SECONDS));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to inspect " + archiveFile, e);
        }
        return format;
    }

    /** The packaging time to keep when the existing archive is still current. */
    private Optional<Long> reusableTime(PackageInfo info, ExistingArchive existing, RepositoryManifest manifest) {
        Md5Digest digest = info.digest();
        if (digest == null || !manifest.digest(info.id()).map(digest::equals).orElse(false)) {
            return Optional.empty();
        }
        PackageInfo archived;
        try (TemporaryFile tpm = TemporaryFile.create()) {
            archiver.extractFile(existing.file(), existing.format(),
                    session.layout().packageManifestPath(info.id()), tpm.path());
            archived = codec.read(tpm.path());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read the package manifest of " + existing.file(), e);
        }
        if (!digest.equals(archived.digest())) {
            log.debugf("%s: digest in %s differs from the repository manifest", info.id(), existing.file().getFileName());
            return Optional.empty();
        }
        long time = manifest.timePackaged(info.id()).orElse(archived.timePackaged());
        return Optional.of(time);
    }

    private void build(PackageInfo info, Path repository, ArchiveFormat format, Path archiveFile) {
        if (info.path() == null) {
            throw new RepositoryBuildException("Cannot rebuild " + info.id() + ": no staging directory.");
        }
        log.debugf("Creating %s...", archiveFile.getFileName());
        Path filesDir = info.path().resolve(StagingDirectoryCodec.FILES);
        Path tarFile = repository.resolve(ArchiveFormat.TAR.fileName(info.id()));
        try {
            Files.createDirectories(repository);
            Path tpm = filesDir.resolve(session.layout().packageManifestPath(info.id()));
            Files.createDirectories(tpm.getParent());
            codec.write(tpm, info, info.timePackaged());
            Files.setLastModifiedTime(tpm, FileTime.from(info.timePackaged(), TimeUnit.SECONDS));

            archiver.createTar(tarFile, filesDir, session.layout().prefix());
            archiver.compress(tarFile, format, archiveFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create " + archiveFile, e);
        } finally {
            try {
                Files.deleteIfExists(tarFile);
            } catch (IOException e) {
                log.warnf("warning: could not remove %s: %s", tarFile, e.getMessage());
            }
        }
    }
}
