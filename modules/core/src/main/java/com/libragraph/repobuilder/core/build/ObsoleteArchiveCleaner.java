package com.libragraph.repobuilder.core.build;

import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Removes package archives superseded by a newer-format archive of the same
 * package: a cabinet once a bzip2 or lzma tar exists, a bzip2 tar once an lzma
 * tar exists.
 */
@ApplicationScoped
public class ObsoleteArchiveCleaner {

    private static final Logger log = Logger.getLogger(ObsoleteArchiveCleaner.class);

    /** @return the deleted files, sorted */
    public List<Path> clean(Path repository) {
        List<Path> entries;
        try (Stream<Path> list = Files.list(repository)) {
            entries = list.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + repository, e);
        }
        List<Path> obsolete = new ArrayList<>();
        for (Path file : entries) {
            String name = file.getFileName().toString();
            if (name.endsWith(ArchiveFormat.CABINET.extension())) {
                String id = baseName(name, ArchiveFormat.CABINET);
                if (exists(repository, id, ArchiveFormat.TAR_BZIP2) || exists(repository, id, ArchiveFormat.TAR_LZMA)) {
                    obsolete.add(file);
                }
            } else if (name.endsWith(ArchiveFormat.TAR_BZIP2.extension())) {
                if (exists(repository, baseName(name, ArchiveFormat.TAR_BZIP2), ArchiveFormat.TAR_LZMA)) {
                    obsolete.add(file);
                }
            }
        }
        for (Path file : obsolete) {
            log.debugf("Removing %s...", file);
            try {
                Files.delete(file);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to remove " + file, e);
            }
        }
        return obsolete;
    }

    private static String baseName(String fileName, ArchiveFormat format) {
        return fileName.substring(0, fileName.length() - format.extension().length());
    }

    private static boolean exists(Path repository, String id, ArchiveFormat format) {
        return Files.isRegularFile(repository.resolve(format.fileName(id)));
    }
}
