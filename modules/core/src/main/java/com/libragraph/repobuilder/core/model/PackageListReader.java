package com.libragraph.repobuilder.core.model;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.types.PackageLevel;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads package selection lists.
 *
 * <p>Each line is {@code <L> <id>[;<Type>]} where {@code L} is one of
 * {@code S M L T -} and {@code Type} one of {@code MSCab TarBzip2 TarLzma}.
 * {@code @<file>} includes another list; a relative include is resolved against
 * the including file's directory. Other lines are ignored. The first entry for
 * an id wins; later ones are reported and skipped.
 */
public class PackageListReader {

    private static final Logger log = Logger.getLogger(PackageListReader.class);

    public PackageSelection read(Path file, PackageLevel defaultLevel) {
        Map<String, PackageSpec> specs = new LinkedHashMap<>();
        read(file, specs);
        return new PackageSelection(specs, defaultLevel);
    }

    void read(Path file, Map<String, PackageSpec> specs) {
        Iterable<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read package list " + file, e);
        }
        for (String line : lines) {
            if (line.isEmpty()) {
                continue;
            }
            char ch = line.charAt(0);
            String rest = line.substring(1).replaceFirst("^[ \t]+", "");
            if (rest.isEmpty()) {
                continue;
            }
            if (ch == '@') {
                Path include = Path.of(rest);
                if (!include.isAbsolute() && file.getParent() != null) {
                    include = file.getParent().resolve(include);
                }
                read(include, specs);
                continue;
            }
            if (!PackageLevel.isCode(ch)) {
                continue;
            }
            String[] tokens = rest.split(";");
            String id = tokens[0].strip();
            PackageSpec existing = specs.get(id);
            if (existing != null) {
                log.warnf("warning: ignoring '%s %s': already marked as '%s'", ch, id, existing.level().code());
                continue;
            }
            Optional<ArchiveFormat> format = Optional.empty();
            if (tokens.length > 1) {
                format = Optional.of(archiveFormat(tokens[1].strip(), file));
            }
            specs.put(id, new PackageSpec(id, PackageLevel.fromCode(ch), format));
        }
    }

    private static ArchiveFormat archiveFormat(String typeName, Path file) {
        return ArchiveFormat.fromTypeName(typeName)
                .filter(f -> f == ArchiveFormat.CABINET || f == ArchiveFormat.TAR_BZIP2 || f == ArchiveFormat.TAR_LZMA)
                .orElseThrow(() -> new RepositoryBuildException("Invalid package list file: " + file));
    }
}
