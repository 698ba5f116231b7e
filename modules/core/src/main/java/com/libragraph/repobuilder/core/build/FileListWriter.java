package com.libragraph.repobuilder.core.build;

import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.formats.api.Archiver;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes the LZMA-compressed file index {@code files.csv.lzma}: one
 * {@code path;id} line per file, with the TEXMF prefix removed, sorted.
 */
@ApplicationScoped
public class FileListWriter {

    private static final Logger log = Logger.getLogger(FileListWriter.class);

    public static final String FILE_LIST = "files.csv";
    public static final String FILE_LIST_ARCHIVE = "files.csv.lzma";

    private final BuildSession session;
    private final Archiver archiver;

    @Inject
    public FileListWriter(BuildSession session, Archiver archiver) {
        this.session = session;
        this.archiver = archiver;
    }

    /** The sorted index lines of every non-ignored package. */
    public List<String> lines(Map<String, PackageInfo> table) {
        List<String> lines = new ArrayList<>();
        for (PackageInfo info : table.values()) {
            if (session.selection().isIgnored(info.id())) {
                continue;
            }
            for (String file : info.allFiles()) {
                lines.add(session.layout().stripPrefix(file) + ";" + info.id());
            }
        }
        Collections.sort(lines);
        return lines;
    }

    /** @return the written archive */
    public Path write(Map<String, PackageInfo> table, Path repository) {
        Path csv = repository.resolve(FILE_LIST);
        Path archive = repository.resolve(FILE_LIST_ARCHIVE);
        List<String> lines = lines(table);
        try {
            StringBuilder text = new StringBuilder();
            for (String line : lines) {
                text.append(line).append('\n');
            }
            Files.writeString(csv, text, StandardCharsets.UTF_8);
            archiver.compress(csv, ArchiveFormat.TAR_LZMA, archive);
            Files.delete(csv);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + archive, e);
        }
        log.debugf("wrote %d entries to %s", lines.size(), archive.getFileName());
        return archive;
    }
}
