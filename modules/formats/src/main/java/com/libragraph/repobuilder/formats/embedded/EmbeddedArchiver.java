package com.libragraph.repobuilder.formats.embedded;

import com.libragraph.repobuilder.formats.api.ArchiveException;
import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.formats.api.Archiver;
import com.libragraph.repobuilder.formats.api.Codec;
import com.libragraph.repobuilder.formats.api.UnsupportedArchiveFormatException;
import org.apache.commons.compress.archivers.ArchiveEntry;
import org.apache.commons.compress.archivers.ArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.jboss.logging.Logger;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link Archiver} implemented in-process with Apache Commons Compress.
 *
 * <p>Archives are reproducible: entries are written in name order, owner ids
 * and names are cleared, permissions are fixed to 0644/0755 and only the
 * modification time of each file is recorded. Cabinet files are not supported.
 */
public class EmbeddedArchiver implements Archiver {

    private static final Logger log = Logger.getLogger(EmbeddedArchiver.class);

    private static final int FILE_MODE = 0100644;
    private static final int DIR_MODE = 040755;

    private final Map<ArchiveFormat.Compression, Codec> codecs = new EnumMap<>(ArchiveFormat.Compression.class);

    public EmbeddedArchiver(List<Codec> codecs) {
        for (Codec codec : codecs) {
            this.codecs.put(codec.compression(), codec);
        }
    }

    private Codec codec(ArchiveFormat format, String operation) {
        Codec codec = codecs.get(format.compression());
        if (codec == null) {
            throw new UnsupportedArchiveFormatException(format, operation);
        }
        return codec;
    }

    @Override
    public void create(ArchiveFormat format, Path workingDirectory, String member, Path archive) {
        List<Path> entries = collect(workingDirectory, member);
        log.debugf("writing %d entries to %s", entries.size(), archive);
        try {
            Files.deleteIfExists(archive);
            switch (format.container()) {
                case TAR -> {
                    try (OutputStream out = encodingStream(format, archive, "create")) {
                        writeTar(out, workingDirectory, entries);
                    }
                }
                case ZIP -> {
                    try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(archive))) {
                        writeZip(out, workingDirectory, entries);
                    }
                }
                default -> throw new UnsupportedArchiveFormatException(format, "create");
            }
        } catch (IOException e) {
            throw new ArchiveException("Failed to create " + archive, e);
        }
    }

    @Override
    public void createTar(Path tarFile, Path workingDirectory, String member) {
        List<Path> entries = workingDirectory != null && Files.isDirectory(workingDirectory)
                ? collect(workingDirectory, member)
                : List.of();
        try {
            Files.deleteIfExists(tarFile);
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tarFile))) {
                writeTar(out, workingDirectory, entries);
            }
        } catch (IOException e) {
            throw new ArchiveException("Failed to create " + tarFile, e);
        }
    }

    @Override
    public void compress(Path file, ArchiveFormat format, Path outFile) {
        Codec codec = codec(format, "compress");
        try {
            Files.deleteIfExists(outFile);
            try (InputStream in = Files.newInputStream(file);
                 OutputStream out = codec.encoding(new BufferedOutputStream(Files.newOutputStream(outFile)))) {
                in.transferTo(out);
            }
        } catch (IOException e) {
            throw new ArchiveException("Failed to compress " + file, e);
        }
    }

    @Override
    public void extract(Path archive, ArchiveFormat format, Path outDir) {
        Path root = outDir.toAbsolutePath().normalize();
        try (ArchiveInputStream<?> in = openArchive(archive, format, "extract")) {
            Files.createDirectories(root);
            ArchiveEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new ArchiveException("Entry escapes the extraction directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                if (entry instanceof TarArchiveEntry tarEntry && !tarEntry.isFile()) {
                    continue;
                }
                Files.createDirectories(target.getParent());
                try (OutputStream out = Files.newOutputStream(target)) {
                    in.transferTo(out);
                }
                if (entry.getLastModifiedDate() != null) {
                    Files.setLastModifiedTime(target, FileTime.fromMillis(entry.getLastModifiedDate().getTime()));
                }
            }
        } catch (IOException e) {
            throw new ArchiveException("Failed to extract " + archive, e);
        }
    }

    @Override
    public void extractFile(Path archive, ArchiveFormat format, String member, Path outFile) {
        String wanted = memberName(member);
        try (ArchiveInputStream<?> in = openArchive(archive, format, "extract file")) {
            ArchiveEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                if (!entry.isDirectory() && memberName(entry.getName()).equals(wanted)) {
                    Files.deleteIfExists(outFile);
                    try (OutputStream out = Files.newOutputStream(outFile)) {
                        in.transferTo(out);
                    }
                    return;
                }
            }
        } catch (IOException e) {
            throw new ArchiveException("Failed to extract " + member + " from " + archive, e);
        }
        throw new ArchiveException(member + ": not found in archive " + archive);
    }

    private OutputStream encodingStream(ArchiveFormat format, Path archive, String operation) throws IOException {
        OutputStream out = new BufferedOutputStream(Files.newOutputStream(archive));
        if (format.compression() == ArchiveFormat.Compression.NONE) {
            return out;
        }
        return codec(format, operation).encoding(out);
    }

    private ArchiveInputStream<?> openArchive(Path archive, ArchiveFormat format, String operation) throws IOException {
        switch (format.container()) {
            case TAR: {
                InputStream in = new BufferedInputStream(Files.newInputStream(archive));
                if (format.compression() != ArchiveFormat.Compression.NONE) {
                    in = codec(format, operation).decoding(in);
                }
                return new TarArchiveInputStream(in);
            }
            case ZIP:
                return new ZipArchiveInputStream(new BufferedInputStream(Files.newInputStream(archive)));
            default:
                throw new UnsupportedArchiveFormatException(format, operation);
        }
    }

    private static void writeTar(OutputStream out, Path base, List<Path> entries) throws IOException {
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(out)) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
            for (Path path : entries) {
                boolean dir = Files.isDirectory(path);
                TarArchiveEntry entry = new TarArchiveEntry(entryName(base, path, dir));
                entry.setMode(dir ? DIR_MODE : FILE_MODE);
                entry.setUserId(0);
                entry.setGroupId(0);
                entry.setUserName("");
                entry.setGroupName("");
                entry.setModTime(wholeSeconds(Files.getLastModifiedTime(path)));
                if (!dir) {
                    entry.setSize(Files.size(path));
                }
                tar.putArchiveEntry(entry);
                if (!dir) {
                    Files.copy(path, tar);
                }
                tar.closeArchiveEntry();
            }
            tar.finish();
        }
    }

    private static void writeZip(OutputStream out, Path base, List<Path> entries) throws IOException {
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(out)) {
            for (Path path : entries) {
                boolean dir = Files.isDirectory(path);
                ZipArchiveEntry entry = new ZipArchiveEntry(entryName(base, path, dir));
                entry.setTime(Files.getLastModifiedTime(path).toMillis());
                zip.putArchiveEntry(entry);
                if (!dir) {
                    Files.copy(path, zip);
                }
                zip.closeArchiveEntry();
            }
            zip.finish();
        }
    }

    /** The member itself and everything below it, in entry-name order. */
    private static List<Path> collect(Path base, String member) {
        Path start = base.resolve(member);
        if (!Files.exists(start)) {
            throw new ArchiveException(member + ": no such file or directory in " + base);
        }
        try (Stream<Path> walk = Files.walk(start)) {
            List<Path> paths = new ArrayList<>(walk.collect(Collectors.toList()));
            paths.sort((a, b) -> entryName(base, a, false).compareTo(entryName(base, b, false)));
            return paths;
        } catch (IOException e) {
            throw new ArchiveException("Failed to list " + start, e);
        }
    }

    private static FileTime wholeSeconds(FileTime time) {
        return FileTime.from(time.to(TimeUnit.SECONDS), TimeUnit.SECONDS);
    }

    private static String entryName(Path base, Path path, boolean directory) {
        String name = base.relativize(path).toString().replace('\\', '/');
        return directory ? name + "/" : name;
    }

    private static String memberName(String name) {
        String n = name.replace('\\', '/');
        while (n.startsWith("./")) {
            n = n.substring(2);
        }
        return n;
    }
}
