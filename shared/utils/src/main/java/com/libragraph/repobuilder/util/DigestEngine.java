package com.libragraph.repobuilder.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributeView;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.MessageDigest;
import java.util.Locale;

/**
 * Per-file content digests and the aggregate TDS digest over a file table.
 */
public final class DigestEngine {

    /** Suffix of package manifest files; they are metadata and never part of a TDS digest. */
    public static final String PACKAGE_MANIFEST_SUFFIX = ".tpm";

    private static final int CHUNK_SIZE = 4096;

    private DigestEngine() {
    }

    public record CopyResult(Md5Digest digest, long bytesCopied) {}

    /**
     * Copies {@code source} to {@code dest} in fixed-size chunks while hashing the
     * bytes, then carries the source's creation, access and modification times over.
     */
    public static CopyResult copyAndHash(Path source, Path dest) throws IOException {
        MessageDigest md = Md5Digest.newMessageDigest();
        long total = 0;
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = Files.newOutputStream(dest)) {
            byte[] buf = new byte[CHUNK_SIZE];
            int n;
            while ((n = in.read(buf)) > 0) {
                out.write(buf, 0, n);
                md.update(buf, 0, n);
                total += n;
            }
        }
        BasicFileAttributes attrs = Files.readAttributes(source, BasicFileAttributes.class);
        Files.getFileAttributeView(dest, BasicFileAttributeView.class)
                .setTimes(attrs.lastModifiedTime(), attrs.lastAccessTime(), attrs.creationTime());
        return new CopyResult(new Md5Digest(md.digest()), total);
    }

    /** Digest of a file's contents. */
    public static Md5Digest hashFile(Path file) throws IOException {
        MessageDigest md = Md5Digest.newMessageDigest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buf = new byte[CHUNK_SIZE];
            int n;
            while ((n = in.read(buf)) > 0) {
                md.update(buf, 0, n);
            }
        }
        return new Md5Digest(md.digest());
    }

    /**
     * TDS digest: for each entry in table order, the backslash-rendered path bytes
     * followed by the raw content digest. Package manifest entries are skipped.
     */
    public static Md5Digest aggregate(FileDigestTable table) {
        MessageDigest md = Md5Digest.newMessageDigest();
        table.forEach((path, digest) -> {
            if (isPackageManifest(path)) {
                return;
            }
            md.update(PathNames.toDos(path).getBytes(StandardCharsets.UTF_8));
            md.update(digest.bytes());
        });
        return new Md5Digest(md.digest());
    }

    /** Digests every regular file listed in {@code relativePaths} under {@code root}. */
    public static FileDigestTable digestFiles(Path root, Iterable<String> relativePaths) throws IOException {
        FileDigestTable table = new FileDigestTable();
        for (String rel : relativePaths) {
            if (isPackageManifest(rel)) {
                continue;
            }
            table.put(rel, hashFile(root.resolve(rel)));
        }
        return table;
    }

    public static boolean isPackageManifest(String path) {
        return path.toLowerCase(Locale.ROOT).endsWith(PACKAGE_MANIFEST_SUFFIX);
    }
}
