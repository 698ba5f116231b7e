package com.libragraph.repobuilder.util;

import java.nio.file.Path;

/**
 * Renders relative paths in the two canonical forms the repository format uses.
 */
public final class PathNames {

    private PathNames() {
    }

    /** Backslash-separated form, used when hashing paths into TDS digests. */
    public static String toDos(String path) {
        return path.replace('/', '\\');
    }

    /** Slash-separated form, used in digest listings, archives and file indexes. */
    public static String toUnix(String path) {
        return path.replace('\\', '/');
    }

    /** Slash-separated path of {@code path} relative to {@code base}. */
    public static String relativize(Path base, Path path) {
        return toUnix(base.relativize(path).toString());
    }

    /**
     * Whether {@code path} equals {@code prefix} or lies beneath it, comparing
     * path components under {@link DosPathComparator} rules.
     */
    public static boolean isUnder(String prefix, String path) {
        String p = toUnix(prefix);
        if (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        String s = toUnix(path);
        if (s.length() < p.length()) {
            return false;
        }
        if (DosPathComparator.INSTANCE.compare(s.substring(0, p.length()), p) != 0) {
            return false;
        }
        return s.length() == p.length() || s.charAt(p.length()) == '/';
    }

    /** File name without its last extension, e.g. {@code a0poster} for {@code a0poster.tpm}. */
    public static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
