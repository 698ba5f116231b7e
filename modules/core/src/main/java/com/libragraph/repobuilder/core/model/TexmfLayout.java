package com.libragraph.repobuilder.core.model;

import com.libragraph.repobuilder.types.FileRole;
import com.libragraph.repobuilder.util.DigestEngine;
import com.libragraph.repobuilder.util.PathNames;

/**
 * Path conventions below the TEXMF prefix (usually {@code texmf}).
 */
public record TexmfLayout(String prefix) {

    public static final String PACKAGE_MANIFEST_DIR = "tpm/packages";
    public static final String MPM_INI_PATH = "miktex/config/mpm.ini";

    public TexmfLayout {
        prefix = PathNames.toUnix(prefix);
        while (prefix.endsWith("/")) {
            prefix = prefix.substring(0, prefix.length() - 1);
        }
    }

    public boolean isDoc(String relativePath) {
        return PathNames.isUnder(prefix + "/doc", relativePath);
    }

    public boolean isSource(String relativePath) {
        return PathNames.isUnder(prefix + "/source", relativePath);
    }

    /** Doc and source files are recognised by prefix; everything else is a run file. */
    public FileRole classify(String relativePath) {
        if (isDoc(relativePath)) {
            return FileRole.DOC;
        }
        if (isSource(relativePath)) {
            return FileRole.SOURCE;
        }
        return FileRole.RUN;
    }

    /** e.g. {@code texmf/tpm/packages} */
    public String packageManifestDirectory() {
        return prefix + "/" + PACKAGE_MANIFEST_DIR;
    }

    /** e.g. {@code texmf/tpm/packages/a0poster.tpm} */
    public String packageManifestPath(String id) {
        return packageManifestDirectory() + "/" + id + DigestEngine.PACKAGE_MANIFEST_SUFFIX;
    }

    /** e.g. {@code texmf/miktex/config/mpm.ini} */
    public String mpmIniPath() {
        return prefix + "/" + MPM_INI_PATH;
    }

    /** The path with the prefix and its separator removed, or unchanged when outside the prefix. */
    public String stripPrefix(String relativePath) {
        String unix = PathNames.toUnix(relativePath);
        if (PathNames.isUnder(prefix, unix) && unix.length() > prefix.length()) {
            return unix.substring(prefix.length() + 1);
        }
        return unix;
    }
}
