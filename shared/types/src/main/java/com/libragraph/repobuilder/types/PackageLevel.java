package com.libragraph.repobuilder.types;

/**
 * Inclusion tier of a package. {@link #EXCLUDED} packages are skipped by every
 * repository operation; the others name the install set a package belongs to.
 */
public enum PackageLevel {
    EXCLUDED('-', "excluded"),
    SMALL('S', "small"),
    MEDIUM('M', "medium"),
    LARGE('L', "large"),
    TOTAL('T', "total");

    private final char code;
    private final String label;

    PackageLevel(char code, String label) {
        this.code = code;
        this.label = label;
    }

    /** Single-character code used in package lists and the repository manifest. */
    public char code() {
        return code;
    }

    public String label() {
        return label;
    }

    public boolean isExcluded() {
        return this == EXCLUDED;
    }

    public static boolean isCode(char code) {
        for (PackageLevel l : values()) {
            if (l.code == code) return true;
        }
        return false;
    }

    public static PackageLevel fromCode(char code) {
        for (PackageLevel l : values()) {
            if (l.code == code) return l;
        }
        throw new IllegalArgumentException("Unknown package level: " + code);
    }
}
