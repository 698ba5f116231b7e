package com.libragraph.repobuilder.core.model;

import com.libragraph.repobuilder.formats.api.ArchiveFormat;

/**
 * Target {@code major.minor} series of a repository, e.g. {@code 4.0}.
 */
public record SeriesVersion(int major, int minor) implements Comparable<SeriesVersion> {

    /** Newest series this builder can produce. */
    public static final SeriesVersion SUPPORTED = new SeriesVersion(4, 0);

    public static SeriesVersion parse(String text) {
        String[] parts = text.trim().split("\\.");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid major/minor version: " + text);
        }
        try {
            return new SeriesVersion(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid major/minor version: " + text, e);
        }
    }

    /** Format of new package and database archives for this series. */
    public ArchiveFormat archiveFormat() {
        return ArchiveFormat.forSeries(major, minor);
    }

    @Override
    public int compareTo(SeriesVersion other) {
        int c = Integer.compare(major, other.major);
        return c != 0 ? c : Integer.compare(minor, other.minor);
    }

    @Override
    public String toString() {
        return major + "." + minor;
    }
}
