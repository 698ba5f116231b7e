package com.libragraph.repobuilder.util;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Relative file path to content digest, ordered by {@link DosPathComparator}.
 *
 * <p>Paths differing only in case or separator style address the same entry.
 */
public final class FileDigestTable {

    private final TreeMap<String, Md5Digest> entries = new TreeMap<>(DosPathComparator.INSTANCE);

    public void put(String relativePath, Md5Digest digest) {
        entries.put(relativePath, digest);
    }

    public Md5Digest get(String relativePath) {
        return entries.get(relativePath);
    }

    public boolean contains(String relativePath) {
        return entries.containsKey(relativePath);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Entries in table order. */
    public SortedMap<String, Md5Digest> entries() {
        return Collections.unmodifiableSortedMap(entries);
    }

    public void forEach(BiConsumer<String, Md5Digest> action) {
        for (Map.Entry<String, Md5Digest> e : entries.entrySet()) {
            action.accept(e.getKey(), e.getValue());
        }
    }
}
