package com.libragraph.repobuilder.util;

import java.util.Comparator;

/**
 * Orders relative paths the way DOS file systems collate them: case-insensitive,
 * with {@code /} and {@code \} treated as the same separator.
 *
 * <p>The TDS digest iterates file tables in this order, so it must never change.
 */
public final class DosPathComparator implements Comparator<String> {

    public static final DosPathComparator INSTANCE = new DosPathComparator();

    private DosPathComparator() {
    }

    @Override
    public int compare(String a, String b) {
        int n = Math.min(a.length(), b.length());
        for (int i = 0; i < n; i++) {
            char ca = fold(a.charAt(i));
            char cb = fold(b.charAt(i));
            if (ca != cb) {
                return ca - cb;
            }
        }
        return a.length() - b.length();
    }

    private static char fold(char c) {
        if (c == '/') {
            return '\\';
        }
        return Character.toLowerCase(c);
    }
}
