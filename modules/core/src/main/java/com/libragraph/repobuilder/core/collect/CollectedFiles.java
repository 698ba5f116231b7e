package com.libragraph.repobuilder.core.collect;

import java.util.List;

/**
 * Result of classifying one tree: the three disjoint file lists and their byte totals.
 * Paths are slash-separated and relative to the collected root.
 */
public record CollectedFiles(List<String> runFiles, long sizeRunFiles,
                             List<String> docFiles, long sizeDocFiles,
                             List<String> sourceFiles, long sizeSourceFiles) {

    public static final CollectedFiles EMPTY = new CollectedFiles(List.of(), 0, List.of(), 0, List.of(), 0);

    public CollectedFiles {
        runFiles = List.copyOf(runFiles);
        docFiles = List.copyOf(docFiles);
        sourceFiles = List.copyOf(sourceFiles);
    }

    public int size() {
        return runFiles.size() + docFiles.size() + sourceFiles.size();
    }
}
