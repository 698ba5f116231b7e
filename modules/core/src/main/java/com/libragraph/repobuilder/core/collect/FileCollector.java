package com.libragraph.repobuilder.core.collect;

import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.model.TexmfLayout;
import com.libragraph.repobuilder.util.DosPathComparator;
import com.libragraph.repobuilder.util.PathNames;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks a tree and partitions its regular files into run, doc and source files.
 * A missing root yields no files.
 */
@ApplicationScoped
public class FileCollector {

    private final TexmfLayout layout;

    @Inject
    public FileCollector(BuildSession session) {
        this(session.layout());
    }

    public FileCollector(TexmfLayout layout) {
        this.layout = layout;
    }

    public CollectedFiles collect(Path root) {
        if (!Files.isDirectory(root)) {
            return CollectedFiles.EMPTY;
        }
        List<String> run = new ArrayList<>();
        List<String> doc = new ArrayList<>();
        List<String> source = new ArrayList<>();
        long[] sizes = new long[3];
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!attrs.isRegularFile()) {
                        return FileVisitResult.CONTINUE;
                    }
                    String rel = PathNames.relativize(root, file);
                    switch (layout.classify(rel)) {
                        case DOC -> {
                            doc.add(rel);
                            sizes[1] += attrs.size();
                        }
                        case SOURCE -> {
                            source.add(rel);
                            sizes[2] += attrs.size();
                        }
                        default -> {
                            run.add(rel);
                            sizes[0] += attrs.size();
                        }
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to collect files under " + root, e);
        }
        run.sort(DosPathComparator.INSTANCE);
        doc.sort(DosPathComparator.INSTANCE);
        source.sort(DosPathComparator.INSTANCE);
        return new CollectedFiles(run, sizes[0], doc, sizes[1], source, sizes[2]);
    }
}
