package com.libragraph.repobuilder.core.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * What to do in this run and on which directories. Which locations are
 * required depends on the mode; the builder reports missing ones.
 */
public record RunRequest(Optional<RunMode> mode,
                         List<Path> stagingRoots,
                         Optional<Path> stagingDir,
                         Optional<Path> repository,
                         Optional<Path> texmfParent,
                         Optional<Path> tpmDir,
                         Optional<Path> tpmFile) {

    public RunRequest {
        stagingRoots = List.copyOf(stagingRoots);
    }
}
