package com.libragraph.repobuilder.core.model;

import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.types.PackageLevel;

import java.util.Optional;

/**
 * One entry of the package selection list.
 *
 * @param archiveFormat archive type requested by the list, if any
 */
public record PackageSpec(String id, PackageLevel level, Optional<ArchiveFormat> archiveFormat) {
}
