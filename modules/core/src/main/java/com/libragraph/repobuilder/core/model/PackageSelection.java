package com.libragraph.repobuilder.core.model;

import com.libragraph.repobuilder.types.PackageLevel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The package selection list with its fallback level for unlisted packages.
 */
public final class PackageSelection {

    private final Map<String, PackageSpec> specs;
    private final PackageLevel defaultLevel;

    public PackageSelection(Map<String, PackageSpec> specs, PackageLevel defaultLevel) {
        this.specs = Collections.unmodifiableMap(new LinkedHashMap<>(specs));
        this.defaultLevel = defaultLevel;
    }

    public static PackageSelection unlisted(PackageLevel defaultLevel) {
        return new PackageSelection(Map.of(), defaultLevel);
    }

    public PackageLevel level(String id) {
        PackageSpec spec = specs.get(id);
        return spec != null ? spec.level() : defaultLevel;
    }

    /** Whether the package is marked {@code -} and must be left out entirely. */
    public boolean isIgnored(String id) {
        return level(id).isExcluded();
    }

    public Optional<PackageSpec> spec(String id) {
        return Optional.ofNullable(specs.get(id));
    }

    public PackageLevel defaultLevel() {
        return defaultLevel;
    }

    public int size() {
        return specs.size();
    }
}
