package com.libragraph.repobuilder.core.manifest;

import com.libragraph.repobuilder.util.Md5Digest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The repository manifest database ({@code mpm.ini}): one section per package id.
 */
public final class RepositoryManifest {

    public static final String LEVEL = "Level";
    public static final String MD5 = "MD5";
    public static final String TIME_PACKAGED = "TimePackaged";
    public static final String CAB_SIZE = "CabSize";
    public static final String CAB_MD5 = "CabMD5";
    public static final String TYPE = "Type";
    public static final String VERSION = "Version";
    public static final String TARGET_SYSTEM = "TargetSystem";
    public static final String MIN_TARGET_SYSTEM_VERSION = "MinTargetSystemVersion";

    private final IniStore store;

    private RepositoryManifest(IniStore store) {
        this.store = store;
    }

    public static RepositoryManifest empty() {
        return new RepositoryManifest(new IniStore());
    }

    public static RepositoryManifest read(Path file) {
        return new RepositoryManifest(IniStore.read(file));
    }

    public void put(String id, String key, String value) {
        store.put(id, key, value);
    }

    public Optional<String> get(String id, String key) {
        return store.get(id, key);
    }

    public boolean delete(String id, String key) {
        return store.delete(id, key);
    }

    public boolean deleteSection(String id) {
        return store.deleteSection(id);
    }

    public boolean contains(String id) {
        return store.hasSection(id);
    }

    public Set<String> keys(String id) {
        return store.keys(id);
    }

    public List<String> ids() {
        return store.sectionNames();
    }

    public int size() {
        return store.size();
    }

    public Optional<Md5Digest> digest(String id) {
        return store.getDigest(id, MD5, "repository manifest entry " + id);
    }

    public OptionalLong timePackaged(String id) {
        return store.getLong(id, TIME_PACKAGED, "repository manifest entry " + id);
    }

    /**
     * Deletes every section whose id is not in {@code currentIds} or is ignored.
     *
     * @return the removed ids
     */
    public List<String> prune(Set<String> currentIds, Predicate<String> ignored) {
        List<String> obsolete = new ArrayList<>();
        for (String id : store.sectionNames()) {
            if (!currentIds.contains(id) || ignored.test(id)) {
                obsolete.add(id);
            }
        }
        obsolete.forEach(store::deleteSection);
        return obsolete;
    }

    public void write(Path file, Optional<ManifestSigner> signer) {
        store.write(file, signer);
    }
}
