package com.libragraph.repobuilder.core.manifest;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.model.PackageInfo;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

/**
 * Maps {@link PackageInfo} to and from package manifest sections. A package
 * manifest file ({@code <id>.tpm}) holds one section named by the id;
 * {@code package-manifests.ini} holds one per package.
 */
@ApplicationScoped
public class PackageManifestCodec {

    static final String DISPLAY_NAME = "displayName";
    static final String CREATOR = "creator";
    static final String TITLE = "title";
    static final String DESCRIPTION = "description";
    static final String VERSION = "version";
    static final String TARGET_SYSTEM = "targetSystem";
    static final String MIN_TARGET_SYSTEM_VERSION = "minTargetSystemVersion";
    static final String CTAN_PATH = "ctanPath";
    static final String COPYRIGHT_OWNER = "copyrightOwner";
    static final String COPYRIGHT_YEAR = "copyrightYear";
    static final String LICENSE_TYPE = "licenseType";
    static final String MD5 = "md5";
    static final String TIME_PACKAGED = "timePackaged";
    static final String RUN_FILES = "runFiles";
    static final String DOC_FILES = "docFiles";
    static final String SOURCE_FILES = "sourceFiles";
    static final String SIZE_RUN_FILES = "sizeRunFiles";
    static final String SIZE_DOC_FILES = "sizeDocFiles";
    static final String SIZE_SOURCE_FILES = "sizeSourceFiles";
    static final String REQUIRED_PACKAGES = "requiredPackages";

    /** Adds the package's section to {@code store}, replacing an existing one. */
    public void put(IniStore store, PackageInfo info, long timePackaged) {
        String id = info.id();
        store.deleteSection(id);
        putText(store, id, DISPLAY_NAME, info.displayName());
        putText(store, id, CREATOR, info.creator());
        putText(store, id, TITLE, info.title());
        putText(store, id, DESCRIPTION, info.description());
        putText(store, id, VERSION, info.version());
        putText(store, id, TARGET_SYSTEM, info.targetSystem());
        putText(store, id, MIN_TARGET_SYSTEM_VERSION, info.minTargetSystemVersion());
        putText(store, id, CTAN_PATH, info.ctanPath());
        putText(store, id, COPYRIGHT_OWNER, info.copyrightOwner());
        putText(store, id, COPYRIGHT_YEAR, info.copyrightYear());
        putText(store, id, LICENSE_TYPE, info.licenseType());
        if (info.digest() != null) {
            store.put(id, MD5, info.digest().toHex());
        }
        if (timePackaged >= 0) {
            store.put(id, TIME_PACKAGED, Long.toString(timePackaged));
        }
        putFiles(store, id, RUN_FILES, SIZE_RUN_FILES, info.runFiles(), info.sizeRunFiles());
        putFiles(store, id, DOC_FILES, SIZE_DOC_FILES, info.docFiles(), info.sizeDocFiles());
        putFiles(store, id, SOURCE_FILES, SIZE_SOURCE_FILES, info.sourceFiles(), info.sizeSourceFiles());
        if (!info.requiredPackages().isEmpty()) {
            store.putList(id, REQUIRED_PACKAGES, info.requiredPackages());
        }
        if (!store.hasSection(id)) {
            store.putList(id, RUN_FILES, List.of());
        }
    }

    public PackageInfo get(IniStore store, String id) {
        PackageInfo info = new PackageInfo();
        info.setId(id);
        text(store, id, DISPLAY_NAME, info::setDisplayName);
        text(store, id, CREATOR, info::setCreator);
        text(store, id, TITLE, info::setTitle);
        text(store, id, DESCRIPTION, info::setDescription);
        text(store, id, VERSION, info::setVersion);
        text(store, id, TARGET_SYSTEM, info::setTargetSystem);
        text(store, id, MIN_TARGET_SYSTEM_VERSION, info::setMinTargetSystemVersion);
        text(store, id, CTAN_PATH, info::setCtanPath);
        text(store, id, COPYRIGHT_OWNER, info::setCopyrightOwner);
        text(store, id, COPYRIGHT_YEAR, info::setCopyrightYear);
        text(store, id, LICENSE_TYPE, info::setLicenseType);
        store.getDigest(id, MD5, source(id)).ifPresent(info::setDigest);
        store.getLong(id, TIME_PACKAGED, source(id)).ifPresent(info::setTimePackaged);
        info.setRunFiles(store.getList(id, RUN_FILES), size(store, id, SIZE_RUN_FILES));
        info.setDocFiles(store.getList(id, DOC_FILES), size(store, id, SIZE_DOC_FILES));
        info.setSourceFiles(store.getList(id, SOURCE_FILES), size(store, id, SIZE_SOURCE_FILES));
        info.requiredPackages().addAll(store.getList(id, REQUIRED_PACKAGES));
        return info;
    }

    public void write(Path file, PackageInfo info, long timePackaged) {
        IniStore store = new IniStore();
        put(store, info, timePackaged);
        store.write(file);
    }

    /** Reads a package manifest file; the id is the name of its section. */
    public PackageInfo read(Path file) {
        IniStore store = IniStore.read(file);
        List<String> sections = store.sectionNames();
        String id = sections.stream()
                .filter(s -> !s.isEmpty())
                .findFirst()
                .orElseThrow(() -> new RepositoryBuildException("Invalid package manifest file: " + file));
        return get(store, id);
    }

    private static void putText(IniStore store, String id, String key, String value) {
        if (!value.isEmpty()) {
            store.put(id, key, value);
        }
    }

    private static void putFiles(IniStore store, String id, String key, String sizeKey, List<String> files, long size) {
        if (!files.isEmpty()) {
            store.putList(id, key, files);
            store.put(id, sizeKey, Long.toString(size));
        }
    }

    private static void text(IniStore store, String id, String key, Consumer<String> setter) {
        store.get(id, key).ifPresent(setter);
    }

    private static long size(IniStore store, String id, String key) {
        return store.getLong(id, key, source(id)).orElse(0L);
    }

    private static String source(String id) {
        return "package manifest " + id;
    }
}
