package com.libragraph.repobuilder.core.model;

import com.libragraph.repobuilder.core.collect.CollectedFiles;
import com.libragraph.repobuilder.util.DigestEngine;
import com.libragraph.repobuilder.util.Md5Digest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The package record the builder works on. Text fields default to the empty
 * string; {@link #digest()} and {@link #path()} are null until known, and
 * {@link #timePackaged()} is {@link #UNKNOWN_TIME} until the package is archived.
 *
 * <p>Mutable: the collector fills in the file lists, the auto-categorizer adds
 * dependency edges and the archive service records archive metadata.
 */
public class PackageInfo {

    public static final long UNKNOWN_TIME = -1;

    private String id = "";
    private String displayName = "";
    private String creator = "";
    private String title = "";
    private String description = "";
    private String version = "";
    private String targetSystem = "";
    private String minTargetSystemVersion = "";
    private String ctanPath = "";
    private String copyrightOwner = "";
    private String copyrightYear = "";
    private String licenseType = "";

    private final List<String> requiredPackages = new ArrayList<>();
    private final List<String> requiredBy = new ArrayList<>();

    private List<String> runFiles = new ArrayList<>();
    private List<String> docFiles = new ArrayList<>();
    private List<String> sourceFiles = new ArrayList<>();
    private long sizeRunFiles;
    private long sizeDocFiles;
    private long sizeSourceFiles;

    private Md5Digest digest;
    private long timePackaged = UNKNOWN_TIME;
    private long archiveFileSize;
    private Md5Digest archiveFileDigest;
    private Path path;

    public String id() {
        return id;
    }

    public void setId(String id) {
        this.id = nonNull(id);
    }

    public String displayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = nonNull(displayName);
    }

    public String creator() {
        return creator;
    }

    public void setCreator(String creator) {
        this.creator = nonNull(creator);
    }

    public String title() {
        return title;
    }

    public void setTitle(String title) {
        this.title = nonNull(title);
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = nonNull(description);
    }

    public String version() {
        return version;
    }

    public void setVersion(String version) {
        this.version = nonNull(version);
    }

    public String targetSystem() {
        return targetSystem;
    }

    public void setTargetSystem(String targetSystem) {
        this.targetSystem = nonNull(targetSystem);
    }

    public String minTargetSystemVersion() {
        return minTargetSystemVersion;
    }

    public void setMinTargetSystemVersion(String minTargetSystemVersion) {
        this.minTargetSystemVersion = nonNull(minTargetSystemVersion);
    }

    public String ctanPath() {
        return ctanPath;
    }

    public void setCtanPath(String ctanPath) {
        this.ctanPath = nonNull(ctanPath);
    }

    public String copyrightOwner() {
        return copyrightOwner;
    }

    public void setCopyrightOwner(String copyrightOwner) {
        this.copyrightOwner = nonNull(copyrightOwner);
    }

    public String copyrightYear() {
        return copyrightYear;
    }

    public void setCopyrightYear(String copyrightYear) {
        this.copyrightYear = nonNull(copyrightYear);
    }

    public String licenseType() {
        return licenseType;
    }

    public void setLicenseType(String licenseType) {
        this.licenseType = nonNull(licenseType);
    }

    /** Outgoing dependency edges; mutable. */
    public List<String> requiredPackages() {
        return requiredPackages;
    }

    /** Incoming dependency edges; mutable. */
    public List<String> requiredBy() {
        return requiredBy;
    }

    public List<String> runFiles() {
        return runFiles;
    }

    public List<String> docFiles() {
        return docFiles;
    }

    public List<String> sourceFiles() {
        return sourceFiles;
    }

    public long sizeRunFiles() {
        return sizeRunFiles;
    }

    public long sizeDocFiles() {
        return sizeDocFiles;
    }

    public long sizeSourceFiles() {
        return sizeSourceFiles;
    }

    public void setRunFiles(List<String> files, long size) {
        this.runFiles = new ArrayList<>(files);
        this.sizeRunFiles = size;
    }

    public void setDocFiles(List<String> files, long size) {
        this.docFiles = new ArrayList<>(files);
        this.sizeDocFiles = size;
    }

    public void setSourceFiles(List<String> files, long size) {
        this.sourceFiles = new ArrayList<>(files);
        this.sizeSourceFiles = size;
    }

    /** Replaces all three file lists with a fresh classification. */
    public void setFiles(CollectedFiles files) {
        setRunFiles(files.runFiles(), files.sizeRunFiles());
        setDocFiles(files.docFiles(), files.sizeDocFiles());
        setSourceFiles(files.sourceFiles(), files.sizeSourceFiles());
    }

    /** Run, doc and source files, in that order. */
    public List<String> allFiles() {
        List<String> all = new ArrayList<>(runFiles.size() + docFiles.size() + sourceFiles.size());
        all.addAll(runFiles);
        all.addAll(docFiles);
        all.addAll(sourceFiles);
        return all;
    }

    public int numFiles() {
        return runFiles.size() + docFiles.size() + sourceFiles.size();
    }

    /**
     * A package without payload: no doc or source files, and either no run file
     * or only its own package manifest.
     */
    public boolean isPureContainer() {
        if (!docFiles.isEmpty() || !sourceFiles.isEmpty()) {
            return false;
        }
        return runFiles.isEmpty()
                || (runFiles.size() == 1 && DigestEngine.isPackageManifest(runFiles.get(0)));
    }

    public Md5Digest digest() {
        return digest;
    }

    public void setDigest(Md5Digest digest) {
        this.digest = digest;
    }

    public long timePackaged() {
        return timePackaged;
    }

    public void setTimePackaged(long timePackaged) {
        this.timePackaged = timePackaged;
    }

    public long archiveFileSize() {
        return archiveFileSize;
    }

    public void setArchiveFileSize(long archiveFileSize) {
        this.archiveFileSize = archiveFileSize;
    }

    public Md5Digest archiveFileDigest() {
        return archiveFileDigest;
    }

    public void setArchiveFileDigest(Md5Digest archiveFileDigest) {
        this.archiveFileDigest = archiveFileDigest;
    }

    /** Staging directory the package was read from, or null for packages loaded from a repository. */
    public Path path() {
        return path;
    }

    public void setPath(Path path) {
        this.path = path;
    }

    private static String nonNull(String s) {
        return s == null ? "" : s;
    }

    @Override
    public String toString() {
        return "PackageInfo[" + id + ", " + numFiles() + " files]";
    }
}
