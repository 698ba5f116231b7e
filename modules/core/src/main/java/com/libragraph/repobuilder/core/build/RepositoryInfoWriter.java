package com.libragraph.repobuilder.core.build;

import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.manifest.IniStore;
import com.libragraph.repobuilder.core.manifest.RepositoryManifest;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.util.Md5Digest;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Writes the repository summary {@code pr.ini}.
 *
 * <p>The summary carries a digest over the repository listing, which includes
 * the summary itself. It is therefore written twice: first with the digest of
 * empty input, then with the digest of the listing taken after the first write.
 */
@ApplicationScoped
public class RepositoryInfoWriter {

    public static final String FILE_NAME = "pr.ini";
    static final String SECTION = "repository";

    /** 2000-01-01 in the time zone the version stamp was defined in. */
    static final long VERSION_EPOCH = 946681200L;
    private static final long SECONDS_PER_DAY = 60 * 60 * 24;

    private final BuildSession session;

    @Inject
    public RepositoryInfoWriter(BuildSession session) {
        this.session = session;
    }

    public Path write(Path repository, RepositoryManifest manifest, Map<String, PackageInfo> table) {
        IniStore store = new IniStore();
        store.put(SECTION, "date", Long.toString(session.startTime()));
        store.put(SECTION, "version", Long.toString(versionStamp(session.startTime())));
        store.put(SECTION, "lstdigest", Md5Digest.empty().toHex());
        store.put(SECTION, "numpkg", Integer.toString(manifest.size()));
        store.put(SECTION, "lastupd", String.join(" ", lastUpdated(manifest, table)));
        store.put(SECTION, "relstate", session.releaseState());

        Path file = repository.resolve(FILE_NAME);
        store.write(file, session.signer());
        store.put(SECTION, "lstdigest", listingDigest(repository).toHex());
        store.write(file, session.signer());
        return file;
    }

    /** Days between the version epoch and {@code time}. */
    static long versionStamp(long time) {
        return (time - VERSION_EPOCH) / SECONDS_PER_DAY;
    }

    /**
     * Ids of the most recently packaged packages, newest first. Packages
     * without a recorded time sort last; equal times keep id order.
     */
    List<String> lastUpdated(RepositoryManifest manifest, Map<String, PackageInfo> table) {
        List<Map.Entry<String, Long>> times = new ArrayList<>();
        for (String id : table.keySet()) {
            times.add(Map.entry(id, manifest.timePackaged(id).orElse(PackageInfo.UNKNOWN_TIME)));
        }
        times.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()));
        return times.stream()
                .limit(session.lastUpdatedCount())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    /** MD5 over the sorted {@code name;size\n} lines of the directory's entries. */
    static Md5Digest listingDigest(Path directory) {
        List<String> lines = new ArrayList<>();
        try (Stream<Path> list = Files.list(directory)) {
            for (Path entry : (Iterable<Path>) list::iterator) {
                long size = Files.isRegularFile(entry) ? Files.size(entry) : 0;
                lines.add(entry.getFileName() + ";" + size + "\n");
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
        Collections.sort(lines);
        return Md5Digest.of(String.join("", lines).getBytes(StandardCharsets.UTF_8));
    }
}
