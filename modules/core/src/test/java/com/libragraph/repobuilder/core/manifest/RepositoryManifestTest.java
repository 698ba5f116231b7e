package com.libragraph.repobuilder.core.manifest;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.util.Md5Digest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepositoryManifestTest {

    @TempDir
    Path tmp;

    @Test
    void shouldPruneMissingAndIgnoredPackages() {
        RepositoryManifest manifest = RepositoryManifest.empty();
        manifest.put("a", RepositoryManifest.LEVEL, "T");
        manifest.put("b", RepositoryManifest.LEVEL, "T");
        manifest.put("gone", RepositoryManifest.LEVEL, "T");

        var removed = manifest.prune(Set.of("a", "b"), id -> id.equals("b"));

        assertThat(removed).containsExactlyInAnyOrder("b", "gone");
        assertThat(manifest.ids()).containsExactly("a");
    }

    @Test
    void shouldExposeDigestAndTimePackaged() {
        RepositoryManifest manifest = RepositoryManifest.empty();
        manifest.put("a", RepositoryManifest.MD5, "d41d8cd98f00b204e9800998ecf8427e");
        manifest.put("a", RepositoryManifest.TIME_PACKAGED, "1700000000");

        assertThat(manifest.digest("a")).contains(Md5Digest.empty());
        assertThat(manifest.timePackaged("a")).hasValue(1_700_000_000L);
        assertThat(manifest.digest("b")).isEmpty();
        assertThat(manifest.timePackaged("b")).isEmpty();
    }

    @Test
    void shouldReportHandEditedEntriesAsBuildErrors() {
        RepositoryManifest manifest = RepositoryManifest.empty();
        manifest.put("a", RepositoryManifest.MD5, "not-a-digest");
        manifest.put("a", RepositoryManifest.TIME_PACKAGED, "1.5");

        assertThatThrownBy(() -> manifest.digest("a"))
                .isInstanceOf(RepositoryBuildException.class)
                .hasMessage("Invalid repository manifest entry a (MD5): not-a-digest");
        assertThatThrownBy(() -> manifest.timePackaged("a"))
                .isInstanceOf(RepositoryBuildException.class)
                .hasMessage("Invalid repository manifest entry a (TimePackaged): 1.5");
    }

    @Test
    void shouldWriteAndReadBack() {
        RepositoryManifest manifest = RepositoryManifest.empty();
        manifest.put("a", RepositoryManifest.LEVEL, "S");
        manifest.put("a", RepositoryManifest.TYPE, "TarLzma");
        Path file = tmp.resolve("mpm.ini");

        manifest.write(file, Optional.empty());
        RepositoryManifest read = RepositoryManifest.read(file);

        assertThat(read.get("a", RepositoryManifest.LEVEL)).contains("S");
        assertThat(read.get("a", RepositoryManifest.TYPE)).contains("TarLzma");
        assertThat(read.size()).isEqualTo(1);
    }
}
