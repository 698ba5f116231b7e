package com.libragraph.repobuilder.core.build;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.core.StagingBuilder;
import com.libragraph.repobuilder.core.collect.FileCollector;
import com.libragraph.repobuilder.core.collect.PackageCollector;
import com.libragraph.repobuilder.core.config.BuildSession;
import com.libragraph.repobuilder.core.manifest.PackageManifestCodec;
import com.libragraph.repobuilder.core.manifest.RepositoryManifest;
import com.libragraph.repobuilder.core.model.PackageInfo;
import com.libragraph.repobuilder.core.staging.StagingDirectoryCodec;
import com.libragraph.repobuilder.util.Md5Digest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HierarchyBuilderTest {

    private static final long START = 1_700_000_000L;

    @TempDir
    Path tmp;

    private BuildSession session;
    private HierarchyBuilder builder;
    private PackageInfo info;

    @BeforeEach
    void setUp() {
        session = BuildSession.defaults(START);
        builder = new HierarchyBuilder(session, new PackageManifestCodec());
        new StagingBuilder("a").version("1.0")
                .file("texmf/tex/latex/a/a.sty", "a")
                .file("texmf/doc/latex/a/README", "readme")
                .build(tmp.resolve("staging"));
        info = new PackageCollector(session, new StagingDirectoryCodec(), new FileCollector(session))
                .collectPackages(List.of(tmp.resolve("staging"))).get("a");
    }

    @Test
    void shouldInstallFilesAndRecordPackage() {
        Path texmfParent = tmp.resolve("tree");
        RepositoryManifest manifest = RepositoryManifest.empty();

        builder.build(Map.of("a", info), texmfParent, manifest);

        assertThat(texmfParent.resolve("texmf/tex/latex/a/a.sty")).hasContent("a");
        assertThat(texmfParent.resolve("texmf/doc/latex/a/README")).hasContent("readme");
        PackageInfo installed = new PackageManifestCodec().read(texmfParent.resolve("texmf/tpm/packages/a.tpm"));
        assertThat(installed.timePackaged()).isEqualTo(START);
        assertThat(manifest.get("a", RepositoryManifest.LEVEL)).contains("T");
        assertThat(manifest.digest("a")).contains(info.digest());
        assertThat(manifest.timePackaged("a")).hasValue(START);
        assertThat(manifest.get("a", RepositoryManifest.VERSION)).contains("1.0");
        assertThat(manifest.get("a", RepositoryManifest.TARGET_SYSTEM)).isEmpty();
    }

    @Test
    void shouldFailOnDigestMismatch() {
        info.setDigest(Md5Digest.empty());

        assertThatThrownBy(() -> builder.build(Map.of("a", info), tmp.resolve("tree"), RepositoryManifest.empty()))
                .isInstanceOf(RepositoryBuildException.class)
                .hasMessage("Bad TDS digest (a).");
    }

    @Test
    void shouldFailOnMissingFile() throws Exception {
        Files.delete(tmp.resolve("staging/a/Files/texmf/doc/latex/a/README"));

        assertThatThrownBy(() -> builder.build(Map.of("a", info), tmp.resolve("tree"), RepositoryManifest.empty()))
                .isInstanceOf(RepositoryBuildException.class)
                .hasMessageStartingWith("No match for ");
    }
}
