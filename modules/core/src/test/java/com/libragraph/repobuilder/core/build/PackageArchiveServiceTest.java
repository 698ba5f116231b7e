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
import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.util.DigestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PackageArchiveServiceTest {

    private static final long FIRST_RUN = 1_700_000_000L;
    private static final long SECOND_RUN = 1_700_086_400L;

    @TempDir
    Path tmp;

    private CountingArchiver archiver;
    private Path staging;
    private Path repository;
    private RepositoryManifest manifest;

    @BeforeEach
    void setUp() throws Exception {
        archiver = new CountingArchiver();
        staging = new StagingBuilder("a").file("texmf/tex/latex/a/a.sty", "\\ProvidesPackage{a}\n").build(tmp.resolve("staging"));
        repository = Files.createDirectories(tmp.resolve("repo"));
        manifest = RepositoryManifest.empty();
    }

    private PackageArchiveService service(long startTime) {
        return new PackageArchiveService(BuildSession.defaults(startTime), archiver, new PackageManifestCodec());
    }

    private PackageInfo collect() {
        BuildSession session = BuildSession.defaults(0);
        PackageInfo info = new StagingDirectoryCodec().read(staging);
        new PackageCollector(session, new StagingDirectoryCodec(), new FileCollector(session)).collectPackage(info);
        return info;
    }

    private void record(PackageInfo info) {
        manifest.put(info.id(), RepositoryManifest.MD5, info.digest().toHex());
        manifest.put(info.id(), RepositoryManifest.TIME_PACKAGED, Long.toString(info.timePackaged()));
    }

    @Test
    void shouldBuildArchiveWithPackageManifest() throws Exception {
        PackageInfo info = collect();

        ArchiveFormat format = service(FIRST_RUN).createArchiveFile(info, repository, manifest);

        Path archive = repository.resolve("a.tar.lzma");
        assertThat(format).isEqualTo(ArchiveFormat.TAR_LZMA);
        assertThat(archive).exists();
        assertThat(repository.resolve("a.tar")).doesNotExist();
        assertThat(info.timePackaged()).isEqualTo(FIRST_RUN);
        assertThat(info.archiveFileSize()).isEqualTo(Files.size(archive));
        assertThat(info.archiveFileDigest()).isEqualTo(DigestEngine.hashFile(archive));
        assertThat(Files.getLastModifiedTime(archive).toMillis()).isEqualTo(FIRST_RUN * 1000);

        Path out = tmp.resolve("out");
        archiver.extract(archive, ArchiveFormat.TAR_LZMA, out);
        assertThat(out.resolve("texmf/tex/latex/a/a.sty")).hasContent("\\ProvidesPackage{a}\n");
        PackageInfo packaged = new PackageManifestCodec().read(out.resolve("texmf/tpm/packages/a.tpm"));
        assertThat(packaged.digest()).isEqualTo(info.digest());
        assertThat(packaged.timePackaged()).isEqualTo(FIRST_RUN);
    }

    @Test
    void shouldReuseUnchangedArchive() throws Exception {
        PackageInfo first = collect();
        service(FIRST_RUN).createArchiveFile(first, repository, manifest);
        record(first);
        byte[] bytes = Files.readAllBytes(repository.resolve("a.tar.lzma"));

        PackageInfo second = collect();
        service(SECOND_RUN).createArchiveFile(second, repository, manifest);

        assertThat(archiver.writes("a.tar.lzma")).isEqualTo(1);
        assertThat(second.timePackaged()).isEqualTo(FIRST_RUN);
        assertThat(second.digest()).isEqualTo(first.digest());
        assertThat(Files.readAllBytes(repository.resolve("a.tar.lzma"))).isEqualTo(bytes);
    }

    @Test
    void shouldRebuildWhenContentChanged() throws Exception {
        PackageInfo first = collect();
        service(FIRST_RUN).createArchiveFile(first, repository, manifest);
        record(first);
        Files.writeString(staging.resolve("Files/texmf/tex/latex/a/a.sty"), "\\ProvidesPackage{a}[v2]\n");

        PackageInfo second = collect();
        service(SECOND_RUN).createArchiveFile(second, repository, manifest);

        assertThat(archiver.writes("a.tar.lzma")).isEqualTo(2);
        assertThat(second.timePackaged()).isEqualTo(SECOND_RUN);
        assertThat(second.digest()).isNotEqualTo(first.digest());
    }

    @Test
    void shouldRebuildWhenRepositoryManifestDisagrees() {
        PackageInfo first = collect();
        service(FIRST_RUN).createArchiveFile(first, repository, manifest);

        PackageInfo second = collect();
        service(SECOND_RUN).createArchiveFile(second, repository, manifest);

        assertThat(archiver.writes("a.tar.lzma")).isEqualTo(2);
        assertThat(second.timePackaged()).isEqualTo(SECOND_RUN);
    }

    @Test
    void shouldPreferNewestExistingFormat() throws Exception {
        Files.writeString(repository.resolve("a.cab"), "cab");
        Files.writeString(repository.resolve("a.tar.bz2"), "bz2");

        assertThat(service(FIRST_RUN).findExisting(repository, "a"))
                .hasValueSatisfying(e -> assertThat(e.format()).isEqualTo(ArchiveFormat.TAR_BZIP2));
        assertThat(service(FIRST_RUN).findExisting(repository, "b")).isEmpty();
    }

    @Test
    void shouldFailToRebuildPackageWithoutStagingDirectory() {
        PackageInfo info = collect();
        info.setPath(null);

        assertThatThrownBy(() -> service(FIRST_RUN).createArchiveFile(info, repository, manifest))
                .isInstanceOf(RepositoryBuildException.class)
                .hasMessageContaining("no staging directory");
    }
}
