package com.libragraph.repobuilder.formats.external;

import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.formats.api.ExternalToolException;
import com.libragraph.repobuilder.formats.api.ToolNotFoundException;
import com.libragraph.repobuilder.formats.api.UnsupportedArchiveFormatException;
import com.libragraph.repobuilder.formats.process.ProcessExecutor;
import com.libragraph.repobuilder.formats.process.ProcessInvocation;
import com.libragraph.repobuilder.formats.process.ProcessResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExternalArchiverTest {

    @TempDir
    Path tmp;

    private RecordingExecutor executor;
    private ExternalArchiver archiver;

    @BeforeEach
    void setUp() {
        executor = new RecordingExecutor();
        archiver = new ExternalArchiver(executor, Optional.of(Path.of("/opt/xz")), Map.of());
    }

    @Test
    void shouldPipeTarIntoXzForLzmaArchives() {
        Path archive = tmp.resolve("a.tar.lzma");
        archiver.create(ArchiveFormat.TAR_LZMA, tmp, "Files", archive);

        ProcessInvocation inv = executor.only();
        assertThat(inv.stages()).containsExactly(
                List.of("tar", "--force-local", "-cf", "-", "Files"),
                List.of("/opt/xz", "--compress", "--format=lzma"));
        assertThat(inv.workingDirectory()).isEqualTo(tmp);
        assertThat(inv.stdout()).isEqualTo(archive.toAbsolutePath());
    }

    @Test
    void shouldExtractBzip2TarInTargetDirectory() {
        Path out = tmp.resolve("out");
        archiver.extract(tmp.resolve("a.tar.bz2"), ArchiveFormat.TAR_BZIP2, out);

        ProcessInvocation inv = executor.only();
        assertThat(inv.stages().get(0)).containsExactly("tar", "--force-local", "-xjf",
                tmp.resolve("a.tar.bz2").toAbsolutePath().toString());
        assertThat(inv.workingDirectory()).isEqualTo(out);
        assertThat(out).isDirectory();
    }

    @Test
    void shouldStreamSingleCabinetMember() {
        Path out = tmp.resolve("mpm.ini");
        archiver.extractFile(tmp.resolve("db.cab"), ArchiveFormat.CABINET, "mpm.ini", out);

        ProcessInvocation inv = executor.only();
        assertThat(inv.stages().get(0)).startsWith("cabextract", "--filter", "mpm.ini", "--pipe");
        assertThat(inv.stdout()).isEqualTo(out.toAbsolutePath());
    }

    @Test
    void shouldCompressWithBzip2KeepingInput() {
        Path file = tmp.resolve("files.csv");
        archiver.compress(file, ArchiveFormat.TAR_BZIP2, tmp.resolve("files.csv.bz2"));

        assertThat(executor.only().stages().get(0))
                .containsExactly("bzip2", "--keep", "--compress", "--stdout", file.toAbsolutePath().toString());
    }

    @Test
    void shouldAppendMemberToEmptyTar() {
        archiver.createTar(tmp.resolve("x.tar"), tmp, "texmf");

        assertThat(executor.invocations).hasSize(2);
        assertThat(executor.invocations.get(0).stages().get(0)).contains("--files-from=/dev/null");
        assertThat(executor.invocations.get(1).stages().get(0)).contains("-rf", "texmf");
        assertThat(executor.invocations.get(1).workingDirectory()).isEqualTo(tmp);
    }

    @Test
    void shouldCreateEmptyTarWhenDirectoryIsMissing() {
        archiver.createTar(tmp.resolve("x.tar"), tmp.resolve("missing"), "texmf");

        assertThat(executor.invocations).hasSize(1);
    }

    @Test
    void shouldReportCommandAndOutputOnFailure() {
        executor.next = new ProcessResult(2, "tar: Files: Cannot stat");

        assertThatThrownBy(() -> archiver.create(ArchiveFormat.TAR_BZIP2, tmp, "Files", tmp.resolve("a.tar.bz2")))
                .isInstanceOfSatisfying(ExternalToolException.class, e -> {
                    assertThat(e.exitCode()).isEqualTo(2);
                    assertThat(e.command()).startsWith("tar --force-local -cjf");
                    assertThat(e.output()).contains("Cannot stat");
                });
    }

    @Test
    void shouldRefuseToCreateCabinets() {
        assertThatThrownBy(() -> archiver.create(ArchiveFormat.CABINET, tmp, "Files", tmp.resolve("a.cab")))
                .isInstanceOf(UnsupportedArchiveFormatException.class);
        assertThat(executor.invocations).isEmpty();
    }

    @Test
    void shouldFailWhenXzIsNotOnPath() {
        ExternalArchiver noXz = new ExternalArchiver(executor, Optional.empty(), Map.of("PATH", tmp.toString()));

        assertThatThrownBy(() -> noXz.compress(tmp.resolve("f"), ArchiveFormat.TAR_LZMA, tmp.resolve("f.lzma")))
                .isInstanceOf(ToolNotFoundException.class)
                .hasMessage("The xz utility could not be found.");
    }

    @Test
    void shouldFailWhenPathIsUnset() {
        ExternalArchiver noPath = new ExternalArchiver(executor, Optional.empty(), Map.of());

        assertThatThrownBy(() -> noPath.compress(tmp.resolve("f"), ArchiveFormat.TAR_LZMA, tmp.resolve("f.lzma")))
                .isInstanceOf(ToolNotFoundException.class)
                .hasMessage("PATH is not set.");
    }

    private static class RecordingExecutor implements ProcessExecutor {
        final List<ProcessInvocation> invocations = new ArrayList<>();
        ProcessResult next = new ProcessResult(0, "");

        @Override
        public ProcessResult execute(ProcessInvocation invocation) {
            invocations.add(invocation);
            return next;
        }

        ProcessInvocation only() {
            assertThat(invocations).hasSize(1);
            return invocations.get(0);
        }
    }
}
