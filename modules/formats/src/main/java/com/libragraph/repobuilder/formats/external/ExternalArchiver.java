package com.libragraph.repobuilder.formats.external;

import com.libragraph.repobuilder.formats.api.ArchiveException;
import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.formats.api.Archiver;
import com.libragraph.repobuilder.formats.api.ExternalToolException;
import com.libragraph.repobuilder.formats.api.UnsupportedArchiveFormatException;
import com.libragraph.repobuilder.formats.process.ProcessExecutor;
import com.libragraph.repobuilder.formats.process.ProcessInvocation;
import com.libragraph.repobuilder.formats.process.ProcessResult;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link Archiver} that shells out to tar, xz, bzip2, zip/unzip and cabextract.
 *
 * <p>All command lines come from one table, {@link #COMMANDS}, keyed by format.
 * Each invocation runs exactly once; a non-zero exit is reported with the
 * command and the captured output.
 */
public class ExternalArchiver implements Archiver {

    private static final Logger log = Logger.getLogger(ExternalArchiver.class);

    /** Command templates of one format. Operations a format lacks stay unsupported. */
    private interface Commands {
        default ProcessInvocation create(ArchiveFormat f, Path archive, String member, Tools t) {
            throw new UnsupportedArchiveFormatException(f, "create");
        }

        default ProcessInvocation extract(ArchiveFormat f, Path archive, Tools t) {
            throw new UnsupportedArchiveFormatException(f, "extract");
        }

        default ProcessInvocation extractMember(ArchiveFormat f, Path archive, String member, Tools t) {
            throw new UnsupportedArchiveFormatException(f, "extract file");
        }

        default ProcessInvocation compress(ArchiveFormat f, Path file, Tools t) {
            throw new UnsupportedArchiveFormatException(f, "compress");
        }
    }

    /** Lazily resolved tool paths. */
    private interface Tools {
        String xz();
    }

    private static final Map<ArchiveFormat, Commands> COMMANDS = new EnumMap<>(ArchiveFormat.class);

    static {
        COMMANDS.put(ArchiveFormat.CABINET, new Commands() {
            @Override
            public ProcessInvocation extract(ArchiveFormat f, Path archive, Tools t) {
                return ProcessInvocation.of("cabextract", archive.toString());
            }

            @Override
            public ProcessInvocation extractMember(ArchiveFormat f, Path archive, String member, Tools t) {
                return ProcessInvocation.of("cabextract", "--filter", member, "--pipe", archive.toString());
            }
        });
        COMMANDS.put(ArchiveFormat.TAR_BZIP2, new Commands() {
            @Override
            public ProcessInvocation create(ArchiveFormat f, Path archive, String member, Tools t) {
                return ProcessInvocation.of("tar", "--force-local", "-cjf", archive.toString(), member);
            }

            @Override
            public ProcessInvocation extract(ArchiveFormat f, Path archive, Tools t) {
                return ProcessInvocation.of("tar", "--force-local", "-xjf", archive.toString());
            }

            @Override
            public ProcessInvocation extractMember(ArchiveFormat f, Path archive, String member, Tools t) {
                return ProcessInvocation.of("tar", "--force-local", "--to-stdout", "-xjf", archive.toString(), member);
            }

            @Override
            public ProcessInvocation compress(ArchiveFormat f, Path file, Tools t) {
                return ProcessInvocation.of("bzip2", "--keep", "--compress", "--stdout", file.toString());
            }
        });
        COMMANDS.put(ArchiveFormat.TAR_LZMA, new Commands() {
            @Override
            public ProcessInvocation create(ArchiveFormat f, Path archive, String member, Tools t) {
                return ProcessInvocation.of("tar", "--force-local", "-cf", "-", member)
                        .pipe(t.xz(), "--compress", "--format=lzma")
                        .redirectTo(archive);
            }

            @Override
            public ProcessInvocation extract(ArchiveFormat f, Path archive, Tools t) {
                return ProcessInvocation.of(t.xz(), "--decompress", "--format=lzma", "--keep", "--stdout", archive.toString())
                        .pipe("tar", "--force-local", "-xf", "-");
            }

            @Override
            public ProcessInvocation extractMember(ArchiveFormat f, Path archive, String member, Tools t) {
                return ProcessInvocation.of(t.xz(), "--decompress", "--format=lzma", "--keep", "--stdout", archive.toString())
                        .pipe("tar", "--force-local", "--to-stdout", "-xf", "-", member);
            }

            @Override
            public ProcessInvocation compress(ArchiveFormat f, Path file, Tools t) {
                return ProcessInvocation.of(t.xz(), "--compress", "--format=lzma", "--keep", "--stdout", file.toString());
            }
        });
        COMMANDS.put(ArchiveFormat.TAR, new Commands() {
            @Override
            public ProcessInvocation create(ArchiveFormat f, Path archive, String member, Tools t) {
                return ProcessInvocation.of("tar", "--force-local", "-cf", archive.toString(), member);
            }

            @Override
            public ProcessInvocation extract(ArchiveFormat f, Path archive, Tools t) {
                return ProcessInvocation.of("tar", "--force-local", "-xf", archive.toString());
            }

            @Override
            public ProcessInvocation extractMember(ArchiveFormat f, Path archive, String member, Tools t) {
                return ProcessInvocation.of("tar", "--force-local", "--to-stdout", "-xf", archive.toString(), member);
            }
        });
        COMMANDS.put(ArchiveFormat.ZIP, new Commands() {
            @Override
            public ProcessInvocation create(ArchiveFormat f, Path archive, String member, Tools t) {
                return ProcessInvocation.of("zip", "-r", "-X", "-q", archive.toString(), member);
            }

            @Override
            public ProcessInvocation extract(ArchiveFormat f, Path archive, Tools t) {
                return ProcessInvocation.of("unzip", "-o", "-q", archive.toString());
            }

            @Override
            public ProcessInvocation extractMember(ArchiveFormat f, Path archive, String member, Tools t) {
                return ProcessInvocation.of("unzip", "-p", archive.toString(), member);
            }
        });
    }

    private final ProcessExecutor executor;
    private final Optional<Path> xzOverride;
    private final Map<String, String> environment;
    private Path xz;

    private final Tools tools = () -> xz().toString();

    /**
     * @param executor    runs the command lines
     * @param xzOverride  explicit xz location; when empty xz is searched on {@code PATH}
     * @param environment environment used for tool discovery
     */
    public ExternalArchiver(ProcessExecutor executor, Optional<Path> xzOverride, Map<String, String> environment) {
        this.executor = executor;
        this.xzOverride = xzOverride;
        this.environment = Map.copyOf(environment);
    }

    private Path xz() {
        if (xz == null) {
            xz = xzOverride.orElseGet(() -> ToolLocator.find("xz", environment));
        }
        return xz;
    }

    private Commands commands(ArchiveFormat format) {
        return COMMANDS.get(format);
    }

    @Override
    public void create(ArchiveFormat format, Path workingDirectory, String member, Path archive) {
        ProcessInvocation inv = commands(format).create(format, archive.toAbsolutePath(), member, tools);
        deleteIfExists(archive);
        run(inv.in(workingDirectory));
    }

    @Override
    public void createTar(Path tarFile, Path workingDirectory, String member) {
        Path tar = tarFile.toAbsolutePath();
        deleteIfExists(tar);
        run(ProcessInvocation.of("tar", "--force-local", "-cf", tar.toString(), "--files-from=/dev/null"));
        if (workingDirectory != null && Files.isDirectory(workingDirectory)) {
            run(ProcessInvocation.of("tar", "--force-local", "-rf", tar.toString(), member).in(workingDirectory));
        }
    }

    @Override
    public void compress(Path file, ArchiveFormat format, Path outFile) {
        ProcessInvocation inv = commands(format).compress(format, file.toAbsolutePath(), tools);
        deleteIfExists(outFile);
        run(inv.redirectTo(outFile.toAbsolutePath()));
    }

    @Override
    public void extract(Path archive, ArchiveFormat format, Path outDir) {
        ProcessInvocation inv = commands(format).extract(format, archive.toAbsolutePath(), tools);
        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            throw new ArchiveException("Failed to create " + outDir, e);
        }
        run(inv.in(outDir));
    }

    @Override
    public void extractFile(Path archive, ArchiveFormat format, String member, Path outFile) {
        ProcessInvocation inv = commands(format).extractMember(format, archive.toAbsolutePath(), member, tools);
        run(inv.redirectTo(outFile.toAbsolutePath()));
    }

    private void run(ProcessInvocation invocation) {
        ProcessResult result = executor.execute(invocation);
        if (!result.succeeded()) {
            log.debugf("%s exited with %d", invocation.commandLine(), result.exitCode());
            throw new ExternalToolException(invocation.commandLine(), result.exitCode(), result.output());
        }
    }

    private static void deleteIfExists(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new ArchiveException("Failed to delete " + file, e);
        }
    }
}
