package com.libragraph.repobuilder.formats.process;

import com.libragraph.repobuilder.formats.api.ArchiveException;
import com.libragraph.repobuilder.formats.api.ExternalToolException;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link ProcessExecutor} backed by {@link ProcessBuilder}. Pipelines are started
 * with {@link ProcessBuilder#startPipeline}; standard error of every stage (and
 * standard output of the last, unless redirected to a file) is collected in a
 * capture file that is read once the invocation finishes.
 */
@ApplicationScoped
public class SystemProcessExecutor implements ProcessExecutor {

    private static final Logger log = Logger.getLogger(SystemProcessExecutor.class);

    @Override
    public ProcessResult execute(ProcessInvocation invocation) {
        String commandLine = invocation.commandLine();
        log.debugf("working directory: %s",
                invocation.workingDirectory() != null ? invocation.workingDirectory() : Path.of("").toAbsolutePath());
        log.debugf("running: %s", commandLine);

        Path capture;
        try {
            capture = Files.createTempFile("repobuilder-", ".out");
        } catch (IOException e) {
            throw new ArchiveException("Failed to create process output capture file", e);
        }
        try {
            List<ProcessBuilder> builders = new ArrayList<>();
            List<List<String>> stages = invocation.stages();
            for (int i = 0; i < stages.size(); i++) {
                ProcessBuilder pb = new ProcessBuilder(stages.get(i));
                if (invocation.workingDirectory() != null) {
                    pb.directory(invocation.workingDirectory().toFile());
                }
                pb.redirectError(ProcessBuilder.Redirect.appendTo(capture.toFile()));
                if (i == stages.size() - 1) {
                    if (invocation.stdout() != null) {
                        pb.redirectOutput(ProcessBuilder.Redirect.to(invocation.stdout().toFile()));
                    } else {
                        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(capture.toFile()));
                    }
                }
                builders.add(pb);
            }

            List<Process> processes;
            try {
                processes = builders.size() == 1
                        ? List.of(builders.get(0).start())
                        : ProcessBuilder.startPipeline(builders);
            } catch (IOException e) {
                throw new ExternalToolException(commandLine, e.getMessage(), e);
            }
            processes.get(0).getOutputStream().close();

            int exitCode = 0;
            for (Process p : processes) {
                int code = p.waitFor();
                if (code != 0 && exitCode == 0) {
                    exitCode = code;
                }
            }
            String output = new String(Files.readAllBytes(capture), StandardCharsets.UTF_8);
            return new ProcessResult(exitCode, output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArchiveException("Interrupted while running: " + commandLine, e);
        } catch (IOException e) {
            throw new ArchiveException("I/O failure while running: " + commandLine, e);
        } finally {
            try {
                Files.deleteIfExists(capture);
            } catch (IOException e) {
                log.debugf("could not delete capture file %s: %s", capture, e.getMessage());
            }
        }
    }
}
