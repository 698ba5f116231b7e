package com.libragraph.repobuilder.formats.process;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One external command line, or a pipeline of them, together with the directory
 * it runs in and an optional file receiving the last stage's standard output.
 *
 * <p>The working directory applies to this invocation only; nothing in the
 * process changes directory.
 *
 * @param stages           pipeline stages, each an argument vector
 * @param workingDirectory directory the stages run in, or null for the current one
 * @param stdout           file receiving the last stage's output, or null to capture it
 */
public record ProcessInvocation(List<List<String>> stages, Path workingDirectory, Path stdout) {

    public ProcessInvocation {
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("Invocation needs at least one command");
        }
        List<List<String>> copy = new ArrayList<>();
        for (List<String> stage : stages) {
            copy.add(List.copyOf(stage));
        }
        stages = List.copyOf(copy);
    }

    public static ProcessInvocation of(String... command) {
        return new ProcessInvocation(List.of(List.of(command)), null, null);
    }

    /** Appends a stage reading this invocation's output. */
    public ProcessInvocation pipe(String... command) {
        List<List<String>> next = new ArrayList<>(stages);
        next.add(List.of(command));
        return new ProcessInvocation(next, workingDirectory, stdout);
    }

    public ProcessInvocation in(Path directory) {
        return new ProcessInvocation(stages, directory, stdout);
    }

    public ProcessInvocation redirectTo(Path file) {
        return new ProcessInvocation(stages, workingDirectory, file);
    }

    /** Shell-like rendering for logs and error messages. */
    public String commandLine() {
        String line = stages.stream()
                .map(s -> String.join(" ", s))
                .collect(Collectors.joining(" | "));
        return stdout == null ? line : line + " > " + stdout;
    }

    @Override
    public String toString() {
        return commandLine();
    }
}
