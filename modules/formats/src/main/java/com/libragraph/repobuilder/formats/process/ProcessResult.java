package com.libragraph.repobuilder.formats.process;

/**
 * Exit status of an invocation (first non-zero stage wins) and its combined
 * captured output.
 */
public record ProcessResult(int exitCode, String output) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
