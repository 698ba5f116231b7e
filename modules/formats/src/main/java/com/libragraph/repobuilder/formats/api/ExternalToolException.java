package com.libragraph.repobuilder.formats.api;

/**
 * An external archiver or compressor could not be started or exited non-zero.
 * Carries the command line and the tool's combined output for the operator.
 */
public class ExternalToolException extends ArchiveException {

    private final String command;
    private final int exitCode;
    private final String output;

    public ExternalToolException(String command, int exitCode, String output) {
        super("A system command failed: " + command);
        this.command = command;
        this.exitCode = exitCode;
        this.output = output;
    }

    public ExternalToolException(String command, String output, Throwable cause) {
        super("A system command could not be started: " + command, cause);
        this.command = command;
        this.exitCode = -1;
        this.output = output;
    }

    public String command() {
        return command;
    }

    /** Exit status, or -1 when the tool could not be spawned. */
    public int exitCode() {
        return exitCode;
    }

    public String output() {
        return output;
    }
}
