package com.libragraph.repobuilder.formats.process;

/**
 * Runs external commands to completion. No timeout: a hanging tool hangs the caller.
 */
public interface ProcessExecutor {

    /**
     * Runs the invocation and returns once every stage has exited.
     *
     * @throws com.libragraph.repobuilder.formats.api.ExternalToolException if a stage cannot be started
     */
    ProcessResult execute(ProcessInvocation invocation);
}
