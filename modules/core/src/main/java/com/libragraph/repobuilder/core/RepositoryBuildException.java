package com.libragraph.repobuilder.core;

/**
 * Unrecoverable condition that aborts the whole run: missing mandatory input,
 * a bad digest, a missing repository archive or an invalid package list.
 */
public class RepositoryBuildException extends RuntimeException {

    public RepositoryBuildException(String message) {
        super(message);
    }

    public RepositoryBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
