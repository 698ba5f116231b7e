package com.libragraph.repobuilder.core.manifest;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Source of the signing key. An empty key file means output is not signed.
 */
public interface PrivateKeyProvider {

    Optional<Path> privateKeyFile();

    /** Passphrase of an encrypted key; empty for an unencrypted one. */
    char[] passphrase();
}
