package com.libragraph.repobuilder.core.manifest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Key file plus an optional file holding the passphrase. A trailing line break
 * in the passphrase file is not part of the passphrase.
 */
public record FilePrivateKeyProvider(Optional<Path> privateKeyFile, Optional<Path> passphraseFile)
        implements PrivateKeyProvider {

    public static FilePrivateKeyProvider none() {
        return new FilePrivateKeyProvider(Optional.empty(), Optional.empty());
    }

    @Override
    public char[] passphrase() {
        if (passphraseFile.isEmpty()) {
            return new char[0];
        }
        try {
            String text = Files.readString(passphraseFile.get(), StandardCharsets.UTF_8);
            return text.replaceAll("[\r\n]+$", "").toCharArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read passphrase file " + passphraseFile.get(), e);
        }
    }
}
