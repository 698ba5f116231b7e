package com.libragraph.repobuilder.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Represents an MD5 digest (16 bytes).
 * Immutable value object that can be used as a map key.
 *
 * <p>MD5 is the digest the repository format has always used for file contents,
 * TDS digests and archive checksums; it is a change detector here, not a
 * security boundary (signatures cover that).
 */
public record Md5Digest(byte[] bytes) {
    private static final int DIGEST_LENGTH = 16;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public Md5Digest {
        Objects.requireNonNull(bytes, "Digest bytes cannot be null");
        if (bytes.length != DIGEST_LENGTH) {
            throw new IllegalArgumentException(
                "MD5 digest must be 16 bytes, got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Creates an Md5Digest from a hex string (32 characters, either case).
     */
    public static Md5Digest fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        String trimmed = hex.trim();
        if (trimmed.length() != 32) {
            throw new IllegalArgumentException(
                "MD5 hex string must be 32 characters, got: " + trimmed.length()
            );
        }
        try {
            return new Md5Digest(HEX_FORMAT.parseHex(trimmed.toLowerCase()));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /** Digest of the given bytes. */
    public static Md5Digest of(byte[] data) {
        MessageDigest md = newMessageDigest();
        md.update(data);
        return new Md5Digest(md.digest());
    }

    /** Digest of zero bytes ({@code d41d8cd98f00b204e9800998ecf8427e}). */
    public static Md5Digest empty() {
        return new Md5Digest(newMessageDigest().digest());
    }

    static MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    /**
     * Returns lowercase hex representation (32 characters).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Md5Digest other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
