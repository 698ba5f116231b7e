package com.libragraph.repobuilder.core.manifest;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import com.libragraph.repobuilder.util.Md5Digest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;

/**
 * Structured text store used for {@code package.ini}, {@code mpm.ini},
 * {@code pr.ini} and package manifest files.
 *
 * <p>Syntax: {@code [section]} headers, {@code key=value} lines, array values as
 * repeated {@code key[]=value} lines ({@code key;=value} is accepted on read),
 * and {@code ;} or {@code #} comment lines. Keys appearing before the first
 * header belong to the unnamed section {@code ""}. Section names and keys
 * compare case-insensitively. Output is sorted so equal stores render to equal
 * bytes. Backslashes and line breaks in values are escaped; files written by
 * other tools ({@code package.ini}) are read verbatim instead. Everything after
 * the {@code =} is the value, surrounding whitespace included.
 *
 * <p>A signed file carries a trailing {@code ;;signature:<algorithm>:<base64>}
 * line computed over every preceding byte.
 */
public final class IniStore {

    static final String SIGNATURE_PREFIX = ";;signature:";

    private final TreeMap<String, Section> sections = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    private static final class Section {
        final String name;
        final TreeMap<String, Entry> entries = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        Section(String name) {
            this.name = name;
        }
    }

    private static final class Entry {
        final String key;
        final List<String> values = new ArrayList<>();
        final boolean array;

        Entry(String key, boolean array) {
            this.key = key;
            this.array = array;
        }
    }

    public static IniStore read(Path file) {
        return parse(readText(file), true);
    }

    /** Reads a file whose values carry no escapes, so backslashes stay literal. */
    public static IniStore readVerbatim(Path file) {
        return parse(readText(file), false);
    }

    public static IniStore parse(String text) {
        return parse(text, true);
    }

    public static IniStore parse(String text, boolean escaped) {
        IniStore store = new IniStore();
        String section = "";
        for (String raw : text.split("\n", -1)) {
            String line = raw.endsWith("\r") ? raw.substring(0, raw.length() - 1) : raw;
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith(";") || trimmed.startsWith("#")) {
                continue;
            }
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                section = trimmed.substring(1, trimmed.length() - 1).strip();
                store.section(section);
                continue;
            }
            int eq = line.indexOf('=');
            if (eq < 0 || line.substring(0, eq).isBlank()) {
                continue;
            }
            String key = line.substring(0, eq).strip();
            String value = line.substring(eq + 1);
            if (escaped) {
                value = unescape(value);
            }
            if (key.endsWith("[]")) {
                store.append(section, key.substring(0, key.length() - 2).strip(), value);
            } else if (key.endsWith(";")) {
                store.append(section, key.substring(0, key.length() - 1).strip(), value);
            } else {
                store.put(section, key, value);
            }
        }
        return store;
    }

    private static String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private Section section(String name) {
        return sections.computeIfAbsent(name, Section::new);
    }

    /** Single value; for array keys the values joined by {@code ;}. */
    public Optional<String> get(String section, String key) {
        Section s = sections.get(section);
        if (s == null) {
            return Optional.empty();
        }
        Entry e = s.entries.get(key);
        if (e == null) {
            return Optional.empty();
        }
        return Optional.of(String.join(";", e.values));
    }

    /**
     * Digest value of {@code key}, empty when absent or blank.
     *
     * @param source names the file in the error message, e.g. {@code "package manifest (a0poster)"}
     * @throws RepositoryBuildException if the value is not an MD5 hex string
     */
    public Optional<Md5Digest> getDigest(String section, String key, String source) {
        Optional<String> value = get(section, key).map(String::strip).filter(s -> !s.isEmpty());
        try {
            return value.map(Md5Digest::fromHex);
        } catch (IllegalArgumentException e) {
            throw invalid(source, key, value.get(), e);
        }
    }

    /** Numeric value of {@code key}; see {@link #getDigest}. */
    public OptionalLong getLong(String section, String key, String source) {
        Optional<String> value = get(section, key).map(String::strip).filter(s -> !s.isEmpty());
        if (value.isEmpty()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(value.get()));
        } catch (NumberFormatException e) {
            throw invalid(source, key, value.get(), e);
        }
    }

    private static RepositoryBuildException invalid(String source, String key, String value, Exception cause) {
        return new RepositoryBuildException("Invalid " + source + " (" + key + "): " + value, cause);
    }

    /** All values of an array key, or the single value of a plain key. */
    public List<String> getList(String section, String key) {
        Section s = sections.get(section);
        if (s == null || !s.entries.containsKey(key)) {
            return List.of();
        }
        return List.copyOf(s.entries.get(key).values);
    }

    public void put(String section, String key, String value) {
        Entry e = new Entry(key, false);
        e.values.add(value);
        section(section).entries.put(key, e);
    }

    public void putList(String section, String key, List<String> values) {
        Entry e = new Entry(key, true);
        e.values.addAll(values);
        section(section).entries.put(key, e);
    }

    /** Adds one value to an array key, turning a plain key into an array. */
    public void append(String section, String key, String value) {
        Section s = section(section);
        Entry existing = s.entries.get(key);
        if (existing == null || !existing.array) {
            Entry e = new Entry(key, true);
            if (existing != null) {
                e.values.addAll(existing.values);
            }
            s.entries.put(key, e);
            existing = e;
        }
        existing.values.add(value);
    }

    public boolean delete(String section, String key) {
        Section s = sections.get(section);
        return s != null && s.entries.remove(key) != null;
    }

    public boolean deleteSection(String section) {
        return sections.remove(section) != null;
    }

    public boolean hasSection(String section) {
        return sections.containsKey(section);
    }

    /** Section names in output order, each in the case it was first seen. */
    public List<String> sectionNames() {
        List<String> names = new ArrayList<>();
        for (Section s : sections.values()) {
            names.add(s.name);
        }
        return names;
    }

    /** Keys of a section, in output order. */
    public Set<String> keys(String section) {
        Section s = sections.get(section);
        if (s == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(s.entries.navigableKeySet());
    }

    public int size() {
        return sections.size();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (Section s : sections.values()) {
            if (!s.name.isEmpty()) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append('[').append(s.name).append("]\n");
            }
            for (Entry e : s.entries.values()) {
                if (e.array) {
                    for (String v : e.values) {
                        sb.append(e.key).append("[]=").append(escape(v)).append('\n');
                    }
                } else {
                    sb.append(e.key).append('=').append(escape(e.values.get(0))).append('\n');
                }
            }
        }
        return sb.toString();
    }

    public void write(Path file) {
        write(file, Optional.empty());
    }

    /** Writes the store, signed when a signer is given. */
    public void write(Path file, Optional<ManifestSigner> signer) {
        byte[] content = render().getBytes(StandardCharsets.UTF_8);
        try {
            Files.deleteIfExists(file);
            if (signer.isEmpty()) {
                Files.write(file, content);
                return;
            }
            ManifestSigner s = signer.get();
            String line = SIGNATURE_PREFIX + s.algorithm() + ":"
                    + Base64.getEncoder().encodeToString(s.sign(content)) + "\n";
            byte[] trailer = line.getBytes(StandardCharsets.UTF_8);
            byte[] signed = new byte[content.length + trailer.length];
            System.arraycopy(content, 0, signed, 0, content.length);
            System.arraycopy(trailer, 0, signed, content.length, trailer.length);
            Files.write(file, signed);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    /**
     * Checks the trailing signature of a signed file against {@code key}.
     * Returns false for unsigned files and for signatures that do not match.
     */
    public static boolean verify(Path file, PublicKey key) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        int at = text.lastIndexOf(SIGNATURE_PREFIX);
        if (at < 0 || (at > 0 && text.charAt(at - 1) != '\n')) {
            return false;
        }
        String line = text.substring(at + SIGNATURE_PREFIX.length()).strip();
        int colon = line.indexOf(':');
        if (colon < 0) {
            return false;
        }
        try {
            Signature signature = Signature.getInstance(line.substring(0, colon));
            signature.initVerify(key);
            signature.update(text.substring(0, at).getBytes(StandardCharsets.UTF_8));
            return signature.verify(Base64.getDecoder().decode(line.substring(colon + 1)));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            return false;
        }
    }

    private static String escape(String value) {
        if (value.indexOf('\\') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char n = value.charAt(i + 1);
                if (n == '\\' || n == 'n' || n == 'r') {
                    sb.append(n == '\\' ? '\\' : n == 'n' ? '\n' : '\r');
                    i++;
                    continue;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
