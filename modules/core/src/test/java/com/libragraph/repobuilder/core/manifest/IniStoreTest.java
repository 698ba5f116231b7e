package com.libragraph.repobuilder.core.manifest;

import com.libragraph.repobuilder.core.RepositoryBuildException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IniStoreTest {

    @TempDir
    Path tmp;

    @Test
    void shouldParseSectionsArraysAndComments() {
        IniStore store = IniStore.parse("""
                ; comment
                top=level
                [a0poster]
                # another comment
                displayName=A0 Poster
                runFiles[]=texmf/tex/latex/a0poster/a0poster.cls
                runFiles[]=texmf/tex/latex/a0poster/a0size.sty
                requires;=b
                requires;=c
                """);

        assertThat(store.get("", "top")).contains("level");
        assertThat(store.get("a0poster", "displayName")).contains("A0 Poster");
        assertThat(store.getList("a0poster", "runFiles")).containsExactly(
                "texmf/tex/latex/a0poster/a0poster.cls",
                "texmf/tex/latex/a0poster/a0size.sty");
        assertThat(store.get("a0poster", "requires")).contains("b;c");
    }

    @Test
    void shouldCompareSectionsAndKeysCaseInsensitively() {
        IniStore store = IniStore.parse("[Pkg]\nMD5=abc\n");

        assertThat(store.hasSection("pkg")).isTrue();
        assertThat(store.get("PKG", "md5")).contains("abc");
        assertThat(store.sectionNames()).containsExactly("Pkg");
    }

    @Test
    void shouldRenderSortedRegardlessOfInsertionOrder() {
        IniStore first = new IniStore();
        first.put("b", "y", "2");
        first.put("a", "x", "1");
        first.putList("a", "files", List.of("f1", "f2"));
        IniStore second = new IniStore();
        second.putList("a", "files", List.of("f1", "f2"));
        second.put("a", "x", "1");
        second.put("b", "y", "2");

        assertThat(first.render()).isEqualTo(second.render());
        assertThat(first.render()).isEqualTo("[a]\nfiles[]=f1\nfiles[]=f2\nx=1\n\n[b]\ny=2\n");
    }

    @Test
    void shouldRoundTripEscapedValues() {
        IniStore store = new IniStore();
        store.put("p", "description", "line one\nline two with \\ backslash");

        IniStore parsed = IniStore.parse(store.render());

        assertThat(parsed.get("p", "description")).contains("line one\nline two with \\ backslash");
    }

    @Test
    void shouldDeleteKeysAndSections() {
        IniStore store = IniStore.parse("[a]\nx=1\ny=2\n[b]\nz=3\n");

        assertThat(store.delete("a", "x")).isTrue();
        assertThat(store.delete("a", "missing")).isFalse();
        assertThat(store.deleteSection("b")).isTrue();

        assertThat(store.keys("a")).containsExactly("y");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void shouldSignAndVerify() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        KeyPair pair = generator.generateKeyPair();
        IniStore store = IniStore.parse("[a]\nMD5=d41d8cd98f00b204e9800998ecf8427e\n");
        Path file = tmp.resolve("mpm.ini");

        store.write(file, Optional.of(new ManifestSigner(pair.getPrivate())));

        assertThat(Files.readString(file)).contains(";;signature:SHA256withRSA:");
        assertThat(IniStore.verify(file, pair.getPublic())).isTrue();
        assertThat(IniStore.read(file).get("a", "MD5")).contains("d41d8cd98f00b204e9800998ecf8427e");
    }

    @Test
    void shouldRejectTamperedSignedFile() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        KeyPair pair = generator.generateKeyPair();
        Path file = tmp.resolve("mpm.ini");
        IniStore.parse("[a]\nLevel=T\n").write(file, Optional.of(new ManifestSigner(pair.getPrivate())));

        Files.writeString(file, Files.readString(file).replace("Level=T", "Level=S"));

        assertThat(IniStore.verify(file, pair.getPublic())).isFalse();
    }

    @Test
    void shouldNotVerifyUnsignedFile() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        Path file = tmp.resolve("plain.ini");
        IniStore.parse("[a]\nx=1\n").write(file);

        assertThat(IniStore.verify(file, generator.generateKeyPair().getPublic())).isFalse();
    }

    @Test
    void shouldKeepWhitespaceAroundValues() {
        IniStore store = new IniStore();
        store.put("p", "description", "  indented text ");

        IniStore parsed = IniStore.parse(store.render());

        assertThat(parsed.get("p", "description")).contains("  indented text ");
    }

    @Test
    void shouldDropCarriageReturnsOfCrlfFiles() {
        IniStore store = IniStore.parse("[a]\r\nx=1\r\n");

        assertThat(store.get("a", "x")).contains("1");
    }

    @Test
    void shouldReadBackslashesVerbatim() throws Exception {
        Path file = tmp.resolve("package.ini");
        Files.writeString(file, "title=\\newcommand and \\relax\n");

        assertThat(IniStore.readVerbatim(file).get("", "title")).contains("\\newcommand and \\relax");
        assertThat(IniStore.read(file).get("", "title")).contains("\newcommand and \relax");
    }

    @Test
    void shouldParseTypedValues() {
        IniStore store = IniStore.parse("[a]\nMD5= d41d8cd98f00b204e9800998ecf8427e\nTimePackaged=1700000000\nempty=\n");

        assertThat(store.getDigest("a", "MD5", "test file")).isPresent();
        assertThat(store.getLong("a", "TimePackaged", "test file")).hasValue(1700000000L);
        assertThat(store.getLong("a", "empty", "test file")).isEmpty();
        assertThat(store.getDigest("a", "missing", "test file")).isEmpty();
    }

    @Test
    void shouldReportMalformedTypedValues() {
        IniStore store = IniStore.parse("[a]\nMD5=xyz\nTimePackaged=yesterday\n");

        assertThatThrownBy(() -> store.getDigest("a", "MD5", "test file"))
                .isInstanceOf(RepositoryBuildException.class)
                .hasMessage("Invalid test file (MD5): xyz");
        assertThatThrownBy(() -> store.getLong("a", "TimePackaged", "test file"))
                .isInstanceOf(RepositoryBuildException.class)
                .hasMessage("Invalid test file (TimePackaged): yesterday");
    }
}
