package com.libragraph.repobuilder.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class Md5DigestTest {

    @Test
    void shouldDefensiveCopyOnConstruction() {
        byte[] bytes = new byte[16];
        bytes[0] = (byte) 0x01;
        Md5Digest digest = new Md5Digest(bytes);

        bytes[0] = (byte) 0xFF;
        assertThat(digest.bytes()[0]).isEqualTo((byte) 0x01);
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new Md5Digest(new byte[8]))
                .withMessageContaining("16 bytes");
    }

    @Test
    void shouldRejectNullBytes() {
        assertThatNullPointerException()
                .isThrownBy(() -> new Md5Digest(null));
    }

    @Test
    void shouldParseUpperAndLowerCaseHex() {
        Md5Digest lower = Md5Digest.fromHex("0123456789abcdef0123456789abcdef");
        Md5Digest upper = Md5Digest.fromHex("0123456789ABCDEF0123456789ABCDEF");

        assertThat(lower).isEqualTo(upper);
        assertThat(upper.toHex()).isEqualTo("0123456789abcdef0123456789abcdef");
    }

    @Test
    void shouldRejectInvalidHexLength() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> Md5Digest.fromHex("abcd"))
                .withMessageContaining("32 characters");
    }

    @Test
    void shouldMatchKnownDigests() {
        assertThat(Md5Digest.empty().toHex()).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
        assertThat(Md5Digest.of("abc".getBytes(StandardCharsets.US_ASCII)).toHex())
                .isEqualTo("900150983cd24fb0d6963f7d28e17f72");
    }

    @Test
    void shouldImplementEqualsAndHashCode() {
        Md5Digest a = Md5Digest.fromHex("0123456789abcdef0123456789abcdef");
        Md5Digest b = Md5Digest.fromHex("0123456789abcdef0123456789abcdef");
        Md5Digest c = Md5Digest.fromHex("fedcba9876543210fedcba9876543210");

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
        assertThat(a.toString()).isEqualTo(a.toHex());
    }
}
