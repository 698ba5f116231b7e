package com.libragraph.repobuilder.formats.codecs;

import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class LzmaCodecTest {
    private LzmaCodec codec;

    @BeforeEach
    void setUp() {
        codec = new LzmaCodec();
    }

    @Test
    void shouldImplementLzma() {
        assertThat(codec.compression()).isEqualTo(ArchiveFormat.Compression.LZMA);
    }

    @Test
    void shouldRoundTripWithDifferentContent() throws Exception {
        String[] testCases = {
                "",
                "Short",
                "A".repeat(1000),
                "texmf/tex/latex/a/a.sty;a\ntexmf/doc/latex/a/README;a\n",
        };

        for (String original : testCases) {
            ByteArrayOutputStream compressed = new ByteArrayOutputStream();
            try (OutputStream out = codec.encoding(compressed)) {
                out.write(original.getBytes(StandardCharsets.UTF_8));
            }
            try (InputStream in = codec.decoding(new ByteArrayInputStream(compressed.toByteArray()))) {
                assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo(original);
            }
        }
    }

    @Test
    void shouldProduceIdenticalOutputForIdenticalInput() throws Exception {
        byte[] input = "files.csv content\n".repeat(50).getBytes(StandardCharsets.UTF_8);

        assertThat(encode(input)).isEqualTo(encode(input));
    }

    private byte[] encode(byte[] input) throws Exception {
        ByteArrayOutputStream compressed = new ByteArrayOutputStream();
        try (OutputStream out = codec.encoding(compressed)) {
            out.write(input);
        }
        return compressed.toByteArray();
    }
}
