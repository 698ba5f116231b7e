package com.libragraph.repobuilder.formats.codecs;

import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.formats.api.Codec;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.lzma.LZMACompressorInputStream;
import org.apache.commons.compress.compressors.lzma.LZMACompressorOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Codec for the legacy LZMA container (.lzma files), as written by
 * {@code xz --format=lzma}. Commons Compress delegates to XZ for Java.
 */
@ApplicationScoped
public class LzmaCodec implements Codec {

    @Override
    public ArchiveFormat.Compression compression() {
        return ArchiveFormat.Compression.LZMA;
    }

    @Override
    public InputStream decoding(InputStream in) throws IOException {
        return new LZMACompressorInputStream(in);
    }

    @Override
    public OutputStream encoding(OutputStream out) throws IOException {
        return new LZMACompressorOutputStream(out);
    }
}
