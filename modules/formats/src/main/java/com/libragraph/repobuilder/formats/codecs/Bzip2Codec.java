package com.libragraph.repobuilder.formats.codecs;

import com.libragraph.repobuilder.formats.api.ArchiveFormat;
import com.libragraph.repobuilder.formats.api.Codec;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Codec for BZIP2 compression (.bz2 files).
 * Uses Apache Commons Compress for BZIP2 support.
 */
@ApplicationScoped
public class Bzip2Codec implements Codec {

    private static final int BLOCK_SIZE = 9;

    @Override
    public ArchiveFormat.Compression compression() {
        return ArchiveFormat.Compression.BZIP2;
    }

    @Override
    public InputStream decoding(InputStream in) throws IOException {
        return new BZip2CompressorInputStream(in, true);
    }

    @Override
    public OutputStream encoding(OutputStream out) throws IOException {
        return new BZip2CompressorOutputStream(out, BLOCK_SIZE);
    }
}
