package com.libragraph.repobuilder.formats.api;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Interface for codec plugins that handle the compression layer of an archive.
 * Examples: bzip2, lzma.
 *
 * Codecs are bidirectional stream wrappers.
 * Implementations should be {@code @ApplicationScoped} CDI beans.
 */
public interface Codec {

    /** The compression this codec implements. */
    ArchiveFormat.Compression compression();

    /**
     * Wraps an encoded stream so that reads return decoded bytes.
     */
    InputStream decoding(InputStream in) throws IOException;

    /**
     * Wraps a sink so that written bytes are encoded. Closing the returned stream
     * finishes the encoding and closes {@code out}.
     */
    OutputStream encoding(OutputStream out) throws IOException;
}
