package com.jclean.common.compression;

import java.io.IOException;

/**
 * Interface for compression/decompression of whole table files.
 */
public interface Compressor {
    /**
     * Compresses the given data.
     *
     * @param uncompressed The data to compress
     * @return The compressed bytes
     * @throws IOException if the codec fails
     */
    byte[] compress(byte[] uncompressed) throws IOException;

    /**
     * Decompresses the given data.
     *
     * @param compressed The data to decompress
     * @return The original bytes
     * @throws IOException if the data is not valid for this codec
     */
    byte[] decompress(byte[] compressed) throws IOException;
}
