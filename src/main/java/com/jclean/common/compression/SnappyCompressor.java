package com.jclean.common.compression;

import org.xerial.snappy.Snappy;

import java.io.IOException;

/**
 * Compressor implementation using Snappy compression.
 */
public class SnappyCompressor implements Compressor {
    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        return Snappy.compress(uncompressed);
    }

    @Override
    public byte[] decompress(byte[] compressed) throws IOException {
        if (!Snappy.isValidCompressedBuffer(compressed)) {
            throw new IOException("Invalid Snappy data");
        }
        return Snappy.uncompress(compressed);
    }
}
