package com.jclean.common.compression;

import java.util.Arrays;

/**
 * A "compressor" that simply copies the data without any compression.
 */
public class UncompressedCompressor implements Compressor {
    @Override
    public byte[] compress(byte[] uncompressed) {
        return Arrays.copyOf(uncompressed, uncompressed.length);
    }

    @Override
    public byte[] decompress(byte[] compressed) {
        return Arrays.copyOf(compressed, compressed.length);
    }
}
