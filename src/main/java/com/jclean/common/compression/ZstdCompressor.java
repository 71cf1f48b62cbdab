package com.jclean.common.compression;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Compressor implementation using Zstandard compression.
 */
public class ZstdCompressor implements Compressor {
    private static final int COMPRESSION_LEVEL = 3; // Default compression level

    @Override
    public byte[] compress(byte[] uncompressed) {
        return Zstd.compress(uncompressed, COMPRESSION_LEVEL);
    }

    @Override
    public byte[] decompress(byte[] compressed) throws IOException {
        // the streaming API does not need the frame to record its content size
        try (ZstdInputStream zis = new ZstdInputStream(new ByteArrayInputStream(compressed))) {
            return zis.readAllBytes();
        }
    }
}
