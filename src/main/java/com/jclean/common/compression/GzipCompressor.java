package com.jclean.common.compression;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Compressor implementation using GZIP compression.
 */
public class GzipCompressor implements Compressor {
    @Override
    public byte[] compress(byte[] uncompressed) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (GZIPOutputStream gzos = new GZIPOutputStream(baos)) {
            gzos.write(uncompressed);
        }
        return baos.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] compressed) throws IOException {
        try (GZIPInputStream gzis = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gzis.readAllBytes();
        }
    }
}
