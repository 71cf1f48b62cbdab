package com.jclean.common.compression;

import java.util.Locale;

/**
 * Compression codecs available for table files, with the file suffix each one uses.
 */
public enum CompressionCodec {
    UNCOMPRESSED(""),
    SNAPPY(".snappy"),
    GZIP(".gz"),
    ZSTD(".zst");

    private final String suffix;

    CompressionCodec(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    /**
     * Detects the codec from a file name's trailing suffix.
     *
     * @param fileName The file name to inspect
     * @return The matching codec, or UNCOMPRESSED when no suffix matches
     */
    public static CompressionCodec fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (CompressionCodec codec : values()) {
            if (codec != UNCOMPRESSED && lower.endsWith(codec.suffix)) {
                return codec;
            }
        }
        return UNCOMPRESSED;
    }

    public static CompressionCodec fromName(String name) {
        for (CompressionCodec codec : values()) {
            if (codec.name().equalsIgnoreCase(name.trim())) {
                return codec;
            }
        }
        throw new IllegalArgumentException("Unknown compression codec: " + name);
    }
}
