package com.jclean.io;

import com.jclean.common.compression.CompressionCodec;

import java.util.List;
import java.util.Locale;

/**
 * Delimited text layout of a table file: a header row, then one line per row,
 * fields separated by a single delimiter character and quoted RFC 4180 style.
 */
public class TableFormat {
    public static final char DEFAULT_DELIMITER = ',';
    public static final char QUOTE = '"';
    public static final String DEFAULT_EXTENSION = ".csv";

    /** Recognised table extensions, checked before any compression suffix is considered. */
    public static final List<String> TABLE_EXTENSIONS = List.of(".csv", ".tsv", ".txt");

    private final char delimiter;

    public TableFormat(char delimiter) {
        if (delimiter == QUOTE || delimiter == '\n' || delimiter == '\r') {
            throw new IllegalArgumentException("Invalid delimiter: " + delimiter);
        }
        this.delimiter = delimiter;
    }

    public char getDelimiter() {
        return delimiter;
    }

    /**
     * Picks the delimiter for a file: TAB for {@code .tsv} files (compressed or not),
     * otherwise the given default.
     */
    public static TableFormat forFileName(String fileName, char defaultDelimiter) {
        String stripped = stripCompressionSuffix(fileName).toLowerCase(Locale.ROOT);
        return stripped.endsWith(".tsv") ? new TableFormat('\t') : new TableFormat(defaultDelimiter);
    }

    public static String stripCompressionSuffix(String fileName) {
        CompressionCodec codec = CompressionCodec.fromFileName(fileName);
        return fileName.substring(0, fileName.length() - codec.getSuffix().length());
    }
}
