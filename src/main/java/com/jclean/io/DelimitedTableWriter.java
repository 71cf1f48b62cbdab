package com.jclean.io;

import com.jclean.common.compression.CompressionCodec;
import com.jclean.common.compression.CompressorFactory;
import com.jclean.common.value.Value;
import com.jclean.table.Row;
import com.jclean.table.Table;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes tables as delimited text, optionally compressed.
 */
public class DelimitedTableWriter {
    private final TableFormat format;
    private final CompressionCodec codec;

    public DelimitedTableWriter(TableFormat format) {
        this(format, CompressionCodec.UNCOMPRESSED);
    }

    public DelimitedTableWriter(TableFormat format, CompressionCodec codec) {
        this.format = format;
        this.codec = codec;
    }

    /**
     * Writes the table to a new file. Existing files are never replaced.
     *
     * @param table The table to write
     * @param path The file to create
     * @throws java.nio.file.FileAlreadyExistsException if {@code path} exists
     * @throws IOException if the file cannot be written
     */
    public void write(Table table, Path path) throws IOException {
        byte[] bytes = format(table).getBytes(StandardCharsets.UTF_8);
        byte[] encoded = CompressorFactory.getCompressor(codec).compress(bytes);
        try {
            Files.write(path, encoded, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new IOException("Unable to write to file: " + path, e);
        }
    }

    /**
     * Renders the table as delimited text: header first, one line per row,
     * NULL as an empty field.
     */
    public String format(Table table) {
        StringBuilder out = new StringBuilder();
        appendLine(out, table.getColumnNames());
        for (Row row : table.getRows()) {
            List<Value> values = row.getValues();
            for (int c = 0; c < values.size(); c++) {
                if (c > 0) {
                    out.append(format.getDelimiter());
                }
                out.append(escape(values.get(c).toText()));
            }
            out.append('\n');
        }
        return out.toString();
    }

    private void appendLine(StringBuilder out, List<String> fields) {
        for (int c = 0; c < fields.size(); c++) {
            if (c > 0) {
                out.append(format.getDelimiter());
            }
            out.append(escape(fields.get(c)));
        }
        out.append('\n');
    }

    private String escape(String field) {
        boolean needsQuotes = field.indexOf(format.getDelimiter()) >= 0
            || field.indexOf(TableFormat.QUOTE) >= 0
            || field.indexOf('\n') >= 0
            || field.indexOf('\r') >= 0;
        if (!needsQuotes) {
            return field;
        }
        return TableFormat.QUOTE + field.replace("\"", "\"\"") + TableFormat.QUOTE;
    }
}
