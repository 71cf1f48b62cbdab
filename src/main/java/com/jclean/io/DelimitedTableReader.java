package com.jclean.io;

import com.jclean.common.compression.CompressionCodec;
import com.jclean.common.compression.CompressorFactory;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;
import com.jclean.common.value.ValueParser;
import com.jclean.table.Row;
import com.jclean.table.Table;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads delimited text files into tables, inferring each column's type from its cells.
 * Files ending in a compression suffix are decompressed first.
 */
public class DelimitedTableReader {
    private final char defaultDelimiter;

    public DelimitedTableReader() {
        this(TableFormat.DEFAULT_DELIMITER);
    }

    public DelimitedTableReader(char defaultDelimiter) {
        this.defaultDelimiter = defaultDelimiter;
    }

    /**
     * Reads a whole table file.
     *
     * @param path The file to read
     * @return A table whose source name is {@code path}
     * @throws NoSuchFileException if the file does not exist
     * @throws TableParseException if the content is not a well-formed table
     * @throws IOException if the file cannot be read
     */
    public Table read(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "File not found");
        }
        if (Files.isDirectory(path)) {
            throw new IOException("Not a file: " + path);
        }
        String fileName = path.getFileName().toString();
        byte[] bytes = Files.readAllBytes(path);
        CompressionCodec codec = CompressionCodec.fromFileName(fileName);
        try {
            bytes = CompressorFactory.getCompressor(codec).decompress(bytes);
        } catch (IOException e) {
            throw new TableParseException("Cannot decompress " + codec + " file: " + path, e);
        }
        TableFormat format = TableFormat.forFileName(fileName, defaultDelimiter);
        return parse(decode(bytes), format, path.toString());
    }

    /**
     * Parses delimited text held in memory.
     *
     * @param text Full file content
     * @param format Delimiter to split on
     * @param sourceName Source recorded on the table, or null
     * @return The parsed table
     * @throws TableParseException if the text is not a well-formed table
     */
    public Table parse(String text, TableFormat format, String sourceName) throws TableParseException {
        List<List<String>> records = new RecordSplitter(text, format.getDelimiter()).split();
        if (records.isEmpty()) {
            throw new TableParseException("No header row found");
        }
        List<String> header = records.get(0);
        validateHeader(header);

        int width = header.size();
        for (int r = 1; r < records.size(); r++) {
            if (records.get(r).size() != width) {
                throw new TableParseException(String.format(
                    "Line %d has %d fields, expected %d", r + 1, records.get(r).size(), width));
            }
        }

        Schema.Builder schema = new Schema.Builder();
        ColumnType[] types = new ColumnType[width];
        for (int c = 0; c < width; c++) {
            List<String> cells = new ArrayList<>(records.size() - 1);
            for (int r = 1; r < records.size(); r++) {
                cells.add(records.get(r).get(c));
            }
            types[c] = ValueParser.inferType(cells);
            schema.addColumn(header.get(c), types[c]);
        }

        List<Row> rows = new ArrayList<>(records.size() - 1);
        for (int r = 1; r < records.size(); r++) {
            List<String> record = records.get(r);
            List<Value> values = new ArrayList<>(width);
            for (int c = 0; c < width; c++) {
                values.add(ValueParser.parse(record.get(c), types[c]));
            }
            rows.add(new Row(values));
        }
        return new Table(schema.build(), rows, sourceName);
    }

    private static void validateHeader(List<String> header) throws TableParseException {
        Set<String> names = new HashSet<>();
        for (int c = 0; c < header.size(); c++) {
            String name = header.get(c);
            if (name == null || name.isBlank()) {
                throw new TableParseException("Header column " + (c + 1) + " has no name");
            }
            if (!names.add(name)) {
                throw new TableParseException("Duplicate column name in header: " + name);
            }
        }
    }

    private static String decode(byte[] bytes) throws TableParseException {
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
            return text.startsWith("\uFEFF") ? text.substring(1) : text;
        } catch (CharacterCodingException e) {
            throw new TableParseException("File is not valid UTF-8 text", e);
        }
    }

    /**
     * Splits text into records of fields. Empty fields come back as {@code null};
     * blank lines are skipped.
     */
    static class RecordSplitter {
        private final String text;
        private final char delimiter;
        private int position;
        private int line = 1;

        RecordSplitter(String text, char delimiter) {
            this.text = text;
            this.delimiter = delimiter;
        }

        List<List<String>> split() throws TableParseException {
            List<List<String>> records = new ArrayList<>();
            while (position < text.length()) {
                List<String> record = readRecord();
                if (!(record.size() == 1 && record.get(0) == null)) {
                    records.add(record);
                }
            }
            return records;
        }

        private List<String> readRecord() throws TableParseException {
            List<String> fields = new ArrayList<>();
            while (true) {
                String field = readField();
                fields.add(field.isEmpty() ? null : field);
                if (position >= text.length()) {
                    return fields;
                }
                char c = text.charAt(position);
                if (c == delimiter) {
                    position++;
                    continue;
                }
                // end of line: \n, \r or \r\n
                position++;
                if (c == '\r' && position < text.length() && text.charAt(position) == '\n') {
                    position++;
                }
                line++;
                return fields;
            }
        }

        private String readField() throws TableParseException {
            if (position < text.length() && text.charAt(position) == TableFormat.QUOTE) {
                return readQuotedField();
            }
            int start = position;
            while (position < text.length()) {
                char c = text.charAt(position);
                if (c == delimiter || c == '\n' || c == '\r') {
                    break;
                }
                if (c == TableFormat.QUOTE) {
                    throw new TableParseException("Unexpected quote on line " + line);
                }
                position++;
            }
            return text.substring(start, position);
        }

        private String readQuotedField() throws TableParseException {
            int startLine = line;
            StringBuilder field = new StringBuilder();
            position++;
            while (true) {
                if (position >= text.length()) {
                    throw new TableParseException("Unterminated quoted field starting on line " + startLine);
                }
                char c = text.charAt(position++);
                if (c == TableFormat.QUOTE) {
                    if (position < text.length() && text.charAt(position) == TableFormat.QUOTE) {
                        field.append(TableFormat.QUOTE);
                        position++;
                        continue;
                    }
                    break;
                }
                if (c == '\n') {
                    line++;
                }
                field.append(c);
            }
            if (position < text.length()) {
                char next = text.charAt(position);
                if (next != delimiter && next != '\n' && next != '\r') {
                    throw new TableParseException("Unexpected character after closing quote on line " + line);
                }
            }
            return field.toString();
        }
    }
}
