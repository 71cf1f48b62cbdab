package com.jclean.io;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Builds a complete table from a file path, translating I/O failures into
 * SOURCE_NOT_FOUND and PARSE_ERROR.
 */
public class TableLoader {
    private static final Logger logger = LoggerFactory.getLogger(TableLoader.class);

    private final DelimitedTableReader reader;

    public TableLoader(DelimitedTableReader reader) {
        this.reader = reader;
    }

    /**
     * Loads a table.
     *
     * @param source File path; surrounding double quotes are ignored
     * @return The loaded table
     * @throws CleaningException SOURCE_NOT_FOUND or PARSE_ERROR
     */
    public Table load(String source) {
        Path path = toPath(source);
        try {
            Table table = reader.read(path);
            logger.info("Loaded {} rows and {} columns from {}", table.rowCount(), table.columnCount(), path);
            return table;
        } catch (NoSuchFileException e) {
            throw new CleaningException(ErrorKind.SOURCE_NOT_FOUND, "File not found: " + path, e);
        } catch (TableParseException e) {
            throw new CleaningException(ErrorKind.PARSE_ERROR,
                "Error parsing " + path + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new CleaningException(ErrorKind.SOURCE_NOT_FOUND,
                "Error reading " + path + ": " + e.getMessage(), e);
        }
    }

    private static Path toPath(String source) {
        String trimmed = source.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            throw new CleaningException(ErrorKind.SOURCE_NOT_FOUND, "No file path given");
        }
        try {
            return Paths.get(trimmed);
        } catch (InvalidPathException e) {
            throw new CleaningException(ErrorKind.SOURCE_NOT_FOUND, "Invalid file path: " + trimmed, e);
        }
    }
}
