package com.jclean.io;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.compression.CompressionCodec;
import com.jclean.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Exports the current table to a new, timestamped file in the configured
 * output directory. The source file is never written.
 * <p>
 * Output names follow {@code {base}_cleaned_{yyyyMMdd_HHmmss}{ext}}, where
 * {@code ext} is the source's table extension plus any compression suffix.
 * When that name is taken, a counter is appended to the timestamp
 * ({@code _1}, {@code _2}, ...) so earlier exports are never replaced.
 */
public class Persister {
    private static final Logger logger = LoggerFactory.getLogger(Persister.class);
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final String DEFAULT_BASE = "table";
    private static final int MAX_ATTEMPTS = 1000;

    private final Path outputDirectory;
    private final CompressionCodec defaultCodec;
    private final char defaultDelimiter;
    private final Clock clock;

    public Persister(Path outputDirectory, CompressionCodec defaultCodec, char defaultDelimiter, Clock clock) {
        this.outputDirectory = outputDirectory;
        this.defaultCodec = defaultCodec;
        this.defaultDelimiter = defaultDelimiter;
        this.clock = clock;
    }

    /**
     * Writes the whole table, in its current column and row order.
     *
     * @param table The table to export; it is not modified
     * @return Path of the written file
     * @throws CleaningException PERSISTENCE if the file cannot be written
     */
    public Path persist(Table table) {
        String sourceName = table.getSourceName().orElse(null);
        Path source = sourceName != null ? Paths.get(sourceName).toAbsolutePath().normalize() : null;
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String fileName = outputFileName(sourceName, attempt);
            Path target = outputDirectory.resolve(fileName);
            if (Files.exists(target) || target.toAbsolutePath().normalize().equals(source)) {
                continue;
            }
            return write(table, fileName, target);
        }
        throw new CleaningException(ErrorKind.PERSISTENCE,
            "No free output name for " + outputFileName(sourceName) + " after " + MAX_ATTEMPTS + " attempts");
    }

    private Path write(Table table, String fileName, Path target) {
        DelimitedTableWriter writer = new DelimitedTableWriter(
            TableFormat.forFileName(fileName, defaultDelimiter), CompressionCodec.fromFileName(fileName));
        try {
            Files.createDirectories(outputDirectory);
            writer.write(table, target);
        } catch (IOException e) {
            logger.debug("Failed to save table to {}", target, e);
            throw new CleaningException(ErrorKind.PERSISTENCE, "Error saving file " + target + ": " + e.getMessage(), e);
        }
        logger.info("Saved {} rows and {} columns to {}", table.rowCount(), table.columnCount(), target);
        return target;
    }

    /**
     * Derives the output file name for a table loaded from {@code sourceName}.
     *
     * @param sourceName Source path, or null for tables not loaded from a file
     * @return The output file name, without directory
     */
    public String outputFileName(String sourceName) {
        return outputFileName(sourceName, 0);
    }

    private String outputFileName(String sourceName, int attempt) {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        if (attempt > 0) {
            timestamp = timestamp + "_" + attempt;
        }
        if (sourceName == null) {
            return DEFAULT_BASE + "_cleaned_" + timestamp + TableFormat.DEFAULT_EXTENSION + defaultCodec.getSuffix();
        }
        Path namePath = Paths.get(sourceName).getFileName();
        String fileName = namePath != null ? namePath.toString() : sourceName;

        CompressionCodec sourceCodec = CompressionCodec.fromFileName(fileName);
        String stripped = TableFormat.stripCompressionSuffix(fileName);
        String lower = stripped.toLowerCase(Locale.ROOT);

        String base = null;
        String extension = null;
        for (String candidate : TableFormat.TABLE_EXTENSIONS) {
            if (lower.endsWith(candidate)) {
                extension = stripped.substring(stripped.length() - candidate.length());
                base = stripped.substring(0, stripped.length() - candidate.length());
                break;
            }
        }
        if (extension == null) {
            int dot = stripped.lastIndexOf('.');
            base = dot > 0 ? stripped.substring(0, dot) : stripped;
            extension = TableFormat.DEFAULT_EXTENSION;
        }
        if (base.isEmpty()) {
            base = DEFAULT_BASE;
        }
        CompressionCodec codec = sourceCodec != CompressionCodec.UNCOMPRESSED ? sourceCodec : defaultCodec;
        return base + "_cleaned_" + timestamp + extension + codec.getSuffix();
    }
}
