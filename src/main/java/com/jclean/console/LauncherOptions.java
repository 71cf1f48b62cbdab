package com.jclean.console;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.jclean.common.compression.CompressionCodec;
import com.jclean.session.EngineConfig;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line options of the console tool.
 * <p><pre>
 * jclean [--file path] [--output-dir dir] [--compression codec] [--delimiter c] [--help]
 * </pre></p>
 */
public class LauncherOptions {
    @Parameter(names = {"-h", "--help"}, help = true, description = "Print command line usage.")
    private boolean help = false;

    @Parameter(names = {"-f", "--file"}, description = "Table file to load at start-up.")
    private String file;

    @Parameter(names = {"-o", "--output-dir"}, description = "Directory cleaned files are saved to.")
    private String outputDirectory = ".";

    @Parameter(names = {"-c", "--compression"}, converter = CodecConverter.class,
        description = "Compression for saved files: UNCOMPRESSED, SNAPPY, GZIP or ZSTD.")
    private CompressionCodec compression = CompressionCodec.UNCOMPRESSED;

    @Parameter(names = {"-d", "--delimiter"}, description = "Field delimiter for files that are not .tsv.")
    private String delimiter = ",";

    public boolean isHelp() {
        return help;
    }

    public String getFile() {
        return file;
    }

    public Path getOutputDirectory() {
        return Paths.get(outputDirectory);
    }

    public CompressionCodec getCompression() {
        return compression;
    }

    /**
     * The delimiter character; {@code \t} is accepted for TAB.
     */
    public char getDelimiter() {
        String value = "\\t".equals(delimiter) ? "\t" : delimiter;
        if (value.length() != 1) {
            throw new ParameterException("Delimiter must be a single character: " + delimiter);
        }
        return value.charAt(0);
    }

    public EngineConfig toConfig() {
        return new EngineConfig.Builder()
            .setDelimiter(getDelimiter())
            .setOutputDirectory(getOutputDirectory())
            .setCompressionCodec(getCompression())
            .build();
    }

    public static class CodecConverter implements IStringConverter<CompressionCodec> {
        @Override
        public CompressionCodec convert(String value) {
            try {
                return CompressionCodec.fromName(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(e.getMessage());
            }
        }
    }
}
