package com.jclean.session;

import com.jclean.common.compression.CompressionCodec;
import com.jclean.io.TableFormat;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Objects;

/**
 * Configuration for a cleaning session.
 */
public class EngineConfig {
    private final char delimiter;
    private final Path outputDirectory;
    private final CompressionCodec compressionCodec;
    private final Clock clock;

    private EngineConfig(Builder builder) {
        this.delimiter = builder.delimiter;
        this.outputDirectory = builder.outputDirectory;
        this.compressionCodec = builder.compressionCodec;
        this.clock = builder.clock;
    }

    public char getDelimiter() {
        return delimiter;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public CompressionCodec getCompressionCodec() {
        return compressionCodec;
    }

    public Clock getClock() {
        return clock;
    }

    public static class Builder {
        private char delimiter = TableFormat.DEFAULT_DELIMITER;
        private Path outputDirectory = Paths.get(".");
        private CompressionCodec compressionCodec = CompressionCodec.UNCOMPRESSED;
        private Clock clock = Clock.systemDefaultZone();

        public Builder setDelimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder setOutputDirectory(Path outputDirectory) {
            this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory cannot be null");
            return this;
        }

        public Builder setCompressionCodec(CompressionCodec compressionCodec) {
            this.compressionCodec = Objects.requireNonNull(compressionCodec, "compressionCodec cannot be null");
            return this;
        }

        public Builder setClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
