package com.jclean.console;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.jclean.common.compression.CompressionCodec;
import com.jclean.session.EngineConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LauncherOptionsTest {

    private static LauncherOptions parse(String... args) {
        LauncherOptions options = new LauncherOptions();
        JCommander.newBuilder().addObject(options).build().parse(args);
        return options;
    }

    @Test
    void shouldUseDefaults() {
        EngineConfig config = parse().toConfig();

        assertThat(config.getDelimiter()).isEqualTo(',');
        assertThat(config.getCompressionCodec()).isEqualTo(CompressionCodec.UNCOMPRESSED);
        assertThat(config.getOutputDirectory()).isEqualTo(Paths.get("."));
    }

    @Test
    void shouldParseAllOptions() {
        LauncherOptions options = parse("--file", "in.csv", "-o", "out", "--compression", "zstd", "-d", "\\t");

        assertThat(options.getFile()).isEqualTo("in.csv");
        assertThat(options.getDelimiter()).isEqualTo('\t');
        assertThat(options.toConfig().getCompressionCodec()).isEqualTo(CompressionCodec.ZSTD);
        assertThat(options.toConfig().getOutputDirectory()).isEqualTo(Paths.get("out"));
    }

    @Test
    void shouldRejectBadValues() {
        assertThatThrownBy(() -> parse("--compression", "lzma")).isInstanceOf(ParameterException.class);
        assertThatThrownBy(() -> parse("--delimiter", ";;").getDelimiter()).isInstanceOf(ParameterException.class);
    }
}
