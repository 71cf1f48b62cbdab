package com.jclean.io;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.table.Table;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TableLoaderTest {
    @TempDir
    Path tempDir;

    private final TableLoader loader = new TableLoader(new DelimitedTableReader());

    @Test
    void shouldLoadQuotedPath() throws IOException {
        Path file = tempDir.resolve("my data.csv");
        Files.writeString(file, "a\n1\n");

        Table table = loader.load("\"" + file + "\"");

        assertThat(table.rowCount()).isEqualTo(1);
    }

    @Test
    void shouldReportMissingFileAsSourceNotFound() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("nope.csv").toString()))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.SOURCE_NOT_FOUND)
            .hasMessageContaining("File not found");
        assertThatThrownBy(() -> loader.load("  "))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.SOURCE_NOT_FOUND);
    }

    @Test
    void shouldReportMalformedFileAsParseError() throws IOException {
        Path file = tempDir.resolve("ragged.csv");
        Files.writeString(file, "a,b\n1\n");

        assertThatThrownBy(() -> loader.load(file.toString()))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.PARSE_ERROR);
    }
}
