package com.jclean.io;

import com.jclean.common.compression.CompressionCodec;
import com.jclean.common.compression.CompressorFactory;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.table.Table;
import com.jclean.table.TestTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static com.jclean.table.TestTables.cells;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DelimitedTableWriterTest {
    @TempDir
    Path tempDir;

    private Table table;

    @BeforeEach
    void setUp() {
        Schema schema = new Schema.Builder()
            .addColumn("name", ColumnType.TEXT)
            .addColumn("score", ColumnType.FLOAT)
            .addColumn("joined", ColumnType.DATETIME)
            .build();
        table = TestTables.table(schema,
            cells("Smith, J", 15.0, LocalDate.of(2024, 1, 2)),
            cells("say \"hi\"", null, null));
    }

    @Test
    void shouldFormatWithQuotingAndEmptyNulls() {
        String text = new DelimitedTableWriter(new TableFormat(',')).format(table);

        assertThat(text).isEqualTo(
            "name,score,joined\n"
                + "\"Smith, J\",15.0,2024-01-02\n"
                + "\"say \"\"hi\"\"\",,\n");
    }

    @Test
    void shouldWriteAndReadBackCompressedFile() throws IOException {
        Path file = tempDir.resolve("out.csv.zst");

        new DelimitedTableWriter(new TableFormat(','), CompressionCodec.ZSTD).write(table, file);
        byte[] raw = CompressorFactory.getCompressor(CompressionCodec.ZSTD).decompress(Files.readAllBytes(file));
        Table read = new DelimitedTableReader().read(file);

        assertThat(new String(raw, StandardCharsets.UTF_8)).startsWith("name,score,joined\n");
        assertThat(read.getColumnValues("name")).isEqualTo(table.getColumnValues("name"));
        assertThat(read.getColumnValues("score")).isEqualTo(table.getColumnValues("score"));
    }

    @Test
    void shouldNeverReplaceExistingFile() throws IOException {
        Path file = tempDir.resolve("taken.csv");
        Files.writeString(file, "keep me");

        assertThatThrownBy(() -> new DelimitedTableWriter(new TableFormat(',')).write(table, file))
            .isInstanceOf(IOException.class)
            .hasCauseInstanceOf(FileAlreadyExistsException.class);
        assertThat(Files.readString(file)).isEqualTo("keep me");
    }
}
