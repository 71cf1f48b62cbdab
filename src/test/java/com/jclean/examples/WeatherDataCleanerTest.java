package com.jclean.examples;

import com.jclean.common.CleaningException;
import com.jclean.common.ErrorKind;
import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;
import com.jclean.io.DelimitedTableReader;
import com.jclean.table.Table;
import com.jclean.table.TestTables;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;

import static com.jclean.table.TestTables.cells;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class WeatherDataCleanerTest {
    private final WeatherDataCleaner cleaner = new WeatherDataCleaner();

    private static Path resource(String name) throws Exception {
        return Paths.get(WeatherDataCleanerTest.class.getResource("/tables/" + name).toURI());
    }

    @Test
    void shouldFillEachReadingItsOwnWay() throws Exception {
        // Arrange
        Table weather = new DelimitedTableReader().read(resource("weather.csv"));

        // Act
        WeatherDataCleaner.WeatherReport report = cleaner.clean(weather);

        // Assert
        Table cleaned = report.getCleaned();
        assertThat(report.getMissingBefore().getTotalMissing()).isEqualTo(3);
        assertThat(cleaned.getType("Temperature")).isEqualTo(ColumnType.FLOAT);
        assertThat(cleaned.getValue(1, "Temperature").asDouble()).isCloseTo(22.333, within(1e-3));
        assertThat(cleaned.getValue(2, "Humidity")).isEqualTo(Value.ofInteger(60));
        assertThat(cleaned.getValue(1, "Rainfall")).isEqualTo(Value.ofFloat(0.0));
        assertThat(cleaned.getType("Date")).isEqualTo(ColumnType.DATETIME);
        assertThat(cleaned.getValue(0, "Date")).isEqualTo(Value.ofDateTime(LocalDateTime.of(2024, 1, 1, 0, 0)));
        assertThat(weather.getValue(1, "Temperature")).isEqualTo(Value.NULL);
    }

    @Test
    void shouldReportWeatherStatistics() throws Exception {
        WeatherDataCleaner.WeatherReport report =
            cleaner.clean(new DelimitedTableReader().read(resource("weather.csv")));

        assertThat(report.getMaxTemperature()).hasValue(25.0);
        assertThat(report.getMinTemperature()).hasValue(20.0);
        assertThat(report.getAverageTemperature().getAsDouble()).isCloseTo(22.333, within(1e-3));
        assertThat(report.getTotalRainfall()).hasValue(4.0);
        assertThat(report.getAverageRainfall()).hasValue(1.0);
        assertThat(report.getAverageHumidity()).hasValue(60.0);
    }

    @Test
    void shouldSkipReadingsTheTableDoesNotHave() {
        // Arrange
        Schema schema = new Schema.Builder()
            .addColumn("Station", ColumnType.TEXT)
            .addColumn("Rainfall", ColumnType.INTEGER)
            .build();
        Table weather = TestTables.table(schema, cells("north", 3), cells(null, null));

        // Act
        WeatherDataCleaner.WeatherReport report = cleaner.clean(weather);

        // Assert
        assertThat(report.getCleaned().getColumnValues("Rainfall"))
            .containsExactly(Value.ofInteger(3), Value.ofInteger(0));
        assertThat(report.getCleaned().getValue(1, "Station")).isEqualTo(Value.NULL);
        assertThat(report.getMaxTemperature()).isEmpty();
        assertThat(report.getAverageHumidity()).isEmpty();
        assertThat(report.getTotalRainfall()).hasValue(3.0);
    }

    @Test
    void shouldRejectTextTemperatures() {
        Schema schema = new Schema.Builder().addColumn("Temperature", ColumnType.TEXT).build();
        Table weather = TestTables.table(schema, cells("warm"), cells((Object) null));

        assertThatThrownBy(() -> cleaner.clean(weather))
            .isInstanceOf(CleaningException.class)
            .hasFieldOrPropertyWithValue("kind", ErrorKind.AGGREGATION);
    }
}
