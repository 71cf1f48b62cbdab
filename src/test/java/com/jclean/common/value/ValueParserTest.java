package com.jclean.common.value;

import com.jclean.common.schema.ColumnType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class ValueParserTest {
    @Test
    void shouldInferIntegerColumnsIgnoringEmptyCells() {
        assertThat(ValueParser.inferType(Arrays.asList("10", null, "-20"))).isEqualTo(ColumnType.INTEGER);
    }

    @Test
    void shouldInferFloatWhenAnyCellIsFractional() {
        assertThat(ValueParser.inferType(Arrays.asList("10", "2.5", "3"))).isEqualTo(ColumnType.FLOAT);
        assertThat(ValueParser.inferType(Arrays.asList("1e3", "7.0"))).isEqualTo(ColumnType.FLOAT);
    }

    @Test
    void shouldInferTextForMixedOrEmptyColumns() {
        assertThat(ValueParser.inferType(Arrays.asList("10", "abc"))).isEqualTo(ColumnType.TEXT);
        assertThat(ValueParser.inferType(Arrays.asList(null, null))).isEqualTo(ColumnType.TEXT);
    }

    @Test
    void shouldNeverInferDates() {
        assertThat(ValueParser.inferType(Arrays.asList("2024-01-01", "2024-02-01"))).isEqualTo(ColumnType.TEXT);
    }

    @ParameterizedTest
    @ValueSource(strings = {"NaN", "Infinity", "1d", "0x10", "1,5", ""})
    void shouldRejectNonDecimalText(String text) {
        assertThat(ValueParser.parseDecimal(text).isNull()).isTrue();
    }

    @Test
    void shouldParseSupportedDateFormats() {
        LocalDateTime midnight = LocalDateTime.of(2024, 3, 15, 0, 0);
        assertThat(ValueParser.parseDateTime("2024-03-15")).isEqualTo(Value.ofDateTime(midnight));
        assertThat(ValueParser.parseDateTime("2024/03/15")).isEqualTo(Value.ofDateTime(midnight));
        assertThat(ValueParser.parseDateTime("15-03-2024")).isEqualTo(Value.ofDateTime(midnight));
        assertThat(ValueParser.parseDateTime("03/15/2024")).isEqualTo(Value.ofDateTime(midnight));
        assertThat(ValueParser.parseDateTime("2024-03-15 08:15:30"))
            .isEqualTo(Value.ofDateTime(LocalDateTime.of(2024, 3, 15, 8, 15, 30)));
        assertThat(ValueParser.parseDateTime("2024-03-15T08:15"))
            .isEqualTo(Value.ofDateTime(LocalDateTime.of(2024, 3, 15, 8, 15)));
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-02-30", "yesterday", "2024-13-01", "15.03.2024"})
    void shouldReturnNullForInvalidDates(String text) {
        assertThat(ValueParser.parseDateTime(text).isNull()).isTrue();
    }
}
