package com.jclean.common.schema;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaTest {
    @Test
    void shouldCreateSchemaWithOrderedColumns() {
        Schema schema = new Schema.Builder()
            .addColumn("Name", ColumnType.TEXT)
            .addColumn("Math", ColumnType.INTEGER)
            .addColumn("Average", ColumnType.FLOAT)
            .build();

        assertThat(schema.getColumnNames()).containsExactly("Name", "Math", "Average");
        assertThat(schema.getColumn(schema.indexOf("Math")).getType()).isEqualTo(ColumnType.INTEGER);
        assertThat(schema.indexOf("Average")).isEqualTo(2);
        assertThat(schema.indexOf("missing")).isEqualTo(-1);
    }

    @Test
    void shouldRejectDuplicateColumnNames() {
        Schema.Builder builder = new Schema.Builder()
            .addColumn("id", ColumnType.INTEGER)
            .addColumn("id", ColumnType.TEXT);

        assertThatThrownBy(builder::build)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already exists");
    }

    @Test
    void shouldThrowExceptionForUnknownColumn() {
        Schema schema = new Schema.Builder().addColumn("id", ColumnType.INTEGER).build();

        assertThatThrownBy(() -> schema.withType("unknown", ColumnType.TEXT))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    void shouldChangeTypeWithoutTouchingOriginal() {
        Schema schema = new Schema.Builder()
            .addColumn("id", ColumnType.INTEGER)
            .addColumn("when", ColumnType.TEXT)
            .build();

        Schema retyped = schema.withType("when", ColumnType.DATETIME);

        assertThat(retyped.getColumn(1).getType()).isEqualTo(ColumnType.DATETIME);
        assertThat(schema.getColumn(1).getType()).isEqualTo(ColumnType.TEXT);
        assertThat(retyped.getColumnNames()).isEqualTo(schema.getColumnNames());
    }

    @Test
    void shouldRenderColumnsWithTypeAlias() {
        assertThat(new Column("Math", ColumnType.INTEGER).toString()).isEqualTo("Math (int)");
        assertThat(ColumnType.TEXT.getAlias()).isEqualTo("str");
        assertThat(ColumnType.FLOAT.isNumeric()).isTrue();
        assertThat(ColumnType.DATETIME.isNumeric()).isFalse();
    }
}
