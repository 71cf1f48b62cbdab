package com.jclean.rules;

import com.jclean.common.schema.ColumnType;
import com.jclean.common.schema.Schema;
import com.jclean.common.value.Value;
import com.jclean.table.Table;

import java.util.List;

/**
 * A declarative rule computing a new column from named input columns.
 * Rules are applied by {@link RuleApplier}; the engine itself never calls them.
 */
public interface DerivedColumnRule {
    String getOutputColumn();

    /**
     * Resolves the output column's type against the table the rule will run on.
     *
     * @param schema Schema holding every input column
     * @throws com.jclean.common.CleaningException AGGREGATION when an input has the wrong type
     */
    ColumnType getOutputType(Schema schema);

    List<String> getInputColumns();

    /**
     * Computes the output column.
     *
     * @param table Table holding every input column
     * @return One value per row, in row order, each NULL or of {@link #getOutputType(Schema)}
     */
    List<Value> compute(Table table);
}
