package org.sans.executor;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.Schema;
import org.sans.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A materialized table: a closed schema and rows aligned to it.
 * Tables are never modified once built; operators construct new ones.
 */
public final class Table {
    public final Schema schema;
    private final List<Row> rows;

    public Table(Schema schema, List<Row> rows) {
        Utilities.enforce(!schema.open, "Materialized tables have a closed schema");
        for (Row row: rows)
            Utilities.enforce(row.size() == schema.size(),
                    "Row " + row + " does not match schema " + schema);
        this.schema = schema;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
    }

    /** Build rows from column-name maps.  Missing names give missing values;
     * values are converted to the column types. */
    public static Table fromMaps(Schema schema, List<Map<String, Object>> rows) {
        List<Row> result = new ArrayList<>(rows.size());
        for (Map<String, Object> row: rows)
            result.add(makeRow(schema, row));
        return new Table(schema, result);
    }

    public static Row makeRow(Schema schema, Map<String, Object> values) {
        List<Object> result = new ArrayList<>(schema.size());
        for (Column column: schema.getColumns())
            result.add(Values.conform(values.get(column.name), column.type, column.name));
        return new Row(result);
    }

    public List<Row> getRows() {
        return this.rows;
    }

    public int size() {
        return this.rows.size();
    }

    public Row getRow(int index) {
        return this.rows.get(index);
    }

    public int columnIndex(String column) {
        int index = this.schema.indexOf(column);
        if (index < 0)
            throw new ExecutionError(ErrorCode.RUNTIME_SCHEMA_MISMATCH,
                    "Column " + column + " does not exist in table with schema " + this.schema);
        return index;
    }

    @Nullable
    public Object get(int row, String column) {
        return this.rows.get(row).get(this.columnIndex(column));
    }

    /** The values of a row by column name, in schema order. */
    public Map<String, Object> asMap(Row row) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < this.schema.size(); i++)
            result.put(this.schema.get(i).name, row.get(i));
        return result;
    }

    public List<Object> key(Row row, List<Integer> columns) {
        List<Object> result = new ArrayList<>(columns.size());
        for (int index: columns)
            result.add(row.get(index));
        return result;
    }

    public List<Integer> columnIndexes(List<String> columns) {
        List<Integer> result = new ArrayList<>(columns.size());
        for (String column: columns)
            result.add(this.columnIndex(column));
        return result;
    }

    /** True if every row's key is not smaller than the previous row's key. */
    public boolean isSortedBy(List<String> columns) {
        List<Integer> indexes = this.columnIndexes(columns);
        List<Object> previous = null;
        for (Row row: this.rows) {
            List<Object> current = this.key(row, indexes);
            if (previous != null && Values.compareKeys(previous, current) > 0)
                return false;
            previous = current;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Table table = (Table) o;
        return this.schema.equals(table.schema) && this.rows.equals(table.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.schema, this.rows);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(this.schema).append("\n");
        for (Row row: this.rows)
            builder.append(row).append("\n");
        return builder.toString();
    }
}
