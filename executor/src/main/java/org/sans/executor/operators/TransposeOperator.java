package org.sans.executor.operators;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.step.TransposeStep;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.ScalarType;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExecutionError;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Row;
import org.sans.executor.Table;
import org.sans.executor.Values;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pivots the values of one column into columns named after the values of another.
 * The input must be sorted by the BY columns; each run of equal keys
 * becomes one output row.  New columns appear in the order their names are first seen.
 */
public class TransposeOperator extends BaseOperator<TransposeStep> {
    public TransposeOperator(TransposeStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    /** A legal column name made from an arbitrary value. */
    public static String sanitize(String value) {
        String result = value.replaceAll("[^A-Za-z0-9_]+", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_+|_+$", "");
        if (result.isEmpty())
            return "COL";
        if (Character.isDigit(result.charAt(0)))
            return "COL_" + result;
        return result;
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        Table input = inputs.get(0);
        if (!input.isSortedBy(this.step.by))
            throw new ExecutionError(ErrorCode.RUNTIME_ORDER_REQUIRED,
                    "transpose input is not sorted by " + this.step.by);
        List<Integer> keys = input.columnIndexes(this.step.by);
        int id = input.columnIndex(this.step.id);
        int var = input.columnIndex(this.step.var);

        // Column name to the ID text it was made from
        Map<String, String> sources = new LinkedHashMap<>();
        for (String key: this.step.by)
            sources.put(key, null);
        List<List<Object>> groupKeys = new ArrayList<>();
        List<Map<String, Object>> groups = new ArrayList<>();
        Map<String, Object> current = null;
        List<Object> previous = null;
        for (Row row: input.getRows()) {
            List<Object> key = input.key(row, keys);
            if (previous == null || Values.compareKeys(previous, key) != 0) {
                current = new HashMap<>();
                groups.add(current);
                groupKeys.add(key);
                previous = key;
            }
            Object idValue = row.get(id);
            if (idValue == null || Values.keyText(idValue).isBlank())
                throw new ExecutionError(ErrorCode.RUNTIME_TRANSPOSE_ID_MISSING,
                        "transpose: missing value of ID column " + this.step.id + " in row " + row);
            String text = Values.keyText(idValue);
            String name = sanitize(text);
            if (sources.containsKey(name)) {
                String existing = sources.get(name);
                if (existing == null || !existing.equals(text))
                    throw new ExecutionError(ErrorCode.RUNTIME_TRANSPOSE_ID_COLLISION,
                            "transpose: ID value '" + text + "' and " +
                                    (existing == null ? "BY column " + name : "ID value '" + existing + "'") +
                                    " both name column " + name);
            } else {
                sources.put(name, text);
            }
            current.put(name, row.get(var));
        }

        List<Column> columns = new ArrayList<>();
        ScalarType valueType = input.schema.typeOf(this.step.var);
        for (String name: sources.keySet()) {
            if (this.step.by.contains(name))
                columns.add(input.schema.find(name));
            else
                columns.add(new Column(name, valueType));
        }
        Schema schema = new Schema(columns);

        List<Row> result = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            Map<String, Object> values = groups.get(i);
            for (int k = 0; k < this.step.by.size(); k++)
                values.put(this.step.by.get(k), groupKeys.get(i).get(k));
            result.add(Table.makeRow(schema, values));
        }
        this.counters.put("id_columns", sources.size() - this.step.by.size());
        this.getDebugStream(2)
                .append("transpose created columns ")
                .append(schema.names().toString())
                .newline();
        return new Table(schema, result);
    }
}
