package org.sans.executor.operators;

import org.sans.compiler.errors.ErrorCode;
import org.sans.compiler.ir.step.SqlSelectStep;
import org.sans.compiler.ir.type.Column;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExecutionError;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Row;
import org.sans.executor.Table;
import org.sans.executor.Values;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * A restricted SELECT.  Joins are evaluated left to right over rows whose
 * columns are qualified by table alias; an unqualified name must match exactly
 * one column of the joined tables.  Grouped output is ordered by the group key.
 */
public class SqlSelectOperator extends BaseOperator<SqlSelectStep> {
    public SqlSelectOperator(SqlSelectStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    /** Maps the names usable in the query to qualified column names. */
    static final class Scope {
        final List<String> qualified = new ArrayList<>();
        final Map<String, List<String>> bare = new LinkedHashMap<>();

        List<String> add(String alias, Schema schema) {
            List<String> added = new ArrayList<>();
            for (Column column: schema.getColumns()) {
                String name = alias + "." + column.name;
                this.qualified.add(name);
                this.bare.computeIfAbsent(column.name, k -> new ArrayList<>()).add(name);
                added.add(name);
            }
            return added;
        }

        String resolve(String name) {
            if (this.qualified.contains(name))
                return name;
            List<String> candidates = this.bare.get(name);
            if (candidates == null)
                throw new ExecutionError(ErrorCode.RUNTIME_SQL_COLUMN_UNDEFINED,
                        "Column " + name + " does not exist in the joined tables");
            if (candidates.size() > 1)
                throw new ExecutionError(ErrorCode.RUNTIME_SQL_AMBIGUOUS_COLUMN,
                        "Column " + name + " is ambiguous: " + candidates);
            return candidates.get(0);
        }

        ExpressionEvaluator.IRowScope over(Map<String, Object> row) {
            return name -> row.get(this.resolve(name));
        }
    }

    static Map<String, Object> qualify(Row row, List<String> names) {
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++)
            result.put(names.get(i), row.get(i));
        return result;
    }

    @Nullable
    static Object aggregate(SqlSelectStep.SelectItem item, List<Map<String, Object>> rows, Scope scope) {
        SqlSelectStep.Aggregate aggregate = item.aggregate;
        String argument = item.column;
        if (aggregate == SqlSelectStep.Aggregate.COUNT && "*".equals(argument))
            return (long) rows.size();
        List<Object> values = new ArrayList<>();
        String column = scope.resolve(argument);
        for (Map<String, Object> row: rows) {
            Object value = row.get(column);
            if (value != null)
                values.add(value);
        }
        if (aggregate == SqlSelectStep.Aggregate.COUNT)
            return (long) values.size();
        if (values.isEmpty())
            return null;
        switch (aggregate) {
            case SUM:
                return AggregateOperator.sum(values);
            case AVG:
                return Values.toDecimal(AggregateOperator.sum(values))
                        .divide(BigDecimal.valueOf(values.size()), MathContext.DECIMAL128);
            case MIN:
                return values.stream().min(Values.COMPARATOR).orElse(null);
            case MAX:
                return values.stream().max(Values.COMPARATOR).orElse(null);
            default:
                throw new IllegalStateException("Unexpected aggregate " + aggregate);
        }
    }

    /** Output values of one row or group; columns are taken from the first row. */
    Map<String, Object> project(Map<String, Object> first, List<Map<String, Object>> group, Scope scope) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (SqlSelectStep.SelectItem item: this.step.select) {
            if (item.isStar()) {
                for (Map.Entry<String, List<String>> entry: scope.bare.entrySet())
                    values.putIfAbsent(entry.getKey(), first.get(entry.getValue().get(0)));
            } else if (item.isAggregate()) {
                values.put(item.alias, aggregate(item, group, scope));
            } else {
                values.put(item.alias, first.get(scope.resolve(item.column)));
            }
        }
        return values;
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        Schema schema = required(output);
        Scope scope = new Scope();
        Table from = inputs.get(0);
        List<String> names = scope.add(this.step.from.alias, from.schema);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Row row: from.getRows())
            rows.add(qualify(row, names));

        for (int j = 0; j < this.step.joins.size(); j++) {
            SqlSelectStep.Join join = this.step.joins.get(j);
            Table right = inputs.get(j + 1);
            List<String> rightNames = scope.add(join.table.alias, right.schema);
            List<Map<String, Object>> joined = new ArrayList<>();
            for (Map<String, Object> left: rows) {
                boolean matched = false;
                for (Row row: right.getRows()) {
                    Map<String, Object> combined = new LinkedHashMap<>(left);
                    combined.putAll(qualify(row, rightNames));
                    if (this.evaluator.test(join.on, scope.over(combined))) {
                        matched = true;
                        joined.add(combined);
                    }
                }
                if (!matched && join.type == SqlSelectStep.JoinType.LEFT) {
                    Map<String, Object> combined = new LinkedHashMap<>(left);
                    for (String name: rightNames)
                        combined.put(name, null);
                    joined.add(combined);
                }
            }
            rows = joined;
        }

        if (this.step.where != null) {
            List<Map<String, Object>> filtered = new ArrayList<>();
            for (Map<String, Object> row: rows)
                if (this.evaluator.test(this.step.where, scope.over(row)))
                    filtered.add(row);
            rows = filtered;
        }

        List<Row> result = new ArrayList<>();
        if (!this.step.isGrouped()) {
            for (Map<String, Object> row: rows)
                result.add(Table.makeRow(schema, this.project(row, List.of(row), scope)));
            return new Table(schema, result);
        }

        List<String> keys = new ArrayList<>();
        for (String column: this.step.groupBy)
            keys.add(scope.resolve(column));
        TreeMap<List<Object>, List<Map<String, Object>>> groups = new TreeMap<>(Values.KEY_COMPARATOR);
        for (Map<String, Object> row: rows) {
            List<Object> key = new ArrayList<>();
            for (String column: keys)
                key.add(row.get(column));
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        for (List<Map<String, Object>> group: groups.values())
            result.add(Table.makeRow(schema, this.project(group.get(0), group, scope)));
        this.counters.put("groups", groups.size());
        return new Table(schema, result);
    }
}
