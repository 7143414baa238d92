package org.sans.executor.operators;

import org.sans.compiler.ir.step.AggregateStep;
import org.sans.compiler.ir.type.Schema;
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
 * One row per distinct group key, ordered by key with missing first.
 * Statistics other than count ignore missing values and are missing
 * when a group has no values.
 */
public class AggregateOperator extends BaseOperator<AggregateStep> {
    public AggregateOperator(AggregateStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    /** Sum of values which are all numbers; ints stay ints while they fit. */
    static Object sum(List<Object> values) {
        Object result = 0L;
        boolean exact = true;
        for (Object value: values) {
            if (exact && value instanceof Long) {
                try {
                    result = Math.addExact((Long) result, (Long) value);
                    continue;
                } catch (ArithmeticException e) {
                    exact = false;
                }
            }
            exact = false;
            result = Values.toDecimal(result).add(Values.toDecimal(value));
        }
        return result;
    }

    @Nullable
    static Object compute(AggregateStep.Statistic statistic, List<Object> column, int rows) {
        if (statistic == AggregateStep.Statistic.COUNT)
            return (long) rows;
        List<Object> present = new ArrayList<>();
        for (Object value: column)
            if (value != null)
                present.add(value);
        if (statistic == AggregateStep.Statistic.N)
            return (long) present.size();
        if (present.isEmpty())
            return null;
        switch (statistic) {
            case SUM:
                return sum(present);
            case MEAN:
                return Values.toDecimal(sum(present))
                        .divide(BigDecimal.valueOf(present.size()), MathContext.DECIMAL128);
            case MIN:
                return present.stream().min(Values.COMPARATOR).orElse(null);
            case MAX:
                return present.stream().max(Values.COMPARATOR).orElse(null);
            default:
                throw new IllegalStateException("Unexpected statistic " + statistic);
        }
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        Schema schema = required(output);
        Table input = inputs.get(0);
        List<Integer> keys = input.columnIndexes(this.step.groupBy);
        TreeMap<List<Object>, List<Row>> groups = new TreeMap<>(Values.KEY_COMPARATOR);
        for (Row row: input.getRows())
            groups.computeIfAbsent(input.key(row, keys), k -> new ArrayList<>()).add(row);

        List<Row> result = new ArrayList<>(groups.size());
        for (Map.Entry<List<Object>, List<Row>> group: groups.entrySet()) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (int i = 0; i < this.step.groupBy.size(); i++)
                values.put(this.step.groupBy.get(i), group.getKey().get(i));
            for (AggregateStep.Metric metric: this.step.metrics) {
                int index = input.columnIndex(metric.column);
                List<Object> column = new ArrayList<>();
                for (Row row: group.getValue())
                    column.add(row.get(index));
                values.put(metric.name, compute(metric.statistic, column, group.getValue().size()));
            }
            result.add(Table.makeRow(schema, values));
        }
        this.counters.put("groups", groups.size());
        return new Table(schema, result);
    }
}
