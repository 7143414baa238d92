package org.sans.executor.operators;

import org.sans.compiler.ir.step.SortStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Row;
import org.sans.executor.Table;
import org.sans.executor.Values;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Stable ascending sort; missing values sort first.
 * With nodupkey only the first row of each key, in sorted order, is kept.
 */
public class SortOperator extends BaseOperator<SortStep> {
    public SortOperator(SortStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        Table input = inputs.get(0);
        List<Integer> keys = input.columnIndexes(this.step.keyNames());
        List<Row> sorted = new ArrayList<>(input.getRows());
        // List.sort is stable.
        sorted.sort((left, right) -> Values.compareKeys(input.key(left, keys), input.key(right, keys)));
        if (!this.step.nodupkey)
            return new Table(input.schema, sorted);

        List<Row> result = new ArrayList<>();
        List<Object> previous = null;
        for (Row row: sorted) {
            List<Object> key = input.key(row, keys);
            if (previous != null && Values.compareKeys(previous, key) == 0)
                continue;
            result.add(row);
            previous = key;
        }
        this.counters.put("duplicates_dropped", sorted.size() - result.size());
        this.getDebugStream(2)
                .append("nodupkey dropped ")
                .append(sorted.size() - result.size())
                .append(" rows")
                .newline();
        return new Table(input.schema, result);
    }
}
