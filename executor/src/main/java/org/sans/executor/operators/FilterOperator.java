package org.sans.executor.operators;

import org.sans.compiler.ir.step.FilterStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Row;
import org.sans.executor.Table;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Keeps the rows where the predicate is true; false and missing drop the row. */
public class FilterOperator extends BaseOperator<FilterStep> {
    public FilterOperator(FilterStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        Table input = inputs.get(0);
        List<Row> result = new ArrayList<>();
        for (Row row: input.getRows()) {
            if (this.evaluator.test(this.step.predicate, ExpressionEvaluator.of(input.asMap(row))))
                result.add(row);
        }
        this.counters.put("rows_dropped", input.size() - result.size());
        return new Table(input.schema, result);
    }
}
