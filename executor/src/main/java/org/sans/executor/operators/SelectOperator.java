package org.sans.executor.operators;

import org.sans.compiler.ir.step.SelectStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Row;
import org.sans.executor.Table;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Keeps or drops columns. */
public class SelectOperator extends BaseOperator<SelectStep> {
    public SelectOperator(SelectStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        Schema schema = required(output);
        Table input = inputs.get(0);
        List<Integer> indexes = input.columnIndexes(schema.names());
        List<Row> result = new ArrayList<>(input.size());
        for (Row row: input.getRows())
            result.add(new Row(input.key(row, indexes)));
        return new Table(schema, result);
    }
}
