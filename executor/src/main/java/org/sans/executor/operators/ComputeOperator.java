package org.sans.executor.operators;

import org.sans.compiler.ir.step.ComputeStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Row;
import org.sans.executor.Table;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Evaluates the assignments left to right; later ones see the results of earlier ones. */
public class ComputeOperator extends BaseOperator<ComputeStep> {
    public ComputeOperator(ComputeStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        Schema schema = required(output);
        Table input = inputs.get(0);
        List<Row> result = new ArrayList<>(input.size());
        for (Row row: input.getRows()) {
            Map<String, Object> values = input.asMap(row);
            ExpressionEvaluator.IRowScope scope = ExpressionEvaluator.of(values);
            for (ComputeStep.Assignment assignment: this.step.assignments)
                values.put(assignment.column, this.evaluator.evaluate(assignment.expression, scope));
            result.add(Table.makeRow(schema, values));
        }
        return new Table(schema, result);
    }
}
