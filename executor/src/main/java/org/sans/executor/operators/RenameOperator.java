package org.sans.executor.operators;

import org.sans.compiler.ir.step.RenameStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Table;

import javax.annotation.Nullable;
import java.util.List;

/** Renaming keeps column positions, so the rows are shared with the input. */
public class RenameOperator extends BaseOperator<RenameStep> {
    public RenameOperator(RenameStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        Table input = inputs.get(0);
        return new Table(input.schema.rename(this.step.map), input.getRows());
    }
}
