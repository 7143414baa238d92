package org.sans.executor.operators;

import org.sans.compiler.ir.step.IdentityStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Table;

import javax.annotation.Nullable;
import java.util.List;

public class IdentityOperator extends BaseOperator<IdentityStep> {
    public IdentityOperator(IdentityStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        return inputs.get(0);
    }
}
