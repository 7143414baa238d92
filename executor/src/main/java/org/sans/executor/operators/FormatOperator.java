package org.sans.executor.operators;

import org.sans.compiler.ir.step.FormatStep;
import org.sans.compiler.ir.type.Schema;
import org.sans.executor.ExpressionEvaluator;
import org.sans.executor.Row;
import org.sans.executor.Table;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Declares a format for later lookups; its table lists the explicit entries. */
public class FormatOperator extends BaseOperator<FormatStep> {
    public FormatOperator(FormatStep step, ExpressionEvaluator evaluator) {
        super(step, evaluator);
    }

    @Override
    public Table apply(List<Table> inputs, @Nullable Schema output) {
        this.evaluator.define(this.step);
        List<Row> rows = new ArrayList<>();
        for (Map.Entry<String, String> entry: this.step.map.entrySet())
            rows.add(new Row(entry.getKey(), entry.getValue()));
        this.counters.put("entries", this.step.map.size());
        this.counters.put("total", this.step.isTotal());
        return new Table(required(output), rows);
    }
}
