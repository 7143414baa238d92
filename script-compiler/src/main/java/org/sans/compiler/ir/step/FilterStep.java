package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;
import org.sans.compiler.ir.expression.Expression;

import java.util.List;

/** Keeps the rows where the predicate is true. */
public final class FilterStep extends OpStep {
    public final Expression predicate;

    public FilterStep(SourcePositionRange range, String input, String output, Expression predicate) {
        super(range, List.of(input), List.of(output));
        this.predicate = predicate;
    }

    @Override
    public OpKind getKind() {
        return OpKind.FILTER;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.set("predicate", this.predicate.toJson());
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new FilterStep(this.range, this.getInput(), outputs.get(0), this.predicate);
    }
}
