package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;

import java.util.List;

/** Copies its input unchanged. */
public final class IdentityStep extends OpStep {
    public IdentityStep(SourcePositionRange range, String input, String output) {
        super(range, List.of(input), List.of(output));
    }

    @Override
    public OpKind getKind() {
        return OpKind.IDENTITY;
    }

    @Override
    public ObjectNode paramsToJson() {
        return JsonNodeFactory.instance.objectNode();
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new IdentityStep(this.range, this.getInput(), outputs.get(0));
    }
}
