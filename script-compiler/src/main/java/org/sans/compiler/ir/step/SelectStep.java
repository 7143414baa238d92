package org.sans.compiler.ir.step;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.sans.compiler.errors.SourcePositionRange;

import java.util.Collections;
import java.util.List;

/** Projection: either keep a list of columns (in that order) or drop a list of columns.
 * Exactly one of the lists is non-empty. */
public final class SelectStep extends OpStep {
    public final List<String> keep;
    public final List<String> drop;

    public SelectStep(SourcePositionRange range, String input, String output,
                      List<String> keep, List<String> drop) {
        super(range, List.of(input), List.of(output));
        this.keep = Collections.unmodifiableList(keep);
        this.drop = Collections.unmodifiableList(drop);
    }

    @Override
    public OpKind getKind() {
        return OpKind.SELECT;
    }

    @Override
    public ObjectNode paramsToJson() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.set("keep", stringArray(this.keep));
        result.set("drop", stringArray(this.drop));
        return result;
    }

    @Override
    public <T> T accept(StepVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public OpStep withOutputs(List<String> outputs) {
        return new SelectStep(this.range, this.getInput(), outputs.get(0), this.keep, this.drop);
    }
}
